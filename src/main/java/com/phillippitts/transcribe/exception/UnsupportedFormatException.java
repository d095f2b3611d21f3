package com.phillippitts.transcribe.exception;

import java.util.List;

/**
 * Thrown when an upload has no filename or its extension is not in the allowed-format set.
 * Always raised before any byte of the upload is read.
 */
public class UnsupportedFormatException extends TranscribeException {

    private final String extension;
    private final List<String> allowedFormats;

    public UnsupportedFormatException(String reason, List<String> allowedFormats) {
        super(reason);
        this.extension = "";
        this.allowedFormats = List.copyOf(allowedFormats);
    }

    public UnsupportedFormatException(String extension, String reason, List<String> allowedFormats) {
        super(reason);
        this.extension = extension;
        this.allowedFormats = List.copyOf(allowedFormats);
    }

    public static UnsupportedFormatException forExtension(String extension, List<String> allowedFormats) {
        return new UnsupportedFormatException(extension,
                "Unsupported audio format: " + extension + ". Allowed formats: "
                        + String.join(", ", allowedFormats),
                allowedFormats);
    }

    public String getExtension() {
        return extension;
    }

    public List<String> getAllowedFormats() {
        return allowedFormats;
    }
}
