package com.phillippitts.transcribe.exception;

/**
 * Thrown when a streamed upload crosses the configured byte ceiling.
 * The partially written temp file has already been removed when this is raised.
 */
public class FileTooLargeException extends TranscribeException {

    private static final long BYTES_PER_MB = 1024L * 1024L;

    private final long maxBytes;

    public FileTooLargeException(long maxBytes) {
        super("File too large. Maximum size: " + (maxBytes / BYTES_PER_MB) + "MB");
        this.maxBytes = maxBytes;
    }

    public long getMaxBytes() {
        return maxBytes;
    }
}
