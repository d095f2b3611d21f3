package com.phillippitts.transcribe.exception;

/**
 * Base exception for all transcription-service errors.
 * All domain exceptions extend this class so the HTTP boundary can translate them in one place.
 */
public class TranscribeException extends RuntimeException {

    public TranscribeException(String message) {
        super(message);
    }

    public TranscribeException(String message, Throwable cause) {
        super(message, cause);
    }
}
