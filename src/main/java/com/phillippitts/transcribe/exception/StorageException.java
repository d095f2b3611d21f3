package com.phillippitts.transcribe.exception;

/**
 * Thrown when an upload cannot be written to transient storage.
 */
public class StorageException extends TranscribeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
