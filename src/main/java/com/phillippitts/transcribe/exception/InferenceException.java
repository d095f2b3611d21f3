package com.phillippitts.transcribe.exception;

/**
 * Thrown when the speech engine fails while transcribing an artifact.
 * Never retried automatically; the caller decides whether to resubmit.
 *
 * <p>{@link #getReason()} holds the short engine message that is safe to show clients;
 * {@link #getMessage()} may carry diagnostics such as exit codes and stderr.
 */
public class InferenceException extends TranscribeException {

    private final String engineName;
    private final String reason;

    public InferenceException(String message, String engineName) {
        super(message + " (engine: " + engineName + ")");
        this.engineName = engineName;
        this.reason = message;
    }

    public InferenceException(String message, String engineName, Throwable cause) {
        super(message + " (engine: " + engineName + ")", cause);
        this.engineName = engineName;
        this.reason = message;
    }

    InferenceException(String reason, String detailedMessage, String engineName, Throwable cause) {
        super(detailedMessage + " (engine: " + engineName + ")", cause);
        this.engineName = engineName;
        this.reason = reason;
    }

    public String getEngineName() {
        return engineName;
    }

    public String getReason() {
        return reason;
    }
}
