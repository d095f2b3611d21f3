package com.phillippitts.transcribe.exception;

import java.time.Duration;

/**
 * Thrown when a request cannot obtain a ready speech engine.
 *
 * <p>The {@link Reason} separates a model that is still warming up (retry later) from one
 * that failed to load and will stay broken until an operator intervenes.
 */
public class ModelUnavailableException extends TranscribeException {

    public enum Reason {
        /** Model still loading when the bounded wait elapsed. */
        LOADING_TIMEOUT,
        /** Model construction failed; terminal for the process. */
        LOAD_FAILED,
        /** Engine ready but all inference permits stayed taken for the whole wait. */
        BUSY,
        /** The waiting thread was interrupted. */
        INTERRUPTED
    }

    private final Reason reason;
    private final Duration retryAfter;

    public ModelUnavailableException(Reason reason, String message, Duration retryAfter) {
        super(message);
        this.reason = reason;
        this.retryAfter = retryAfter;
    }

    public ModelUnavailableException(Reason reason, String message, Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.retryAfter = retryAfter;
    }

    public static ModelUnavailableException loadingTimeout(Duration waited) {
        return new ModelUnavailableException(Reason.LOADING_TIMEOUT,
                "Speech model still loading after " + waited.toSeconds() + "s wait", waited);
    }

    public static ModelUnavailableException loadFailed(String failureMessage) {
        return new ModelUnavailableException(Reason.LOAD_FAILED,
                "Speech model failed to load: " + failureMessage, null);
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * Suggested client back-off, or {@code null} when retrying will not help.
     */
    public Duration getRetryAfter() {
        return retryAfter;
    }
}
