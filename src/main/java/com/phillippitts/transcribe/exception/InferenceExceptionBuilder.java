package com.phillippitts.transcribe.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link InferenceException} with diagnostic context.
 *
 * <p>The base message stays available as {@link InferenceException#getReason()}; exit code,
 * duration and metadata only go into the full exception message, which is logged but never
 * returned to clients.
 *
 * <pre>
 * throw InferenceExceptionBuilder.create("Non-zero exit: 1")
 *         .engine("whisper.cpp")
 *         .exitCode(1)
 *         .durationMs(1500)
 *         .metadata("modelPath", modelPath)
 *         .metadata("stderr", stderrSnippet)
 *         .build();
 * </pre>
 */
public final class InferenceExceptionBuilder {

    private final String message;
    private String engineName;
    private Throwable cause;
    private Integer exitCode;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private InferenceExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static InferenceExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new InferenceExceptionBuilder(message);
    }

    public InferenceExceptionBuilder engine(String engineName) {
        this.engineName = engineName;
        return this;
    }

    public InferenceExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public InferenceExceptionBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public InferenceExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata entry; null keys or values are ignored.
     */
    public InferenceExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. Message format:
     * <pre>
     * {message} (exitCode={code}, durationMs={ms}, {key1}={val1}, ...) (engine: {engine})
     * </pre>
     */
    public InferenceException build() {
        String engine = engineName != null ? engineName : "unknown";
        return new InferenceException(message, buildDetailedMessage(), engine, cause);
    }

    private String buildDetailedMessage() {
        boolean hasDetails = exitCode != null || durationMs != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;

        if (exitCode != null) {
            sb.append("exitCode=").append(exitCode);
            first = false;
        }
        if (durationMs != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("durationMs=").append(durationMs);
            first = false;
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
