package com.phillippitts.transcribe.service.stt.whisper;

/**
 * Constants for whisper.cpp process management and output handling.
 *
 * <ul>
 *   <li><b>STDERR_MAX_BYTES (256KB):</b> enough for whisper.cpp model-load logs and errors</li>
 *   <li><b>ERROR_SNIPPET_MAX_CHARS (2KB):</b> stderr excerpt attached to exception messages</li>
 * </ul>
 *
 * @see WhisperProcessManager
 * @since 1.0
 */
final class WhisperConstants {

    /**
     * Engine name reported in logs, metrics and exceptions.
     */
    static final String ENGINE_NAME = "whisper.cpp";

    /**
     * Maximum bytes to capture from stderr per transcription.
     */
    static final int STDERR_MAX_BYTES = 256 * 1024; // 256KB

    /**
     * Maximum characters to include in error message snippets.
     */
    static final int ERROR_SNIPPET_MAX_CHARS = 2048;

    /**
     * Suffix appended to the output base by {@code -oj}.
     */
    static final String JSON_SUFFIX = ".json";

    /**
     * Suffix of the output base derived from the audio file name.
     */
    static final String OUTPUT_BASE_SUFFIX = ".whisper";

    private WhisperConstants() {
        // Utility class - prevent instantiation
    }
}
