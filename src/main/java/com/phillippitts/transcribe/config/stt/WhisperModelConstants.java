package com.phillippitts.transcribe.config.stt;

import java.util.List;

/**
 * Constants describing the whisper.cpp model files this service can load.
 *
 * @since 1.0
 */
public final class WhisperModelConstants {

    /**
     * Minimum plausible size of a GGML model file (20MB).
     * Smaller files are almost always truncated downloads.
     */
    public static final long MIN_MODEL_SIZE_BYTES = 20L * 1024 * 1024;

    /**
     * Model identifiers offered by {@code GET /api/v1/models}.
     */
    public static final List<String> AVAILABLE_MODELS = List.of("tiny", "base", "small", "medium", "large");

    /**
     * File name suffix of 8-bit quantized model files.
     */
    public static final String INT8_SUFFIX = "-q8_0";

    private WhisperModelConstants() {
        // Utility class - prevent instantiation
    }
}
