package com.phillippitts.transcribe.service.stt.whisper;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Validated absolute locations of the files a whisper.cpp invocation needs.
 *
 * @param binary   whisper.cpp CLI executable
 * @param model    GGML model file
 * @param vadModel Silero VAD model, or {@code null} when VAD is unavailable
 */
record WhisperModelFiles(Path binary, Path model, Path vadModel) {

    WhisperModelFiles {
        Objects.requireNonNull(binary, "binary");
        Objects.requireNonNull(model, "model");
    }

    boolean vadAvailable() {
        return vadModel != null;
    }
}
