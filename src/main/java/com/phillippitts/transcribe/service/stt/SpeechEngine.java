package com.phillippitts.transcribe.service.stt;

import com.phillippitts.transcribe.domain.EffectiveParams;
import com.phillippitts.transcribe.exception.InferenceException;

import java.nio.file.Path;

/**
 * Contract for a loaded speech-recognition engine.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>Built once by a {@link SpeechEngineFactory} (may throw
 *       {@link com.phillippitts.transcribe.exception.ModelNotFoundException})</li>
 *   <li>{@link #transcribe(Path, EffectiveParams)} decodes audio files (may throw {@link InferenceException})</li>
 *   <li>{@link #close()} releases resources at shutdown</li>
 * </ol>
 *
 * <p>Thread Safety: implementations are not assumed to be reentrant. Callers serialize
 * access unless configured otherwise.
 */
public interface SpeechEngine extends AutoCloseable {

    /**
     * Decodes the given audio file.
     *
     * <p>The returned segment iterator is single-pass; callers consume it exactly once.
     *
     * @param audioFile file in any container the engine accepts
     * @param params resolved decoding parameters
     * @return lazily produced segments plus the detected language
     * @throws InferenceException if decoding fails (timeout, engine error, unreadable output)
     */
    EngineTranscription transcribe(Path audioFile, EffectiveParams params);

    /**
     * Returns the name of this engine for logging and monitoring.
     *
     * @return Engine name (e.g., "whisper.cpp")
     */
    String getEngineName();

    /**
     * Releases all resources held by this engine. Must be idempotent.
     */
    @Override
    void close();
}
