package com.phillippitts.transcribe.service.stt.whisper;

import com.phillippitts.transcribe.domain.EffectiveParams;
import com.phillippitts.transcribe.exception.InferenceException;
import com.phillippitts.transcribe.exception.InferenceExceptionBuilder;
import com.phillippitts.transcribe.service.stt.EngineTranscription;
import com.phillippitts.transcribe.service.stt.SpeechEngine;
import com.phillippitts.transcribe.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.Objects;

/**
 * whisper.cpp implementation of {@link SpeechEngine}.
 *
 * <p>Each call spawns one {@code whisper-cli} process through {@link WhisperProcessManager},
 * then exposes the JSON side file as a lazily mapped segment sequence via
 * {@link WhisperJsonParser}.
 *
 * <p><b>Privacy:</b> Never logs transcript text. Only durations and sizes are logged.
 *
 * @see WhisperCppEngineFactory
 * @since 1.0
 */
final class WhisperCppEngine implements SpeechEngine {

    private static final Logger LOG = LogManager.getLogger(WhisperCppEngine.class);

    private final WhisperProcessManager manager;
    private final Object lock = new Object();
    private boolean closed = false;

    WhisperCppEngine(WhisperProcessManager manager) {
        this.manager = Objects.requireNonNull(manager, "manager");
    }

    @Override
    public EngineTranscription transcribe(Path audioFile, EffectiveParams params) {
        ensureOpen();
        long startTime = System.nanoTime();
        try {
            String json = manager.run(audioFile, params);
            EngineTranscription transcription = WhisperJsonParser.parse(json);
            LOG.debug("whisper.cpp decoded {} in {} ms (json={} chars, language={})",
                    audioFile.getFileName(), TimeUtils.elapsedMillis(startTime), json.length(),
                    transcription.language());
            return transcription;
        } catch (InferenceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw InferenceExceptionBuilder.create("Unexpected engine failure")
                    .engine(getEngineName())
                    .cause(e)
                    .metadata("error", e.getMessage())
                    .build();
        }
    }

    @Override
    public String getEngineName() {
        return WhisperConstants.ENGINE_NAME;
    }

    @Override
    public void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
        }
        LOG.info("whisper.cpp engine closed");
    }

    private void ensureOpen() {
        synchronized (lock) {
            if (closed) {
                throw new InferenceException(getEngineName() + " engine closed", getEngineName());
            }
        }
    }
}
