package com.phillippitts.transcribe.service.transcription;

import com.phillippitts.transcribe.config.properties.TranscriptionProperties;
import com.phillippitts.transcribe.domain.EffectiveParams;
import com.phillippitts.transcribe.domain.TranscriptionSegment;
import com.phillippitts.transcribe.exception.InferenceException;
import com.phillippitts.transcribe.exception.InferenceExceptionBuilder;
import com.phillippitts.transcribe.service.metrics.TranscriptionMetrics;
import com.phillippitts.transcribe.service.stt.EngineSegment;
import com.phillippitts.transcribe.service.stt.EngineTranscription;
import com.phillippitts.transcribe.service.stt.SpeechEngine;
import com.phillippitts.transcribe.service.stt.util.ConcurrencyGuard;
import com.phillippitts.transcribe.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.StringJoiner;

/**
 * Runs the speech engine on one staged file and assembles its output.
 *
 * <p>Engine access goes through a {@link ConcurrencyGuard}; with the default of one
 * permit every inference is serialized. The engine's segment sequence is consumed exactly
 * once, inside the guarded section, so a lazily decoding engine never runs unguarded.
 *
 * <p><b>Privacy:</b> transcript text is never logged; only lengths and counts.
 */
@Service
public class TranscriptionInvoker {

    private static final Logger LOG = LogManager.getLogger(TranscriptionInvoker.class);

    private final ConcurrencyGuard guard;
    private final TranscriptionMetrics metrics;

    public TranscriptionInvoker(TranscriptionProperties props, TranscriptionMetrics metrics) {
        this.guard = new ConcurrencyGuard(props.maxConcurrentInferences(), props.inferenceAcquireTimeout(),
                "speech engine");
        this.metrics = metrics;
    }

    /**
     * Transcribes the file.
     *
     * @param engine ready engine borrowed from the lifecycle manager
     * @param audioFile staged upload
     * @param params resolved parameters
     * @return joined text, language and optional segments
     * @throws InferenceException if the engine fails
     * @throws com.phillippitts.transcribe.exception.ModelUnavailableException (BUSY) if no
     *         inference slot frees up in time
     */
    public InvocationOutput run(SpeechEngine engine, Path audioFile, EffectiveParams params) {
        guard.acquire();
        try {
            long start = System.nanoTime();
            InvocationOutput output = consume(engine, audioFile, params, start);
            metrics.recordLatency(engine.getEngineName(), System.nanoTime() - start);
            LOG.info("Transcription completed in {}s (language={}, chars={}, segments={})",
                    output.durationSeconds(), output.language(), output.text().length(),
                    output.segments() == null ? "-" : output.segments().size());
            return output;
        } finally {
            guard.release();
        }
    }

    private InvocationOutput consume(SpeechEngine engine, Path audioFile, EffectiveParams params, long start) {
        StringJoiner text = new StringJoiner(" ");
        List<TranscriptionSegment> segments = params.includeSegments() ? new ArrayList<>() : null;
        String detected;
        try {
            EngineTranscription transcription = engine.transcribe(audioFile, params);
            Iterator<EngineSegment> it = transcription.segments();
            while (it.hasNext()) {
                EngineSegment segment = it.next();
                String trimmed = segment.text() == null ? "" : segment.text().trim();
                text.add(trimmed);
                if (segments != null) {
                    segments.add(new TranscriptionSegment(segment.id(), segment.start(), segment.end(), trimmed));
                }
            }
            detected = transcription.language();
        } catch (InferenceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw InferenceExceptionBuilder.create("Engine failed while producing segments")
                    .engine(engine.getEngineName())
                    .cause(e)
                    .metadata("error", e.getMessage())
                    .build();
        }
        String language = detected == null || detected.isBlank() ? params.language() : detected;
        return new InvocationOutput(text.toString(), language, segments, TimeUtils.elapsedSeconds(start));
    }
}
