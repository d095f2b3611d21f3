package com.phillippitts.transcribe.service.orchestration;

import com.phillippitts.transcribe.config.properties.TranscriptionProperties;
import com.phillippitts.transcribe.domain.EffectiveParams;
import com.phillippitts.transcribe.domain.TempArtifact;
import com.phillippitts.transcribe.domain.TranscriptionParams;
import com.phillippitts.transcribe.domain.TranscriptionResult;
import com.phillippitts.transcribe.exception.FileTooLargeException;
import com.phillippitts.transcribe.exception.InferenceException;
import com.phillippitts.transcribe.exception.ModelUnavailableException;
import com.phillippitts.transcribe.exception.StorageException;
import com.phillippitts.transcribe.exception.UnsupportedFormatException;
import com.phillippitts.transcribe.service.metrics.TranscriptionMetrics;
import com.phillippitts.transcribe.service.model.ModelLifecycleManager;
import com.phillippitts.transcribe.service.stt.SpeechEngine;
import com.phillippitts.transcribe.service.transcription.InvocationOutput;
import com.phillippitts.transcribe.service.transcription.ParameterResolver;
import com.phillippitts.transcribe.service.transcription.TranscriptionInvoker;
import com.phillippitts.transcribe.service.upload.UploadIngestionService;
import com.phillippitts.transcribe.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.InputStream;
import java.util.Locale;
import java.util.Objects;

/**
 * Default implementation of {@link TranscriptionOrchestrator}.
 *
 * <p>The temp artifact is owned by a single {@code try/finally}: once ingestion returns,
 * nothing can leave this method without {@link UploadIngestionService#discard} having run.
 * Ingestion itself deletes partial files on failure, so no exit path leaves a file behind.
 *
 * @since 1.0
 */
public class DefaultTranscriptionOrchestrator implements TranscriptionOrchestrator {

    private static final Logger LOG = LogManager.getLogger(DefaultTranscriptionOrchestrator.class);

    private final UploadIngestionService ingestion;
    private final ParameterResolver resolver;
    private final ModelLifecycleManager lifecycle;
    private final TranscriptionInvoker invoker;
    private final TranscriptionProperties props;
    private final TranscriptionMetrics metrics;

    /**
     * Constructs a DefaultTranscriptionOrchestrator.
     *
     * @throws NullPointerException if any parameter is null
     */
    public DefaultTranscriptionOrchestrator(UploadIngestionService ingestion,
                                            ParameterResolver resolver,
                                            ModelLifecycleManager lifecycle,
                                            TranscriptionInvoker invoker,
                                            TranscriptionProperties props,
                                            TranscriptionMetrics metrics) {
        this.ingestion = Objects.requireNonNull(ingestion, "ingestion must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle must not be null");
        this.invoker = Objects.requireNonNull(invoker, "invoker must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    @Override
    public TranscriptionResult handle(InputStream source, String filename, TranscriptionParams params) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(params, "params must not be null");

        TempArtifact artifact = null;
        try {
            ingestion.checkFormat(filename);
            artifact = ingestion.ingest(source, filename);
            metrics.recordUploadSize(artifact.byteSize());
            LOG.info("Upload '{}' accepted ({} bytes)", LogSanitizer.filename(filename), artifact.byteSize());

            EffectiveParams effective = resolver.resolve(params);
            SpeechEngine engine = lifecycle.waitUntilReady(props.readyTimeout());
            InvocationOutput output = invoker.run(engine, artifact.path(), effective);

            TranscriptionResult result = new TranscriptionResult(output.text(), output.language(),
                    output.durationSeconds(), output.segments());
            metrics.incrementSuccess();
            return result;
        } catch (RuntimeException e) {
            metrics.incrementFailure(failureKind(e));
            throw e;
        } finally {
            if (artifact != null && !ingestion.discard(artifact)) {
                metrics.recordCleanupWarning();
            }
        }
    }

    static String failureKind(RuntimeException e) {
        if (e instanceof UnsupportedFormatException) {
            return "unsupported_format";
        }
        if (e instanceof FileTooLargeException) {
            return "file_too_large";
        }
        if (e instanceof StorageException) {
            return "storage_error";
        }
        if (e instanceof ModelUnavailableException mu) {
            return "model_unavailable_" + mu.getReason().name().toLowerCase(Locale.ROOT);
        }
        if (e instanceof InferenceException) {
            return "inference_error";
        }
        return "unexpected";
    }
}
