package com.phillippitts.transcribe.service.orchestration;

import com.phillippitts.transcribe.config.properties.TranscriptionProperties;
import com.phillippitts.transcribe.config.properties.UploadProperties;
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
import com.phillippitts.transcribe.service.stt.EngineSegment;
import com.phillippitts.transcribe.service.stt.EngineTranscription;
import com.phillippitts.transcribe.service.stt.SpeechEngine;
import com.phillippitts.transcribe.service.transcription.ParameterResolver;
import com.phillippitts.transcribe.service.transcription.TranscriptionInvoker;
import com.phillippitts.transcribe.service.upload.UploadIngestionService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.mockito.Mockito.doReturn;

class DefaultTranscriptionOrchestratorTest {

    private static final Duration READY_TIMEOUT = Duration.ofSeconds(3);

    @TempDir
    Path tempDir;

    private SimpleMeterRegistry registry;
    private UploadIngestionService ingestion;
    private ModelLifecycleManager lifecycle;
    private SpeechEngine engine;
    private DefaultTranscriptionOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        TranscriptionMetrics metrics = new TranscriptionMetrics(registry);
        TranscriptionProperties props = new TranscriptionProperties("it", 0.0, 5, true, READY_TIMEOUT, 1,
                Duration.ofSeconds(5));
        ingestion = spy(new UploadIngestionService(new UploadProperties(1, List.of("mp3", "wav"),
                tempDir.toString(), 8192)));
        lifecycle = mock(ModelLifecycleManager.class);
        engine = mock(SpeechEngine.class);
        when(engine.getEngineName()).thenReturn("fake");
        when(lifecycle.waitUntilReady(any())).thenReturn(engine);
        orchestrator = new DefaultTranscriptionOrchestrator(ingestion, new ParameterResolver(props), lifecycle,
                new TranscriptionInvoker(props, metrics), props, metrics);
    }

    private List<Path> residualFiles() throws IOException {
        try (Stream<Path> files = Files.list(tempDir)) {
            return files.toList();
        }
    }

    private static InputStream body(int size) {
        return new ByteArrayInputStream(new byte[size]);
    }

    private double failures(String reason) {
        var counter = registry.find("transcribe.failure").tag("reason", reason).counter();
        return counter == null ? 0.0 : counter.count();
    }

    @Test
    void successfulRequestReturnsResultAndDeletesTempFile() throws IOException {
        AtomicReference<Path> seen = new AtomicReference<>();
        when(engine.transcribe(any(), any())).thenAnswer(inv -> {
            Path audio = inv.getArgument(0);
            assertThat(audio).exists();
            seen.set(audio);
            return new EngineTranscription(List.of(
                    new EngineSegment(0, 0.0, 1.0, " Buongiorno "),
                    new EngineSegment(1, 1.0, 2.0, "a tutti.")).iterator(), null);
        });

        TranscriptionResult result = orchestrator.handle(body(2048), "visit.mp3",
                new TranscriptionParams(null, null, null, null, true));

        assertThat(result.text()).isEqualTo("Buongiorno a tutti.");
        assertThat(result.language()).isEqualTo("it");
        assertThat(result.segments()).hasSize(2);
        assertThat(seen.get()).doesNotExist();
        assertThat(residualFiles()).isEmpty();
        assertThat(registry.get("transcribe.success").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("transcribe.upload.size").summary().totalAmount()).isEqualTo(2048.0);
        verify(lifecycle).waitUntilReady(READY_TIMEOUT);
    }

    @Test
    void segmentsOmittedUnlessRequested() {
        when(engine.transcribe(any(), any())).thenReturn(new EngineTranscription(
                List.of(new EngineSegment(0, 0.0, 1.0, "hi")).iterator(), "en"));

        TranscriptionResult result = orchestrator.handle(body(10), "a.wav", TranscriptionParams.defaults());

        assertThat(result.hasSegments()).isFalse();
        assertThat(result.language()).isEqualTo("en");
    }

    @Test
    void unsupportedFormatNeverTouchesModelOrDisk() throws IOException {
        assertThatThrownBy(() -> orchestrator.handle(body(10), "notes.txt", TranscriptionParams.defaults()))
                .isInstanceOf(UnsupportedFormatException.class);

        verify(lifecycle, never()).waitUntilReady(any());
        assertThat(residualFiles()).isEmpty();
        assertThat(failures("unsupported_format")).isEqualTo(1.0);
    }

    @Test
    void oversizedUploadLeavesNothingBehind() throws IOException {
        assertThatThrownBy(() -> orchestrator.handle(body(1024 * 1024 + 1), "a.wav", TranscriptionParams.defaults()))
                .isInstanceOf(FileTooLargeException.class);

        verify(lifecycle, never()).waitUntilReady(any());
        assertThat(residualFiles()).isEmpty();
        assertThat(failures("file_too_large")).isEqualTo(1.0);
    }

    @Test
    void modelUnavailableStillDeletesTempFile() throws IOException {
        when(lifecycle.waitUntilReady(any())).thenThrow(ModelUnavailableException.loadingTimeout(READY_TIMEOUT));

        assertThatThrownBy(() -> orchestrator.handle(body(10), "a.wav", TranscriptionParams.defaults()))
                .isInstanceOf(ModelUnavailableException.class);

        assertThat(residualFiles()).isEmpty();
        assertThat(failures("model_unavailable_loading_timeout")).isEqualTo(1.0);
    }

    @Test
    void inferenceFailureStillDeletesTempFile() throws IOException {
        when(engine.transcribe(any(), any())).thenThrow(new InferenceException("Non-zero exit: 2", "fake"));

        assertThatThrownBy(() -> orchestrator.handle(body(10), "a.wav", TranscriptionParams.defaults()))
                .isInstanceOf(InferenceException.class);

        assertThat(residualFiles()).isEmpty();
        assertThat(failures("inference_error")).isEqualTo(1.0);
    }

    @Test
    void failedCleanupIsCountedButDoesNotFailTheRequest() {
        when(engine.transcribe(any(), any())).thenReturn(new EngineTranscription(
                List.<EngineSegment>of().iterator(), "it"));
        doReturn(false).when(ingestion).discard(any());

        TranscriptionResult result = orchestrator.handle(body(10), "a.wav", TranscriptionParams.defaults());

        assertThat(result.text()).isEmpty();
        assertThat(registry.get("transcribe.cleanup.warnings").counter().count()).isEqualTo(1.0);
        ArgumentCaptor<TempArtifact> captor = ArgumentCaptor.forClass(TempArtifact.class);
        verify(ingestion).discard(captor.capture());
        assertThat(captor.getValue().byteSize()).isEqualTo(10);
    }

    @Test
    void failureKindsAreStable() {
        assertThat(DefaultTranscriptionOrchestrator.failureKind(new StorageException("x", null)))
                .isEqualTo("storage_error");
        assertThat(DefaultTranscriptionOrchestrator.failureKind(ModelUnavailableException.loadFailed("x")))
                .isEqualTo("model_unavailable_load_failed");
        assertThat(DefaultTranscriptionOrchestrator.failureKind(new IllegalStateException()))
                .isEqualTo("unexpected");
    }
}
