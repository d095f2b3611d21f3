package com.phillippitts.transcribe.service.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class TranscriptionMetricsTest {

    private SimpleMeterRegistry registry;
    private TranscriptionMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new TranscriptionMetrics(registry);
    }

    @Test
    void recordsLatencyPerEngine() {
        metrics.recordLatency("whisper.cpp", TimeUnit.MILLISECONDS.toNanos(1500));
        metrics.recordLatency("whisper.cpp", TimeUnit.MILLISECONDS.toNanos(500));

        var timer = registry.get("transcribe.latency").tag("engine", "whisper.cpp").timer();
        assertThat(timer.count()).isEqualTo(2);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(2000.0);
    }

    @Test
    void countsSuccessAndFailuresByReason() {
        metrics.incrementSuccess();
        metrics.incrementFailure("file_too_large");
        metrics.incrementFailure("file_too_large");
        metrics.incrementFailure("inference_error");

        assertThat(registry.get("transcribe.success").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("transcribe.failure").tag("reason", "file_too_large").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get("transcribe.failure").tag("reason", "inference_error").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void tracksUploadSizesAndCleanupWarnings() {
        assertThat(registry.get("transcribe.cleanup.warnings").counter().count()).isZero();

        metrics.recordUploadSize(1024);
        metrics.recordUploadSize(3072);
        metrics.recordCleanupWarning();

        var summary = registry.get("transcribe.upload.size").summary();
        assertThat(summary.count()).isEqualTo(2);
        assertThat(summary.totalAmount()).isEqualTo(4096.0);
        assertThat(registry.get("transcribe.cleanup.warnings").counter().count()).isEqualTo(1.0);
    }
}
