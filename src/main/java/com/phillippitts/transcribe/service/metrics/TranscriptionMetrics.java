package com.phillippitts.transcribe.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for transcription requests.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Inference latency per engine</li>
 *   <li>Success/failure counts, failures tagged by kind</li>
 *   <li>Accepted upload sizes</li>
 *   <li>Temp files that could not be deleted</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class TranscriptionMetrics {

    static final String METRIC_PREFIX = "transcribe";

    private final MeterRegistry registry;
    private final Counter cleanupWarnings;
    private final DistributionSummary uploadSize;

    public TranscriptionMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.cleanupWarnings = Counter.builder(METRIC_PREFIX + ".cleanup.warnings")
                .description("Temp files that could not be deleted after a request")
                .register(registry);
        this.uploadSize = DistributionSummary.builder(METRIC_PREFIX + ".upload.size")
                .description("Size of accepted uploads")
                .baseUnit("bytes")
                .register(registry);
    }

    /**
     * Records inference latency for a specific engine.
     *
     * @param engineName name of the engine
     * @param durationNanos duration in nanoseconds
     */
    public void recordLatency(String engineName, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken by the speech engine to transcribe audio")
                .tag("engine", engineName)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Increments the success counter.
     */
    public void incrementSuccess() {
        Counter.builder(METRIC_PREFIX + ".success")
                .description("Number of successful transcriptions")
                .register(registry)
                .increment();
    }

    /**
     * Increments the failure counter.
     *
     * @param reason failure kind (unsupported_format, file_too_large, model_unavailable, ...)
     */
    public void incrementFailure(String reason) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of failed transcriptions")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordUploadSize(long bytes) {
        uploadSize.record(bytes);
    }

    public void recordCleanupWarning() {
        cleanupWarnings.increment();
    }
}
