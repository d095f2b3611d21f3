package com.phillippitts.transcribe.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Decoding defaults and request-level timing for transcription.
 * Binds to properties prefixed with "transcription".
 *
 * <p>Request parameters left unset by the client are resolved against these defaults
 * at invocation time.
 *
 * @param defaultLanguage Language hint used when the request carries none
 * @param defaultTemperature Sampling temperature used when the request carries none
 * @param defaultBeamSize Beam width used when the request carries none
 * @param vadFilter Whether voice-activity detection runs before decoding
 * @param readyTimeout Maximum time a request waits for the model to finish loading
 * @param maxConcurrentInferences Number of inferences allowed to run at once (1 serializes them)
 * @param inferenceAcquireTimeout Maximum time a request waits for an inference slot
 */
@ConfigurationProperties(prefix = "transcription")
@Validated
public record TranscriptionProperties(
        @DefaultValue("it")
        @NotBlank(message = "Default language must not be blank")
        String defaultLanguage,

        @DefaultValue("0.0")
        @DecimalMin(value = "0.0", message = "Default temperature must be >= 0")
        @DecimalMax(value = "1.0", message = "Default temperature must be <= 1")
        double defaultTemperature,

        @DefaultValue("5")
        @Min(value = 1, message = "Default beam size must be >= 1")
        @Max(value = 10, message = "Default beam size must be <= 10")
        int defaultBeamSize,

        @DefaultValue("true")
        boolean vadFilter,

        @DefaultValue("120s")
        @NotNull
        Duration readyTimeout,

        @DefaultValue("1")
        @Positive(message = "Max concurrent inferences must be positive")
        int maxConcurrentInferences,

        @DefaultValue("10m")
        @NotNull
        Duration inferenceAcquireTimeout
) {
    public static TranscriptionProperties defaults() {
        return new TranscriptionProperties("it", 0.0, 5, true, Duration.ofSeconds(120), 1, Duration.ofMinutes(10));
    }
}
