package com.phillippitts.transcribe.config.stt;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the whisper.cpp engine.
 * Binds to properties prefixed with "stt.whisper".
 *
 * <p>Example application.properties:
 * <pre>
 * stt.whisper.binary-path=/opt/whisper.cpp/build/bin/whisper-cli
 * stt.whisper.models-dir=/opt/whisper.cpp/models
 * stt.whisper.model=large
 * stt.whisper.device=cuda
 * stt.whisper.compute-type=float16
 * stt.whisper.threads=4
 * stt.whisper.timeout-seconds=600
 * </pre>
 *
 * @param binaryPath Path to the whisper.cpp CLI executable
 * @param modelsDir Directory holding {@code ggml-*.bin} model files
 * @param model Model identifier (tiny, base, small, medium, large)
 * @param modelPath Explicit model file; when blank the path is derived from modelsDir, model and computeType
 * @param device Compute device ("cpu" disables GPU offload)
 * @param computeType Weight precision profile (float16, float32, int8)
 * @param threads Number of CPU threads per inference
 * @param timeoutSeconds Maximum wall-clock time of a single inference process
 * @param maxStdoutBytes Maximum stdout accumulation in bytes
 * @param vadModelPath Optional Silero VAD model used when VAD filtering is enabled
 */
@ConfigurationProperties(prefix = "stt.whisper")
@Validated
public record WhisperConfig(
        @DefaultValue("whisper-cli")
        @NotBlank(message = "Whisper binary path must not be blank")
        String binaryPath,

        @DefaultValue("models")
        @NotBlank(message = "Models directory must not be blank")
        String modelsDir,

        @DefaultValue("large")
        @NotBlank(message = "Model identifier must not be blank")
        String model,

        @DefaultValue("")
        String modelPath,

        @DefaultValue("cuda")
        @NotBlank(message = "Device must not be blank")
        String device,

        @DefaultValue("float16")
        @Pattern(regexp = "float16|float32|int8", message = "Compute type must be float16, float32 or int8")
        String computeType,

        @DefaultValue("4")
        @Positive(message = "Thread count must be positive")
        int threads,

        @DefaultValue("600")
        @Positive(message = "Timeout must be positive")
        int timeoutSeconds,

        @DefaultValue("1048576")
        @Positive(message = "Max stdout bytes must be positive")
        int maxStdoutBytes,

        @DefaultValue("")
        String vadModelPath
) {
    /**
     * Standard values, for tests and non-Spring callers.
     */
    public static WhisperConfig defaults() {
        return new WhisperConfig("whisper-cli", "models", "large", "", "cuda", "float16", 4, 600, 1048576, "");
    }

    /**
     * Returns true when an explicit model file was configured.
     */
    public boolean hasExplicitModelPath() {
        return modelPath != null && !modelPath.isBlank();
    }

    /**
     * Returns true when a VAD model file was configured.
     */
    public boolean hasVadModel() {
        return vadModelPath != null && !vadModelPath.isBlank();
    }

    /**
     * Returns true when inference must stay on the CPU.
     */
    public boolean cpuOnly() {
        return "cpu".equalsIgnoreCase(device);
    }
}
