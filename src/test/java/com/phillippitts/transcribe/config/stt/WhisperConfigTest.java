package com.phillippitts.transcribe.config.stt;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class WhisperConfigTest {

    private static ValidatorFactory factory;
    private static Validator validator;

    @BeforeAll
    static void setUp() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void tearDown() {
        factory.close();
    }

    @Test
    void defaultsAreValid() {
        WhisperConfig cfg = WhisperConfig.defaults();

        assertThat(validator.validate(cfg)).isEmpty();
        assertThat(cfg.hasExplicitModelPath()).isFalse();
        assertThat(cfg.hasVadModel()).isFalse();
        assertThat(cfg.cpuOnly()).isFalse();
    }

    @Test
    void rejectsUnknownComputeType() {
        WhisperConfig cfg = new WhisperConfig("whisper-cli", "models", "large", "", "cuda", "bfloat16",
                4, 600, 1048576, "");

        Set<ConstraintViolation<WhisperConfig>> violations = validator.validate(cfg);

        assertThat(violations).extracting(v -> v.getPropertyPath().toString()).containsExactly("computeType");
    }

    @Test
    void rejectsNonPositiveLimits() {
        WhisperConfig cfg = new WhisperConfig("whisper-cli", "models", "large", "", "cuda", "float16",
                0, -1, 1048576, "");

        assertThat(validator.validate(cfg)).extracting(v -> v.getPropertyPath().toString())
                .containsExactlyInAnyOrder("threads", "timeoutSeconds");
    }

    @Test
    void cpuDeviceIsCaseInsensitive() {
        WhisperConfig cfg = new WhisperConfig("whisper-cli", "models", "small", "/m.bin", "CPU", "int8",
                4, 600, 1048576, "/vad.bin");

        assertThat(cfg.cpuOnly()).isTrue();
        assertThat(cfg.hasExplicitModelPath()).isTrue();
        assertThat(cfg.hasVadModel()).isTrue();
    }
}
