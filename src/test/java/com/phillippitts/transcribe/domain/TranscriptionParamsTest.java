package com.phillippitts.transcribe.domain;

import com.phillippitts.transcribe.exception.InvalidParameterException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TranscriptionParamsTest {

    @Test
    void acceptsBoundaryValues() {
        assertThatCode(() -> new TranscriptionParams("it", 0.0, 1, null, false)).doesNotThrowAnyException();
        assertThatCode(() -> new TranscriptionParams("it", 1.0, 10, null, true)).doesNotThrowAnyException();
    }

    @ParameterizedTest
    @ValueSource(doubles = {-0.1, 1.01, Double.NaN})
    void rejectsTemperatureOutOfRange(double temperature) {
        assertThatThrownBy(() -> new TranscriptionParams(null, temperature, null, null, false))
                .isInstanceOfSatisfying(InvalidParameterException.class,
                        e -> assertThat(e.getParameter()).isEqualTo("temperature"));
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 11, -3})
    void rejectsBeamSizeOutOfRange(int beamSize) {
        assertThatThrownBy(() -> new TranscriptionParams(null, null, beamSize, null, false))
                .isInstanceOfSatisfying(InvalidParameterException.class, e -> {
                    assertThat(e.getParameter()).isEqualTo("beam_size");
                    assertThat(e.getMessage()).contains("between 1 and 10");
                });
    }

    @Test
    void defaultsLeaveEverythingUnset() {
        TranscriptionParams p = TranscriptionParams.defaults();

        assertThat(p.language()).isNull();
        assertThat(p.temperature()).isNull();
        assertThat(p.beamSize()).isNull();
        assertThat(p.includeSegments()).isFalse();
    }
}
