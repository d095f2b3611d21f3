package com.phillippitts.transcribe.service.transcription;

import com.phillippitts.transcribe.config.properties.TranscriptionProperties;
import com.phillippitts.transcribe.domain.EffectiveParams;
import com.phillippitts.transcribe.domain.TranscriptionParams;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ParameterResolverTest {

    private final ParameterResolver resolver = new ParameterResolver(TranscriptionProperties.defaults());

    @Test
    void fillsUnsetFieldsFromDefaults() {
        EffectiveParams p = resolver.resolve(TranscriptionParams.defaults());

        assertThat(p.language()).isEqualTo("it");
        assertThat(p.temperature()).isEqualTo(0.0);
        assertThat(p.beamSize()).isEqualTo(5);
        assertThat(p.initialPrompt()).isNull();
        assertThat(p.includeSegments()).isFalse();
        assertThat(p.vadFilter()).isTrue();
    }

    @Test
    void explicitValuesWin() {
        EffectiveParams p = resolver.resolve(new TranscriptionParams(" en ", 0.7, 3, "Hi", true));

        assertThat(p.language()).isEqualTo("en");
        assertThat(p.temperature()).isEqualTo(0.7);
        assertThat(p.beamSize()).isEqualTo(3);
        assertThat(p.initialPrompt()).isEqualTo("Hi");
        assertThat(p.includeSegments()).isTrue();
    }

    @Test
    void blankLanguageCountsAsUnset() {
        assertThat(resolver.resolve(new TranscriptionParams("  ", null, null, null, false)).language())
                .isEqualTo("it");
    }
}
