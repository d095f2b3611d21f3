package com.phillippitts.transcribe.service.transcription;

import com.phillippitts.transcribe.config.properties.TranscriptionProperties;
import com.phillippitts.transcribe.domain.EffectiveParams;
import com.phillippitts.transcribe.domain.TranscriptionParams;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Fills unset request parameters from {@link TranscriptionProperties}.
 * A blank language counts as unset.
 */
@Component
public class ParameterResolver {

    private final TranscriptionProperties defaults;

    public ParameterResolver(TranscriptionProperties defaults) {
        this.defaults = Objects.requireNonNull(defaults, "defaults");
    }

    public EffectiveParams resolve(TranscriptionParams params) {
        String language = params.language() == null || params.language().isBlank()
                ? defaults.defaultLanguage()
                : params.language().trim();
        double temperature = params.temperature() != null
                ? params.temperature()
                : defaults.defaultTemperature();
        int beamSize = params.beamSize() != null
                ? params.beamSize()
                : defaults.defaultBeamSize();
        return new EffectiveParams(language, temperature, beamSize, params.initialPrompt(),
                params.includeSegments(), defaults.vadFilter());
    }
}
