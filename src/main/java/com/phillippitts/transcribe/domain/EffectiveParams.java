package com.phillippitts.transcribe.domain;

import java.util.Objects;

/**
 * Fully resolved decoding parameters handed to the speech engine.
 *
 * @param language        language hint (never null)
 * @param temperature     sampling temperature
 * @param beamSize        beam width
 * @param initialPrompt   guidance prompt, or null
 * @param includeSegments whether per-segment timing is kept
 * @param vadFilter       whether voice-activity detection runs before decoding
 */
public record EffectiveParams(
        String language,
        double temperature,
        int beamSize,
        String initialPrompt,
        boolean includeSegments,
        boolean vadFilter
) {
    public EffectiveParams {
        Objects.requireNonNull(language, "language must not be null");
    }

    public boolean hasInitialPrompt() {
        return initialPrompt != null && !initialPrompt.isBlank();
    }
}
