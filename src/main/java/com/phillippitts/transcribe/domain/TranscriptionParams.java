package com.phillippitts.transcribe.domain;

import com.phillippitts.transcribe.exception.InvalidParameterException;

/**
 * Decoding parameters as sent by the client. Every field except {@code includeSegments}
 * is optional; {@code null} means "use the configured default".
 *
 * @param language        ISO language hint, or null
 * @param temperature     sampling temperature in [0, 1], or null
 * @param beamSize        beam width in [1, 10], or null
 * @param initialPrompt   guidance prompt, or null
 * @param includeSegments whether per-segment timing is returned
 */
public record TranscriptionParams(
        String language,
        Double temperature,
        Integer beamSize,
        String initialPrompt,
        boolean includeSegments
) {

    public static final double MIN_TEMPERATURE = 0.0;
    public static final double MAX_TEMPERATURE = 1.0;
    public static final int MIN_BEAM_SIZE = 1;
    public static final int MAX_BEAM_SIZE = 10;

    /**
     * Compact constructor with range validation.
     *
     * @throws InvalidParameterException if temperature or beam size is out of range
     */
    public TranscriptionParams {
        if (temperature != null
                && (temperature.isNaN() || temperature < MIN_TEMPERATURE || temperature > MAX_TEMPERATURE)) {
            throw new InvalidParameterException("temperature",
                    "temperature must be between " + MIN_TEMPERATURE + " and " + MAX_TEMPERATURE
                            + ", got: " + temperature);
        }
        if (beamSize != null && (beamSize < MIN_BEAM_SIZE || beamSize > MAX_BEAM_SIZE)) {
            throw new InvalidParameterException("beam_size",
                    "beam_size must be between " + MIN_BEAM_SIZE + " and " + MAX_BEAM_SIZE
                            + ", got: " + beamSize);
        }
    }

    /**
     * Parameters with every optional field unset.
     */
    public static TranscriptionParams defaults() {
        return new TranscriptionParams(null, null, null, null, false);
    }
}
