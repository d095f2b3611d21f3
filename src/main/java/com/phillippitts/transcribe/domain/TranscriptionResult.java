package com.phillippitts.transcribe.domain;

import java.util.List;
import java.util.Objects;

/**
 * Immutable result of one transcription request.
 *
 * @param text            full transcript; segment texts joined by single spaces
 * @param language        detected language, or the requested one when the engine reports none
 * @param durationSeconds wall-clock time of the inference call only
 * @param segments        ordered segments, or {@code null} when they were not requested
 */
public record TranscriptionResult(
        String text,
        String language,
        double durationSeconds,
        List<TranscriptionSegment> segments
) {

    /**
     * Compact constructor with validation.
     *
     * <p>Note: Empty text is valid (silence produces no segments).
     *
     * @throws NullPointerException if text or language is null
     * @throws IllegalArgumentException if duration is negative
     */
    public TranscriptionResult {
        Objects.requireNonNull(text, "Transcription text must not be null");
        Objects.requireNonNull(language, "Language must not be null");
        if (durationSeconds < 0.0) {
            throw new IllegalArgumentException("Duration must be >= 0, got: " + durationSeconds);
        }
        segments = segments == null ? null : List.copyOf(segments);
    }

    public boolean hasSegments() {
        return segments != null;
    }
}
