package com.phillippitts.transcribe.service.transcription;

import com.phillippitts.transcribe.domain.TranscriptionSegment;

import java.util.List;

/**
 * What one engine run produced.
 *
 * @param text            trimmed segment texts joined by single spaces
 * @param language        detected language, or the input language as fallback
 * @param segments        retained segments in arrival order, or null when not requested
 * @param durationSeconds wall-clock time of the engine call
 */
public record InvocationOutput(
        String text,
        String language,
        List<TranscriptionSegment> segments,
        double durationSeconds
) {
}
