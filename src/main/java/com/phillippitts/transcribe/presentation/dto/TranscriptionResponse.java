package com.phillippitts.transcribe.presentation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.phillippitts.transcribe.domain.TranscriptionResult;
import com.phillippitts.transcribe.domain.TranscriptionSegment;

import java.util.List;

/**
 * Body of a successful {@code POST /api/v1/transcribe}. {@code segments} is omitted unless
 * the client asked for it.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TranscriptionResponse(
        String text,
        String language,
        double durationSeconds,
        List<SegmentDto> segments
) {

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record SegmentDto(int id, double start, double end, String text) {
        static SegmentDto from(TranscriptionSegment segment) {
            return new SegmentDto(segment.id(), segment.start(), segment.end(), segment.text());
        }
    }

    public static TranscriptionResponse from(TranscriptionResult result) {
        List<SegmentDto> segments = result.segments() == null ? null
                : result.segments().stream().map(SegmentDto::from).toList();
        return new TranscriptionResponse(result.text(), result.language(), result.durationSeconds(), segments);
    }
}
