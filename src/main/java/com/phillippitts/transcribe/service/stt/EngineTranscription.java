package com.phillippitts.transcribe.service.stt;

import java.util.Iterator;
import java.util.Objects;

/**
 * Output of one engine call.
 *
 * @param segments forward-only, finite, single-pass sequence of segments
 * @param language language detected by the engine, or {@code null} when it reports none
 */
public record EngineTranscription(Iterator<EngineSegment> segments, String language) {

    public EngineTranscription {
        Objects.requireNonNull(segments, "segments must not be null");
    }
}
