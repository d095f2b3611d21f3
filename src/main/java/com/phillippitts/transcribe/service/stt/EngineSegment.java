package com.phillippitts.transcribe.service.stt;

/**
 * A raw segment as emitted by the engine, text not yet trimmed.
 *
 * @param id    engine-assigned segment id
 * @param start start offset in seconds
 * @param end   end offset in seconds
 * @param text  raw segment text
 */
public record EngineSegment(int id, double start, double end, String text) {
}
