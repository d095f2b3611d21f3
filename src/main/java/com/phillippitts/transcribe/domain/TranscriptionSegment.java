package com.phillippitts.transcribe.domain;

/**
 * A contiguous span of transcribed audio.
 *
 * @param id    zero-based position in engine emission order
 * @param start start offset in seconds
 * @param end   end offset in seconds
 * @param text  trimmed segment text
 */
public record TranscriptionSegment(int id, double start, double end, String text) {
}
