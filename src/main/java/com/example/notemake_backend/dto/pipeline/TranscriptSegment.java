package com.example.notemake_backend.dto.pipeline;

/**
 * One timed piece of transcript text. Offsets are milliseconds from the start of the media.
 */
public record TranscriptSegment(long startMs, long endMs, String text) {

    public TranscriptSegment {
        if (startMs < 0) {
            throw new IllegalArgumentException("startMs must be >= 0");
        }
        if (endMs < startMs) {
            endMs = startMs;
        }
        text = text == null ? "" : text;
    }

    public double startSec() {
        return startMs / 1000.0;
    }

    public long durationMs() {
        return endMs - startMs;
    }
}
