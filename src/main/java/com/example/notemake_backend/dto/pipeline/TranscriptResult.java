package com.example.notemake_backend.dto.pipeline;

import com.example.notemake_backend.util.ExtractionMode;
import com.example.notemake_backend.util.TranscriptSegments;

import java.util.List;
import java.util.Locale;

/**
 * A transcript as produced by an extraction engine and stored in the cache. Segments are normalized on
 * construction so they are strictly increasing by start offset and never overlap.
 */
public record TranscriptResult(
        List<TranscriptSegment> segments,
        ExtractionMode sourceMode,
        String language,
        VideoMetadata metadata
) {

    public TranscriptResult {
        if (sourceMode == null) {
            throw new IllegalArgumentException("sourceMode is required");
        }
        segments = TranscriptSegments.normalize(segments);
        language = language == null || language.isBlank() ? "auto" : language.toLowerCase(Locale.ROOT);
    }

    public static TranscriptResult of(List<TranscriptSegment> segments, ExtractionMode mode, String language) {
        return new TranscriptResult(segments, mode, language, null);
    }

    /**
     * Attaches metadata, stretching its duration so it covers the last segment.
     */
    public TranscriptResult withMetadata(VideoMetadata md) {
        if (md == null) {
            return this;
        }
        long coveredSec = (TranscriptSegments.endMs(segments) + 999) / 1000;
        return new TranscriptResult(segments, sourceMode, language, md.withDurationAtLeast(coveredSec));
    }

    public String fullText() {
        return TranscriptSegments.fullText(segments);
    }

    public int segmentCount() {
        return segments.size();
    }
}
