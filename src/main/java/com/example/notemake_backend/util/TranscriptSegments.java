package com.example.notemake_backend.util;

import com.example.notemake_backend.dto.pipeline.TranscriptSegment;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Helpers for ordered, non-overlapping segment lists.
 */
public final class TranscriptSegments {

    private TranscriptSegments() {
    }

    /**
     * Sorts by start offset, drops blank text, merges segments that share a start offset and clamps every end to the
     * next start. The result is strictly increasing by start and free of overlaps.
     */
    public static List<TranscriptSegment> normalize(List<TranscriptSegment> segments) {
        if (segments == null || segments.isEmpty()) {
            return List.of();
        }
        List<TranscriptSegment> sorted = segments.stream()
                .filter(s -> s != null && !s.text().isBlank())
                .sorted(Comparator.comparingLong(TranscriptSegment::startMs).thenComparingLong(TranscriptSegment::endMs))
                .toList();

        List<TranscriptSegment> merged = new ArrayList<>(sorted.size());
        for (TranscriptSegment seg : sorted) {
            if (!merged.isEmpty()) {
                TranscriptSegment last = merged.get(merged.size() - 1);
                if (last.startMs() == seg.startMs()) {
                    merged.set(merged.size() - 1, new TranscriptSegment(last.startMs(),
                            Math.max(last.endMs(), seg.endMs()),
                            last.text().strip() + " " + seg.text().strip()));
                    continue;
                }
            }
            merged.add(new TranscriptSegment(seg.startMs(), seg.endMs(), seg.text().strip()));
        }

        List<TranscriptSegment> result = new ArrayList<>(merged.size());
        for (int i = 0; i < merged.size(); i++) {
            TranscriptSegment seg = merged.get(i);
            long end = seg.endMs();
            if (i + 1 < merged.size()) {
                end = Math.min(end, merged.get(i + 1).startMs());
            }
            result.add(new TranscriptSegment(seg.startMs(), end, seg.text()));
        }
        return List.copyOf(result);
    }

    public static String fullText(List<TranscriptSegment> segments) {
        StringBuilder sb = new StringBuilder();
        for (TranscriptSegment seg : segments) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(seg.text());
        }
        return sb.toString();
    }

    public static long endMs(List<TranscriptSegment> segments) {
        return segments.isEmpty() ? 0L : segments.get(segments.size() - 1).endMs();
    }
}
