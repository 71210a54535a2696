package com.example.notemake_backend.dto.pipeline;

import java.util.List;
import java.util.Map;

/**
 * AI generated notes for one video.
 *
 * @param chapterSummaries chapter title to short summary, in chapter order.
 */
public record Summary(
        String provider,
        String summary,
        List<String> keyPoints,
        List<String> questions,
        String sentiment,
        Map<String, String> chapterSummaries
) {

    public Summary {
        keyPoints = keyPoints == null ? List.of() : List.copyOf(keyPoints);
        questions = questions == null ? List.of() : List.copyOf(questions);
        chapterSummaries = chapterSummaries == null ? Map.of() : chapterSummaries;
    }
}
