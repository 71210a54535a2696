package com.example.notemake_backend.dto.pipeline;

import java.util.List;

/**
 * Output of the text-processing stage.
 *
 * @param text          cleaned transcript text, paragraphs separated by a blank line.
 * @param paragraphs    the same text split per paragraph.
 * @param summaryPoints extractive key sentences (no AI involved).
 * @param chapters      text grouped by video chapter, empty when the video has none.
 */
public record ProcessedText(
        String text,
        List<String> paragraphs,
        List<Keyword> keywords,
        List<String> summaryPoints,
        TextStatistics statistics,
        List<ChapterSection> chapters
) {

    public ProcessedText {
        paragraphs = paragraphs == null ? List.of() : List.copyOf(paragraphs);
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        summaryPoints = summaryPoints == null ? List.of() : List.copyOf(summaryPoints);
        chapters = chapters == null ? List.of() : List.copyOf(chapters);
    }
}
