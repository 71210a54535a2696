package com.example.notemake_backend.dto.pipeline;

/**
 * Word and reading-time figures for a text.
 *
 * @param speakingRateWpm spoken words per minute, {@code null} when the media duration is unknown.
 */
public record TextStatistics(
        int wordCount,
        int characterCount,
        int characterCountNoSpaces,
        int sentenceCount,
        double readingMinutesFast,
        double readingMinutesAverage,
        double readingMinutesSlow,
        Double speakingRateWpm
) {
}
