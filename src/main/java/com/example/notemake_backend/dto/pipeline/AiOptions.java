package com.example.notemake_backend.dto.pipeline;

public record AiOptions(
        boolean enabled,
        int summaryWords,
        int keyPoints,
        boolean questions,
        int questionCount,
        boolean sentiment,
        boolean chapterSummaries
) {

    public AiOptions {
        summaryWords = summaryWords <= 0 ? 300 : summaryWords;
        keyPoints = keyPoints <= 0 ? 5 : keyPoints;
        questionCount = questionCount <= 0 ? 5 : questionCount;
    }

    public static AiOptions defaults() {
        return new AiOptions(true, 300, 5, false, 5, false, false);
    }

    public static AiOptions disabled() {
        return new AiOptions(false, 300, 5, false, 5, false, false);
    }
}
