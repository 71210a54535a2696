package com.example.notemake_backend.engine.Interfaces;

import java.util.List;

/**
 * AI capability set used for note generation. Failures surface as
 * {@link com.example.notemake_backend.exception.PipelineException} with kind {@code QUOTA_EXCEEDED} or
 * {@code PROVIDER_ERROR}.
 */
public interface SummarizationEngine {

    String name();

    /**
     * A provider counts as configured once its API key is set.
     */
    boolean isConfigured();

    String summarize(String text, int maxWords);

    List<String> extractKeyPoints(String text, int count);

    /**
     * Free text analysis of overall sentiment, tone, target audience and content type.
     */
    String analyzeSentiment(String text);

    List<String> generateQuestions(String text, int count);

    String summarizeChapter(String title, String text);
}
