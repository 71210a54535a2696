package com.example.notemake_backend.service;

import com.example.notemake_backend.config.AiProperties;
import com.example.notemake_backend.dto.pipeline.AiOptions;
import com.example.notemake_backend.dto.pipeline.ChapterSection;
import com.example.notemake_backend.dto.pipeline.Summary;
import com.example.notemake_backend.engine.Interfaces.SummarizationEngine;
import com.example.notemake_backend.exception.PipelineException;
import com.example.notemake_backend.util.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the AI part of the notes from whichever {@link SummarizationEngine} is configured.
 */
@Service
public class AiSummaryService {
    private static final Logger LOGGER = LoggerFactory.getLogger(AiSummaryService.class);

    private final SummarizationEngine engine;
    private final AiProperties properties;

    public AiSummaryService(SummarizationEngine engine, AiProperties properties) {
        this.engine = engine;
        this.properties = properties;
    }

    /**
     * AI runs only when globally enabled and the selected provider has an API key.
     */
    public boolean isAvailable() {
        return properties.isEnabled() && engine.isConfigured();
    }

    public String providerName() {
        return engine.name();
    }

    /**
     * @throws PipelineException with kind {@code QUOTA_EXCEEDED} or {@code PROVIDER_ERROR}.
     */
    public Summary summarize(String text, List<ChapterSection> chapters, AiOptions options) {
        if (text == null || text.isBlank()) {
            throw new PipelineException(ErrorKind.PROVIDER_ERROR, "Nothing to summarize");
        }
        AiOptions opts = options != null ? options : AiOptions.defaults();
        LOGGER.info("AI summarize provider={} chars={} questions={} sentiment={} chapters={}",
                engine.name(), text.length(), opts.questions(), opts.sentiment(), opts.chapterSummaries());

        String summary = engine.summarize(text, opts.summaryWords());
        List<String> keyPoints = engine.extractKeyPoints(text, opts.keyPoints());
        List<String> questions = opts.questions() ? engine.generateQuestions(text, opts.questionCount()) : List.of();
        String sentiment = opts.sentiment() ? engine.analyzeSentiment(text) : null;

        Map<String, String> chapterSummaries = new LinkedHashMap<>();
        if (opts.chapterSummaries() && chapters != null) {
            for (ChapterSection ch : chapters) {
                if (ch.text() == null || ch.text().isBlank()) continue;
                chapterSummaries.put(ch.title(), engine.summarizeChapter(ch.title(), ch.text()));
            }
        }
        return new Summary(engine.name(), summary, keyPoints, questions, sentiment, chapterSummaries);
    }
}
