package com.example.notemake_backend.dto.web;

import com.example.notemake_backend.dto.pipeline.AiOptions;
import com.example.notemake_backend.dto.pipeline.ExtractionOptions;
import com.example.notemake_backend.dto.pipeline.PipelineOptions;
import com.example.notemake_backend.dto.pipeline.ProcessingOptions;
import com.example.notemake_backend.util.AudioTask;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

import java.util.List;
import java.util.Locale;

/**
 * Optional knobs shared by single-video and batch requests. Absent values take the pipeline defaults.
 */
public record NoteOptionsRequest(
        String modelSize,
        String task,
        Boolean allowFallback,
        Boolean detectParagraphs,
        Double paragraphPauseSec,
        Boolean removeFillers,
        List<String> customFillers,
        Boolean fixCapitalization,
        Boolean improvePunctuation,
        Boolean cleanArtifacts,
        @Min(0) @Max(100) Integer keywordCount,
        @Min(0) @Max(50) Integer summaryPoints,
        Boolean ai,
        @Min(20) @Max(2000) Integer summaryWords,
        @Min(1) @Max(20) Integer keyPoints,
        Boolean questions,
        @Min(1) @Max(20) Integer questionCount,
        Boolean sentiment,
        Boolean chapterSummaries
) {

    /**
     * @throws IllegalArgumentException on an unknown model size or task.
     */
    public PipelineOptions toOptions() {
        ExtractionOptions ed = ExtractionOptions.defaults();
        ProcessingOptions pd = ProcessingOptions.defaults();
        AiOptions ad = AiOptions.defaults();
        ExtractionOptions extraction = new ExtractionOptions(
                or(allowFallback, ed.allowFallback()),
                modelSize,
                parseTask(task));
        ProcessingOptions processing = new ProcessingOptions(
                or(detectParagraphs, pd.detectParagraphs()),
                paragraphPauseSec != null ? paragraphPauseSec : pd.paragraphPauseSec(),
                or(removeFillers, pd.removeFillers()),
                customFillers,
                or(fixCapitalization, pd.fixCapitalization()),
                or(improvePunctuation, pd.improvePunctuation()),
                or(cleanArtifacts, pd.cleanArtifacts()),
                keywordCount != null ? keywordCount : pd.keywordCount(),
                summaryPoints != null ? summaryPoints : pd.summaryPoints());
        AiOptions aiOptions = new AiOptions(
                or(ai, ad.enabled()),
                summaryWords != null ? summaryWords : ad.summaryWords(),
                keyPoints != null ? keyPoints : ad.keyPoints(),
                or(questions, ad.questions()),
                questionCount != null ? questionCount : ad.questionCount(),
                or(sentiment, ad.sentiment()),
                or(chapterSummaries, ad.chapterSummaries()));
        return new PipelineOptions(extraction, processing, aiOptions);
    }

    public static PipelineOptions toOptions(NoteOptionsRequest request) {
        return request == null ? PipelineOptions.defaults() : request.toOptions();
    }

    private static AudioTask parseTask(String value) {
        if (value == null || value.isBlank()) {
            return AudioTask.TRANSCRIBE;
        }
        try {
            return AudioTask.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown task: " + value, e);
        }
    }

    private static boolean or(Boolean value, boolean fallback) {
        return value != null ? value : fallback;
    }
}
