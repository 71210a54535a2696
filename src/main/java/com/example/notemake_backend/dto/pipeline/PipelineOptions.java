package com.example.notemake_backend.dto.pipeline;

public record PipelineOptions(ExtractionOptions extraction, ProcessingOptions processing, AiOptions ai) {

    public PipelineOptions {
        extraction = extraction == null ? ExtractionOptions.defaults() : extraction;
        processing = processing == null ? ProcessingOptions.defaults() : processing;
        ai = ai == null ? AiOptions.defaults() : ai;
    }

    public static PipelineOptions defaults() {
        return new PipelineOptions(null, null, null);
    }
}
