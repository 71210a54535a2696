package com.example.notemake_backend.util;

public enum PipelineStage {
    METADATA,
    CACHE,
    EXTRACTION,
    PROCESSING,
    AI,
    DONE
}
