package com.example.notemake_backend.dto.pipeline;

import com.example.notemake_backend.util.OutcomeStatus;

import java.time.Instant;

/**
 * Terminal per-video result. Created once by the orchestrator and never mutated afterwards.
 *
 * @param fromCache whether the transcript was served from the cache.
 */
public record PipelineOutcome(
        VideoRef videoRef,
        OutcomeStatus status,
        TranscriptResult transcript,
        ProcessedText processedText,
        Summary summary,
        ErrorDetail error,
        boolean fromCache,
        Instant completedAt
) {

    public static PipelineOutcome failed(VideoRef ref, ErrorDetail error, Instant at) {
        return new PipelineOutcome(ref, OutcomeStatus.FAILED, null, null, null, error, false, at);
    }

    public boolean succeeded() {
        return status == OutcomeStatus.SUCCESS;
    }
}
