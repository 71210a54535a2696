package com.example.notemake_backend.dto.web;

import com.example.notemake_backend.dto.pipeline.BatchRun;
import com.example.notemake_backend.dto.pipeline.BatchSummary;
import com.example.notemake_backend.dto.pipeline.PipelineOutcome;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchStatusResponse(
        String batchId,
        int total,
        int completed,
        int succeeded,
        int partial,
        int failed,
        int skipped,
        boolean cancelled,
        boolean finished,
        Instant startedAt,
        Instant completedAt,
        List<PipelineOutcome> outcomes,
        Map<String, List<PipelineOutcome>> groups
) {

    public static BatchStatusResponse from(BatchRun run, Map<String, List<PipelineOutcome>> groups) {
        BatchSummary s = run.summary();
        return new BatchStatusResponse(run.getId(), s.total(), s.completed(), s.succeeded(), s.partial(), s.failed(),
                s.cancelled(), run.isCancelled(), run.isCompleted(), run.getStartedAt(), run.getCompletedAt(),
                groups == null ? run.getOutcomes() : null, groups);
    }
}
