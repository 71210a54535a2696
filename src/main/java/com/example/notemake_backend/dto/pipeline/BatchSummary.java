package com.example.notemake_backend.dto.pipeline;

/**
 * Aggregate counts of a batch. {@code cancelled} counts items that never started because the run was cancelled.
 */
public record BatchSummary(int total, int completed, int succeeded, int partial, int failed, int cancelled) {
}
