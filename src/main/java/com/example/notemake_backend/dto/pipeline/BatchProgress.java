package com.example.notemake_backend.dto.pipeline;

/**
 * Running counts published after each completed batch item.
 *
 * @param lastVideoId id of the item that just completed.
 */
public record BatchProgress(String batchId, int total, int completed, int succeeded, int partial, int failed,
                            String lastVideoId) {

    public double fraction() {
        return total == 0 ? 1.0 : (double) completed / total;
    }
}
