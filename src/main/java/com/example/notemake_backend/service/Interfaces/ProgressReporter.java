package com.example.notemake_backend.service.Interfaces;

import com.example.notemake_backend.dto.pipeline.BatchProgress;
import com.example.notemake_backend.dto.pipeline.BatchRun;
import com.example.notemake_backend.dto.pipeline.PipelineOutcome;
import com.example.notemake_backend.dto.pipeline.VideoRef;
import com.example.notemake_backend.util.PipelineStage;

/**
 * Observer for pipeline and batch progress. Implementations must not touch pipeline state; nothing reads back from
 * a reporter. Calls for one batch are never concurrent.
 */
public interface ProgressReporter {

    ProgressReporter NOOP = new ProgressReporter() { };

    default void onItemStarted(VideoRef ref) {
    }

    /**
     * Fired by the orchestrator when one video moves to the next stage. May be called from batch worker threads.
     */
    default void onStageChanged(VideoRef ref, PipelineStage stage) {
    }

    /**
     * @param progress running counts including this item.
     */
    default void onItemCompleted(VideoRef ref, PipelineOutcome outcome, BatchProgress progress) {
    }

    default void onBatchCompleted(BatchRun run) {
    }
}
