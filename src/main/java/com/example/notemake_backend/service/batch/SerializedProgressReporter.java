package com.example.notemake_backend.service.batch;

import com.example.notemake_backend.dto.pipeline.BatchProgress;
import com.example.notemake_backend.dto.pipeline.BatchRun;
import com.example.notemake_backend.dto.pipeline.PipelineOutcome;
import com.example.notemake_backend.dto.pipeline.VideoRef;
import com.example.notemake_backend.service.Interfaces.ProgressReporter;
import com.example.notemake_backend.util.PipelineStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Funnels the calls of one batch through a single lock and keeps reporter failures away from the run.
 */
final class SerializedProgressReporter implements ProgressReporter {
    private static final Logger LOGGER = LoggerFactory.getLogger(SerializedProgressReporter.class);

    private final ProgressReporter delegate;
    private final Object lock = new Object();

    SerializedProgressReporter(ProgressReporter delegate) {
        this.delegate = delegate != null ? delegate : ProgressReporter.NOOP;
    }

    Object lock() {
        return lock;
    }

    @Override
    public void onItemStarted(VideoRef ref) {
        synchronized (lock) {
            try {
                delegate.onItemStarted(ref);
            } catch (RuntimeException ex) {
                warn("onItemStarted", ex);
            }
        }
    }

    @Override
    public void onStageChanged(VideoRef ref, PipelineStage stage) {
        synchronized (lock) {
            try {
                delegate.onStageChanged(ref, stage);
            } catch (RuntimeException ex) {
                warn("onStageChanged", ex);
            }
        }
    }

    @Override
    public void onItemCompleted(VideoRef ref, PipelineOutcome outcome, BatchProgress progress) {
        synchronized (lock) {
            try {
                delegate.onItemCompleted(ref, outcome, progress);
            } catch (RuntimeException ex) {
                warn("onItemCompleted", ex);
            }
        }
    }

    @Override
    public void onBatchCompleted(BatchRun run) {
        synchronized (lock) {
            try {
                delegate.onBatchCompleted(run);
            } catch (RuntimeException ex) {
                warn("onBatchCompleted", ex);
            }
        }
    }

    private static void warn(String callback, RuntimeException ex) {
        LOGGER.warn("Progress reporter failed callback={} error={}", callback, ex.toString());
    }
}
