package com.example.notemake_backend.service.batch;

import com.example.notemake_backend.dto.pipeline.BatchProgress;
import com.example.notemake_backend.dto.pipeline.BatchRun;
import com.example.notemake_backend.dto.pipeline.BatchSummary;
import com.example.notemake_backend.dto.pipeline.PipelineOutcome;
import com.example.notemake_backend.dto.pipeline.VideoRef;
import com.example.notemake_backend.service.Interfaces.ProgressReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Default reporter for batches started over REST; clients poll the run state instead.
 */
@Component
public class LoggingProgressReporter implements ProgressReporter {
    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingProgressReporter.class);

    @Override
    public void onItemStarted(VideoRef ref) {
        LOGGER.debug("BATCH item start videoId={}", ref.videoId());
    }

    @Override
    public void onItemCompleted(VideoRef ref, PipelineOutcome outcome, BatchProgress progress) {
        LOGGER.info("BATCH progress id={} {}/{} videoId={} status={} succeeded={} partial={} failed={}",
                progress.batchId(), progress.completed(), progress.total(), ref.videoId(), outcome.status(),
                progress.succeeded(), progress.partial(), progress.failed());
    }

    @Override
    public void onBatchCompleted(BatchRun run) {
        BatchSummary s = run.summary();
        LOGGER.info("BATCH DONE id={} total={} succeeded={} partial={} failed={} cancelled={}", run.getId(),
                s.total(), s.succeeded(), s.partial(), s.failed(), s.cancelled());
    }
}
