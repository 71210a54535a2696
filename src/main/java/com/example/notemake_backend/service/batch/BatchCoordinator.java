package com.example.notemake_backend.service.batch;

import com.example.notemake_backend.config.BatchExecutorProperties;
import com.example.notemake_backend.dto.pipeline.BatchProgress;
import com.example.notemake_backend.dto.pipeline.BatchRun;
import com.example.notemake_backend.dto.pipeline.BatchSummary;
import com.example.notemake_backend.dto.pipeline.ErrorDetail;
import com.example.notemake_backend.dto.pipeline.PipelineOptions;
import com.example.notemake_backend.dto.pipeline.PipelineOutcome;
import com.example.notemake_backend.dto.pipeline.PlaylistEntry;
import com.example.notemake_backend.dto.pipeline.VideoRef;
import com.example.notemake_backend.exception.PipelineException;
import com.example.notemake_backend.service.Interfaces.ProgressReporter;
import com.example.notemake_backend.service.PipelineOrchestrator;
import com.example.notemake_backend.service.playlist.PlaylistResolver;
import com.example.notemake_backend.util.ErrorKind;
import com.example.notemake_backend.util.ExtractionMode;
import com.example.notemake_backend.util.VideoIdParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Runs the pipeline over a list of videos with a bounded number of items in flight. Every input position gets
 * exactly one outcome; a failing item never stops the others.
 * <p>
 * Cancellation is cooperative: items that have not started are recorded as {@code CANCELLED} failures, items
 * already running finish normally.
 */
@Service
public class BatchCoordinator {
    private static final Logger LOGGER = LoggerFactory.getLogger(BatchCoordinator.class);
    private static final String STAGE = "batch";

    private final PipelineOrchestrator orchestrator;
    private final PlaylistResolver playlistResolver;
    private final BatchRegistry registry;
    private final BatchExecutorProperties properties;
    private final Executor itemExecutor;
    private final Executor dispatchExecutor;
    private final Clock clock;

    public BatchCoordinator(PipelineOrchestrator orchestrator,
                            PlaylistResolver playlistResolver,
                            BatchRegistry registry,
                            BatchExecutorProperties properties,
                            @Qualifier("batchTaskExecutor") Executor itemExecutor,
                            @Qualifier("batchDispatchExecutor") Executor dispatchExecutor,
                            Clock clock) {
        this.orchestrator = orchestrator;
        this.playlistResolver = playlistResolver;
        this.registry = registry;
        this.properties = properties;
        this.itemExecutor = itemExecutor;
        this.dispatchExecutor = dispatchExecutor;
        this.clock = clock;
    }

    /**
     * Runs all refs and blocks until every item has an outcome.
     */
    public BatchRun run(List<VideoRef> refs, int concurrencyLimit, PipelineOptions options, ProgressReporter reporter) {
        return run(BatchPlan.of(refs), concurrencyLimit, options, reporter);
    }

    public BatchRun run(BatchPlan plan, int concurrencyLimit, PipelineOptions options, ProgressReporter reporter) {
        if (concurrencyLimit <= 0) {
            throw new IllegalArgumentException("concurrencyLimit must be positive: " + concurrencyLimit);
        }
        BatchRun run = newRun(plan);
        execute(run, plan, concurrencyLimit, options, new SerializedProgressReporter(reporter));
        return run;
    }

    /**
     * Registers the run and executes it in the background. The returned run fills in as items complete.
     *
     * @param concurrency requested limit, clamped to the configured bounds.
     */
    public BatchRun submit(BatchPlan plan, Integer concurrency, PipelineOptions options, ProgressReporter reporter) {
        int limit = properties.effectiveConcurrency(concurrency);
        BatchRun run = newRun(plan);
        SerializedProgressReporter serialized = new SerializedProgressReporter(reporter);
        try {
            dispatchExecutor.execute(() -> execute(run, plan, limit, options, serialized));
        } catch (RejectedExecutionException ex) {
            registry.remove(run.getId());
            LOGGER.warn("BATCH rejected id={} total={}", run.getId(), run.size());
            throw new PipelineException(ErrorKind.RESOURCE_EXHAUSTED, "Batch queue is full, try again later", ex);
        }
        return run;
    }

    /**
     * @return {@code false} when the batch is unknown or already finished.
     */
    public boolean cancel(String batchId) {
        return registry.find(batchId)
                .filter(run -> !run.isCompleted())
                .map(run -> {
                    boolean flipped = run.markCancelled();
                    if (flipped) {
                        LOGGER.info("BATCH cancel requested id={}", batchId);
                    }
                    return true;
                })
                .orElse(false);
    }

    /**
     * Turns user inputs into a plan. Playlists and channels are expanded here, before anything runs, so an
     * unresolvable collection fails the whole batch. Unavailable playlist entries become pre-failed items.
     *
     * @param maxVideos cap per playlist or channel, {@code null} or {@code 0} uses the configured default.
     */
    public BatchPlan expand(List<String> inputs, String language, ExtractionMode mode, Integer maxVideos) {
        int cap = maxVideos != null && maxVideos > 0 ? maxVideos : properties.getMaxVideos();
        List<VideoRef> refs = new ArrayList<>();
        Map<Integer, ErrorDetail> preFailed = new HashMap<>();
        for (String input : inputs) {
            if (input == null || input.isBlank()) {
                continue;
            }
            String in = input.trim();
            if (VideoIdParser.isCollection(in)) {
                for (PlaylistEntry entry : playlistResolver.expand(in, cap)) {
                    if (!entry.available()) {
                        preFailed.put(refs.size(), ErrorDetail.of(ErrorKind.NOT_FOUND, "playlist",
                                "Video unavailable in playlist: " + entry.title()));
                    }
                    refs.add(new VideoRef(entry.videoId(), language, mode));
                }
            } else {
                refs.add(new VideoRef(VideoIdParser.requireVideoId(in), language, mode));
            }
        }
        if (refs.isEmpty()) {
            throw new PipelineException(ErrorKind.INVALID_REFERENCE, "No videos to process");
        }
        return new BatchPlan(refs, preFailed);
    }

    private BatchRun newRun(BatchPlan plan) {
        BatchRun run = new BatchRun(UUID.randomUUID().toString(), plan.refs(), clock.instant());
        registry.register(run);
        return run;
    }

    private void execute(BatchRun run, BatchPlan plan, int limit, PipelineOptions options,
                         SerializedProgressReporter reporter) {
        long t0 = System.nanoTime();
        LOGGER.info("BATCH START id={} total={} concurrency={} preFailed={}", run.getId(), run.size(), limit,
                plan.preFailed().size());
        Semaphore permits = new Semaphore(limit);
        CountDownLatch done = new CountDownLatch(run.size());
        List<VideoRef> items = run.getItems();

        for (int i = 0; i < items.size(); i++) {
            int index = i;
            VideoRef ref = items.get(i);
            ErrorDetail pre = plan.preFailed().get(i);
            if (pre != null) {
                complete(run, index, PipelineOutcome.failed(ref, pre, clock.instant()), reporter);
                done.countDown();
                continue;
            }
            if (!acquire(permits, run)) {
                complete(run, index, cancelled(ref), reporter);
                done.countDown();
                continue;
            }
            try {
                itemExecutor.execute(() -> {
                    try {
                        complete(run, index, runItem(ref, options, reporter), reporter);
                    } finally {
                        try {
                            if (run.outcomeAt(index) == null) {
                                // runItem died with an Error; the slot still needs an outcome
                                LOGGER.error("BATCH item aborted id={} videoId={}", run.getId(), ref.videoId());
                                complete(run, index, PipelineOutcome.failed(ref, ErrorDetail.of(ErrorKind.EXTRACTION_FAILED,
                                        STAGE, "Item aborted"), clock.instant()), reporter);
                            }
                        } finally {
                            permits.release();
                            done.countDown();
                        }
                    }
                });
            } catch (RejectedExecutionException ex) {
                permits.release();
                LOGGER.warn("BATCH item rejected id={} videoId={}", run.getId(), ref.videoId());
                complete(run, index, PipelineOutcome.failed(ref, ErrorDetail.of(ErrorKind.RESOURCE_EXHAUSTED, STAGE,
                        "Executor queue full"), clock.instant()), reporter);
                done.countDown();
            }
        }

        awaitAll(done, run);
        run.markCompleted(clock.instant());
        BatchSummary s = run.summary();
        LOGGER.info("BATCH DONE id={} total={} succeeded={} partial={} failed={} cancelled={} in={}ms",
                run.getId(), s.total(), s.succeeded(), s.partial(), s.failed(), s.cancelled(),
                (System.nanoTime() - t0) / 1_000_000);
        reporter.onBatchCompleted(run);
    }

    private boolean acquire(Semaphore permits, BatchRun run) {
        if (run.isCancelled()) {
            return false;
        }
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            run.markCancelled();
            return false;
        }
        if (run.isCancelled()) {
            permits.release();
            return false;
        }
        return true;
    }

    private PipelineOutcome runItem(VideoRef ref, PipelineOptions options, ProgressReporter reporter) {
        reporter.onItemStarted(ref);
        try {
            return orchestrator.run(ref, options, reporter);
        } catch (RuntimeException ex) {
            LOGGER.error("BATCH item crashed videoId={}", ref.videoId(), ex);
            return PipelineOutcome.failed(ref, ErrorDetail.of(ErrorKind.EXTRACTION_FAILED, STAGE, String.valueOf(ex)),
                    clock.instant());
        }
    }

    private void complete(BatchRun run, int index, PipelineOutcome outcome, SerializedProgressReporter reporter) {
        // record and snapshot under one lock so published counts never go backwards
        synchronized (reporter.lock()) {
            if (!run.record(index, outcome)) {
                LOGGER.warn("BATCH duplicate outcome ignored id={} index={}", run.getId(), index);
                return;
            }
            BatchSummary s = run.summary();
            BatchProgress progress = new BatchProgress(run.getId(), s.total(), s.completed(), s.succeeded(),
                    s.partial(), s.failed(), outcome.videoRef().videoId());
            reporter.onItemCompleted(outcome.videoRef(), outcome, progress);
        }
    }

    private PipelineOutcome cancelled(VideoRef ref) {
        return PipelineOutcome.failed(ref, ErrorDetail.of(ErrorKind.CANCELLED, STAGE, "Batch cancelled before item started"),
                clock.instant());
    }

    private static void awaitAll(CountDownLatch done, BatchRun run) {
        boolean interrupted = false;
        while (true) {
            try {
                if (done.await(1, TimeUnit.SECONDS)) {
                    break;
                }
            } catch (InterruptedException e) {
                interrupted = true;
                run.markCancelled();
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }
}
