package com.example.notemake_backend.service.batch;

import com.example.notemake_backend.config.BatchExecutorProperties;
import com.example.notemake_backend.dto.pipeline.BatchProgress;
import com.example.notemake_backend.dto.pipeline.BatchRun;
import com.example.notemake_backend.dto.pipeline.PipelineOptions;
import com.example.notemake_backend.dto.pipeline.PipelineOutcome;
import com.example.notemake_backend.dto.pipeline.PlaylistEntry;
import com.example.notemake_backend.dto.pipeline.VideoRef;
import com.example.notemake_backend.exception.PipelineException;
import com.example.notemake_backend.exception.PlaylistResolutionFailedException;
import com.example.notemake_backend.service.Interfaces.ProgressReporter;
import com.example.notemake_backend.service.PipelineOrchestrator;
import com.example.notemake_backend.service.playlist.PlaylistResolver;
import com.example.notemake_backend.support.Transcripts;
import com.example.notemake_backend.util.ErrorKind;
import com.example.notemake_backend.util.ExtractionMode;
import com.example.notemake_backend.util.OutcomeStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BatchCoordinatorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock private PipelineOrchestrator orchestrator;
    @Mock private PlaylistResolver playlistResolver;

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private ExecutorService itemExecutor;
    private ExecutorService dispatchExecutor;
    private BatchRegistry registry;
    private BatchExecutorProperties properties;
    private BatchCoordinator coordinator;

    @BeforeEach
    void setUp() {
        itemExecutor = Executors.newFixedThreadPool(6);
        dispatchExecutor = Executors.newSingleThreadExecutor();
        registry = new BatchRegistry(clock, Duration.ofHours(6));
        properties = new BatchExecutorProperties();
        coordinator = new BatchCoordinator(orchestrator, playlistResolver, registry, properties, itemExecutor,
                dispatchExecutor, clock);
    }

    @AfterEach
    void tearDown() {
        itemExecutor.shutdownNow();
        dispatchExecutor.shutdownNow();
    }

    private static PipelineOutcome success(VideoRef ref) {
        return new PipelineOutcome(ref, OutcomeStatus.SUCCESS, Transcripts.sample(ExtractionMode.CAPTIONS), null,
                null, null, false, NOW);
    }

    private static List<VideoRef> refs(String... ids) {
        List<VideoRef> out = new ArrayList<>();
        for (String id : ids) {
            out.add(VideoRef.of(id));
        }
        return out;
    }

    @Test
    void everyPositionGetsOneOutcomeIncludingDuplicates() {
        when(orchestrator.run(any(), any(), any())).thenAnswer(inv -> success(inv.getArgument(0)));
        List<VideoRef> refs = refs("aaaaaaaaaaa", "bbbbbbbbbbb", "aaaaaaaaaaa");

        BatchRun run = coordinator.run(refs, 2, PipelineOptions.defaults(), ProgressReporter.NOOP);

        assertThat(run.isCompleted()).isTrue();
        assertThat(run.getOutcomes()).hasSize(3);
        for (int i = 0; i < refs.size(); i++) {
            assertThat(run.outcomeAt(i).videoRef()).isEqualTo(refs.get(i));
        }
        assertThat(run.summary().succeeded()).isEqualTo(3);
        assertThat(registry.find(run.getId())).containsSame(run);
    }

    @Test
    void failingItemDoesNotAffectOthers() {
        when(orchestrator.run(any(), any(), any())).thenAnswer(inv -> {
            VideoRef ref = inv.getArgument(0);
            if (ref.videoId().equals("bbbbbbbbbbb")) {
                throw new IllegalStateException("boom");
            }
            return success(ref);
        });

        BatchRun run = coordinator.run(refs("aaaaaaaaaaa", "bbbbbbbbbbb", "ccccccccccc"), 3,
                PipelineOptions.defaults(), ProgressReporter.NOOP);

        assertThat(run.outcomeAt(0).status()).isEqualTo(OutcomeStatus.SUCCESS);
        assertThat(run.outcomeAt(1).status()).isEqualTo(OutcomeStatus.FAILED);
        assertThat(run.outcomeAt(1).error().stage()).isEqualTo("batch");
        assertThat(run.outcomeAt(2).status()).isEqualTo(OutcomeStatus.SUCCESS);
        assertThat(run.summary().failed()).isEqualTo(1);
    }

    @Test
    void itemDyingWithErrorStillGetsFailedOutcome() {
        when(orchestrator.run(any(), any(), any())).thenAnswer(inv -> {
            VideoRef ref = inv.getArgument(0);
            if (ref.videoId().equals("bbbbbbbbbbb")) {
                throw new StackOverflowError("deep");
            }
            return success(ref);
        });

        BatchRun run = coordinator.run(refs("aaaaaaaaaaa", "bbbbbbbbbbb", "ccccccccccc"), 3,
                PipelineOptions.defaults(), ProgressReporter.NOOP);

        assertThat(run.isCompleted()).isTrue();
        assertThat(run.getOutcomes()).hasSize(3);
        assertThat(run.outcomeAt(1).status()).isEqualTo(OutcomeStatus.FAILED);
        assertThat(run.outcomeAt(1).error().kind()).isEqualTo(ErrorKind.EXTRACTION_FAILED);
        assertThat(run.summary().succeeded()).isEqualTo(2);
    }

    @Test
    void rejectedSubmissionLeavesNoRunBehind() {
        ExecutorService closed = Executors.newSingleThreadExecutor();
        closed.shutdown();
        BatchCoordinator saturated = new BatchCoordinator(orchestrator, playlistResolver, registry, properties,
                itemExecutor, closed, clock);

        assertThatThrownBy(() -> saturated.submit(new BatchPlan(refs("aaaaaaaaaaa"), Map.of()), 1,
                PipelineOptions.defaults(), ProgressReporter.NOOP))
                .isInstanceOfSatisfying(PipelineException.class,
                        ex -> assertThat(ex.getKind()).isEqualTo(ErrorKind.RESOURCE_EXHAUSTED));
        assertThat(registry.all()).isEmpty();
        verify(orchestrator, never()).run(any(), any(), any());
    }

    @Test
    void inFlightItemsNeverExceedLimit() {
        AtomicInteger active = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        when(orchestrator.run(any(), any(), any())).thenAnswer(inv -> {
            int now = active.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            Thread.sleep(40);
            active.decrementAndGet();
            return success(inv.getArgument(0));
        });

        BatchRun run = coordinator.run(refs("aaaaaaaaaaa", "bbbbbbbbbbb", "ccccccccccc", "ddddddddddd",
                "eeeeeeeeeee", "fffffffffff", "ggggggggggg", "hhhhhhhhhhh"), 2, PipelineOptions.defaults(),
                ProgressReporter.NOOP);

        assertThat(run.summary().completed()).isEqualTo(8);
        assertThat(peak.get()).isLessThanOrEqualTo(2);
    }

    @Test
    void cancelledBatchRecordsPendingItemsAsCancelled() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(orchestrator.run(any(), any(), any())).thenAnswer(inv -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return success(inv.getArgument(0));
        });

        BatchRun run = coordinator.submit(new BatchPlan(refs("aaaaaaaaaaa", "bbbbbbbbbbb", "ccccccccccc"),
                Map.of()), 1, PipelineOptions.defaults(), ProgressReporter.NOOP);
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(coordinator.cancel(run.getId())).isTrue();
        release.countDown();
        awaitCompletion(run);

        assertThat(run.outcomeAt(0).status()).isEqualTo(OutcomeStatus.SUCCESS);
        assertThat(run.outcomeAt(1).error().kind()).isEqualTo(ErrorKind.CANCELLED);
        assertThat(run.outcomeAt(2).error().kind()).isEqualTo(ErrorKind.CANCELLED);
        assertThat(run.summary().cancelled()).isEqualTo(2);
        assertThat(coordinator.cancel(run.getId())).isFalse();
    }

    @Test
    void cancelUnknownBatchIsFalse() {
        assertThat(coordinator.cancel("nope")).isFalse();
    }

    @Test
    void reporterSeesMonotonicProgressAndOneCompletion() {
        when(orchestrator.run(any(), any(), any())).thenAnswer(inv -> success(inv.getArgument(0)));
        RecordingReporter reporter = new RecordingReporter();

        BatchRun run = coordinator.run(refs("aaaaaaaaaaa", "bbbbbbbbbbb", "ccccccccccc", "ddddddddddd"), 3,
                PipelineOptions.defaults(), reporter);

        assertThat(reporter.completedCounts).containsExactly(1, 2, 3, 4);
        assertThat(reporter.started).hasValue(4);
        assertThat(reporter.batchCompleted).containsExactly(run.getId());
    }

    @Test
    void throwingReporterDoesNotBreakBatch() {
        when(orchestrator.run(any(), any(), any())).thenAnswer(inv -> success(inv.getArgument(0)));
        ProgressReporter broken = new ProgressReporter() {
            @Override
            public void onItemCompleted(VideoRef ref, PipelineOutcome outcome, BatchProgress progress) {
                throw new IllegalStateException("ui gone");
            }
        };

        BatchRun run = coordinator.run(refs("aaaaaaaaaaa", "bbbbbbbbbbb"), 2, PipelineOptions.defaults(), broken);

        assertThat(run.summary().succeeded()).isEqualTo(2);
    }

    @Test
    void nonPositiveLimitIsRejected() {
        assertThatThrownBy(() -> coordinator.run(refs("aaaaaaaaaaa"), 0, PipelineOptions.defaults(), ProgressReporter.NOOP))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void expandTurnsUnavailablePlaylistEntriesIntoPreFailedItems() {
        String playlist = "https://www.youtube.com/playlist?list=PL0123456789";
        when(playlistResolver.expand(playlist, 5)).thenReturn(List.of(
                new PlaylistEntry("aaaaaaaaaaa", "First", true),
                new PlaylistEntry("bbbbbbbbbbb", "[Private video]", false)));

        BatchPlan plan = coordinator.expand(List.of(playlist, "https://youtu.be/ccccccccccc"), "en", null, 5);

        assertThat(plan.size()).isEqualTo(3);
        assertThat(plan.refs()).extracting(VideoRef::videoId).containsExactly("aaaaaaaaaaa", "bbbbbbbbbbb", "ccccccccccc");
        assertThat(plan.refs()).allMatch(r -> "en".equals(r.language()));
        assertThat(plan.preFailed()).containsOnlyKeys(1);

        when(orchestrator.run(any(), any(), any())).thenAnswer(inv -> success(inv.getArgument(0)));
        BatchRun run = coordinator.run(plan, 2, PipelineOptions.defaults(), ProgressReporter.NOOP);

        assertThat(run.outcomeAt(1).status()).isEqualTo(OutcomeStatus.FAILED);
        assertThat(run.outcomeAt(1).error().kind()).isEqualTo(ErrorKind.NOT_FOUND);
        verify(orchestrator, never()).run(eq(plan.refs().get(1)), any(), any());
    }

    @Test
    void unresolvablePlaylistFailsWholeExpansion() {
        String playlist = "https://www.youtube.com/playlist?list=PLbroken";
        when(playlistResolver.expand(playlist, 0))
                .thenThrow(new PlaylistResolutionFailedException(playlist, "yt-dlp failed", null));

        assertThatThrownBy(() -> coordinator.expand(List.of(playlist), null, null, null))
                .isInstanceOf(PlaylistResolutionFailedException.class);
    }

    @Test
    void invalidInputIsRejected() {
        assertThatThrownBy(() -> coordinator.expand(List.of("not a url"), null, null, null))
                .isInstanceOfSatisfying(PipelineException.class,
                        ex -> assertThat(ex.getKind()).isEqualTo(ErrorKind.INVALID_REFERENCE));
    }

    private static void awaitCompletion(BatchRun run) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (!run.isCompleted() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(run.isCompleted()).isTrue();
    }

    static class RecordingReporter implements ProgressReporter {
        final List<Integer> completedCounts = Collections.synchronizedList(new ArrayList<>());
        final List<String> batchCompleted = Collections.synchronizedList(new ArrayList<>());
        final AtomicInteger started = new AtomicInteger();

        @Override
        public void onItemStarted(VideoRef ref) {
            started.incrementAndGet();
        }

        @Override
        public void onItemCompleted(VideoRef ref, PipelineOutcome outcome, BatchProgress progress) {
            completedCounts.add(progress.completed());
        }

        @Override
        public void onBatchCompleted(BatchRun run) {
            batchCompleted.add(run.getId());
        }
    }
}
