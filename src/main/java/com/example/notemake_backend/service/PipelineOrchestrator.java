package com.example.notemake_backend.service;

import com.example.notemake_backend.config.CacheProperties;
import com.example.notemake_backend.config.ExtractionProperties;
import com.example.notemake_backend.dto.pipeline.CacheEntry;
import com.example.notemake_backend.dto.pipeline.CacheKey;
import com.example.notemake_backend.dto.pipeline.ChapterSection;
import com.example.notemake_backend.dto.pipeline.ErrorDetail;
import com.example.notemake_backend.dto.pipeline.ExtractionOptions;
import com.example.notemake_backend.dto.pipeline.PipelineOptions;
import com.example.notemake_backend.dto.pipeline.PipelineOutcome;
import com.example.notemake_backend.dto.pipeline.ProcessedText;
import com.example.notemake_backend.dto.pipeline.Summary;
import com.example.notemake_backend.dto.pipeline.TranscriptResult;
import com.example.notemake_backend.dto.pipeline.VideoMetadata;
import com.example.notemake_backend.dto.pipeline.VideoRef;
import com.example.notemake_backend.exception.PipelineException;
import com.example.notemake_backend.service.Interfaces.ProgressReporter;
import com.example.notemake_backend.service.cache.TranscriptCache;
import com.example.notemake_backend.service.metadata.MetadataService;
import com.example.notemake_backend.util.ErrorKind;
import com.example.notemake_backend.util.OutcomeStatus;
import com.example.notemake_backend.util.PipelineStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;

/**
 * Builds notes for one video: metadata, cache lookup, extraction, text processing and optional AI summary, in
 * that order. Always returns a terminal {@link PipelineOutcome}; failures are folded into the outcome.
 * <p>
 * Extraction is single-flight per {@link CacheKey}: while one caller extracts, concurrent callers for the same key
 * wait for that result instead of starting their own.
 */
@Service
public class PipelineOrchestrator {
    private static final Logger LOGGER = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private final MetadataService metadataService;
    private final TranscriptCache cache;
    private final ExtractionStrategy extraction;
    private final TextProcessingService textProcessing;
    private final AiSummaryService aiSummary;
    private final Clock clock;
    private final int schemaVersion;
    private final RetryPolicy metadataRetry;
    private final TimeLimiter limiter;
    private final Duration metadataTimeout;
    private final Duration summaryTimeout;
    private final ConcurrentMap<CacheKey, CompletableFuture<TranscriptResult>> inFlight = new ConcurrentHashMap<>();

    @Autowired
    public PipelineOrchestrator(MetadataService metadataService,
                                TranscriptCache cache,
                                ExtractionStrategy extraction,
                                TextProcessingService textProcessing,
                                AiSummaryService aiSummary,
                                Clock clock,
                                CacheProperties cacheProperties,
                                ExtractionProperties extractionProperties,
                                @Qualifier("collaboratorExecutor") ThreadPoolTaskExecutor collaboratorExecutor) {
        this(metadataService, cache, extraction, textProcessing, aiSummary, clock,
                cacheProperties.getSchemaVersion(),
                new RetryPolicy(extractionProperties.getMetadataAttempts(), extractionProperties.getInitialBackoff(),
                        extractionProperties.getMaxBackoff()),
                new TimeLimiter(collaboratorExecutor.getThreadPoolExecutor()),
                extractionProperties.getMetadataTimeout(),
                extractionProperties.getSummaryTimeout());
    }

    PipelineOrchestrator(MetadataService metadataService, TranscriptCache cache, ExtractionStrategy extraction,
                         TextProcessingService textProcessing, AiSummaryService aiSummary, Clock clock,
                         int schemaVersion, RetryPolicy metadataRetry, TimeLimiter limiter,
                         Duration metadataTimeout, Duration summaryTimeout) {
        this.metadataService = metadataService;
        this.cache = cache;
        this.extraction = extraction;
        this.textProcessing = textProcessing;
        this.aiSummary = aiSummary;
        this.clock = clock;
        this.schemaVersion = schemaVersion;
        this.metadataRetry = metadataRetry;
        this.limiter = limiter;
        this.metadataTimeout = metadataTimeout;
        this.summaryTimeout = summaryTimeout;
    }

    public PipelineOutcome run(VideoRef ref, PipelineOptions options) {
        return run(ref, options, ProgressReporter.NOOP);
    }

    public PipelineOutcome run(VideoRef ref, PipelineOptions options, ProgressReporter reporter) {
        PipelineOptions opts = options != null ? options : PipelineOptions.defaults();
        ProgressReporter rep = reporter != null ? reporter : ProgressReporter.NOOP;
        LOGGER.info("PIPELINE START videoId={} lang={} mode={}", ref.videoId(),
                ref.language() == null ? CacheKey.AUTO_LANGUAGE : ref.language(),
                ref.preferredMode() == null ? CacheKey.AUTO_MODE : ref.preferredMode());

        // 1) metadata
        stage(rep, ref, PipelineStage.METADATA);
        VideoMetadata metadata;
        try {
            String label = "metadata videoId=" + ref.videoId();
            metadata = metadataRetry.execute(label,
                    limiter.limit(label, metadataTimeout, ErrorKind.NETWORK, () -> metadataService.resolve(ref)));
        } catch (PipelineException ex) {
            return failed(ref, ErrorDetail.of(PipelineStage.METADATA.name(), ex));
        }

        // 2) cache
        stage(rep, ref, PipelineStage.CACHE);
        CacheKey key = CacheKey.of(ref, opts.extraction(), schemaVersion);
        TranscriptResult transcript;
        boolean fromCache;
        Optional<CacheEntry> hit = lookup(key);
        if (hit.isPresent()) {
            LOGGER.info("CACHE hit key={} createdAt={}", key.canonical(), hit.get().createdAt());
            transcript = hit.get().payload();
            fromCache = true;
        } else {
            // 3) extraction
            LOGGER.info("CACHE miss key={}", key.canonical());
            stage(rep, ref, PipelineStage.EXTRACTION);
            try {
                Flight flight = extractOnce(key, ref, opts.extraction(), metadata);
                transcript = flight.result();
                fromCache = flight.reused();
            } catch (PipelineException ex) {
                return failed(ref, ErrorDetail.of(PipelineStage.EXTRACTION.name(), ex));
            } catch (RuntimeException ex) {
                LOGGER.error("PIPELINE unexpected extraction failure videoId={}", ref.videoId(), ex);
                return failed(ref, ErrorDetail.of(ErrorKind.EXTRACTION_FAILED, PipelineStage.EXTRACTION.name(), String.valueOf(ex)));
            }
        }
        transcript = transcript.withMetadata(metadata);

        // 4) text processing
        stage(rep, ref, PipelineStage.PROCESSING);
        ErrorDetail error = null;
        ProcessedText processed = null;
        try {
            processed = textProcessing.process(transcript, opts.processing());
        } catch (RuntimeException ex) {
            LOGGER.warn("PIPELINE processing degraded videoId={} error={}", ref.videoId(), ex.toString());
            error = ErrorDetail.of(ErrorKind.PROCESSING_FAILED, PipelineStage.PROCESSING.name(), String.valueOf(ex.getMessage()));
        }

        // 5) AI
        Summary summary = null;
        if (opts.ai().enabled() && aiSummary.isAvailable()) {
            stage(rep, ref, PipelineStage.AI);
            String text = processed != null ? processed.text() : transcript.fullText();
            List<ChapterSection> chapters = processed != null ? processed.chapters() : List.of();
            try {
                summary = limiter.call("summary videoId=" + ref.videoId(), summaryTimeout, ErrorKind.PROVIDER_ERROR,
                        () -> aiSummary.summarize(text, chapters, opts.ai()));
            } catch (PipelineException ex) {
                LOGGER.warn("PIPELINE AI degraded videoId={} kind={} message={}", ref.videoId(), ex.getKind(), ex.getMessage());
                if (error == null) {
                    error = ErrorDetail.of(PipelineStage.AI.name(), ex);
                }
            }
        }

        // 6) outcome
        stage(rep, ref, PipelineStage.DONE);
        OutcomeStatus status = error == null ? OutcomeStatus.SUCCESS : OutcomeStatus.PARTIAL;
        LOGGER.info("PIPELINE DONE videoId={} status={} mode={} fromCache={} segments={}", ref.videoId(), status,
                transcript.sourceMode(), fromCache, transcript.segmentCount());
        return new PipelineOutcome(ref, status, transcript, processed, summary, error, fromCache, clock.instant());
    }

    /**
     * Caches only transcripts, so options that shape processing or AI do not fragment the cache.
     */
    private Flight extractOnce(CacheKey key, VideoRef ref, ExtractionOptions options, VideoMetadata metadata) {
        CompletableFuture<TranscriptResult> mine = new CompletableFuture<>();
        CompletableFuture<TranscriptResult> existing = inFlight.putIfAbsent(key, mine);
        if (existing != null) {
            LOGGER.info("EXTRACT join key={} waiting for in-flight extraction", key.canonical());
            return new Flight(await(existing, key), true);
        }
        try {
            // another caller may have stored the entry between our lookup and claiming the key
            Optional<CacheEntry> hit = lookup(key);
            if (hit.isPresent()) {
                mine.complete(hit.get().payload());
                return new Flight(hit.get().payload(), true);
            }
            TranscriptResult result = extraction.extract(ref, options).withMetadata(metadata);
            store(key, result);
            mine.complete(result);
            return new Flight(result, false);
        } catch (RuntimeException ex) {
            mine.completeExceptionally(ex);
            throw ex;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    private TranscriptResult await(CompletableFuture<TranscriptResult> future, CacheKey key) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineException(ErrorKind.CANCELLED, "Interrupted waiting for extraction of " + key.canonical(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof PipelineException pe) {
                throw pe;
            }
            throw new PipelineException(ErrorKind.EXTRACTION_FAILED, "Shared extraction failed: " + cause, cause);
        }
    }

    private Optional<CacheEntry> lookup(CacheKey key) {
        try {
            return cache.get(key);
        } catch (RuntimeException ex) {
            LOGGER.warn("CACHE read failed key={} continuing without cache: {}", key.canonical(), ex.getMessage());
            return Optional.empty();
        }
    }

    private void store(CacheKey key, TranscriptResult result) {
        try {
            CacheEntry entry = cache.put(key, result);
            LOGGER.info("CACHE put key={} expiresAt={}", key.canonical(), entry.expiresAt());
        } catch (RuntimeException ex) {
            LOGGER.warn("CACHE write failed key={} continuing without cache: {}", key.canonical(), ex.getMessage());
        }
    }

    private PipelineOutcome failed(VideoRef ref, ErrorDetail error) {
        LOGGER.warn("PIPELINE FAILED videoId={} stage={} kind={} cause={} message={}", ref.videoId(), error.stage(),
                error.kind(), error.causeKind(), error.message());
        return PipelineOutcome.failed(ref, error, clock.instant());
    }

    private void stage(ProgressReporter reporter, VideoRef ref, PipelineStage stage) {
        try {
            reporter.onStageChanged(ref, stage);
        } catch (RuntimeException ex) {
            LOGGER.warn("Progress reporter failed stage={} videoId={}: {}", stage, ref.videoId(), ex.toString());
        }
    }

    private record Flight(TranscriptResult result, boolean reused) {}
}
