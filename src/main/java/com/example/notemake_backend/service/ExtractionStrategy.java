package com.example.notemake_backend.service;

import com.example.notemake_backend.config.ExtractionProperties;
import com.example.notemake_backend.dto.pipeline.ExtractionOptions;
import com.example.notemake_backend.dto.pipeline.TranscriptResult;
import com.example.notemake_backend.dto.pipeline.VideoRef;
import com.example.notemake_backend.engine.Interfaces.CaptionEngine;
import com.example.notemake_backend.engine.Interfaces.TranscriptionEngine;
import com.example.notemake_backend.exception.ExtractionFailedException;
import com.example.notemake_backend.exception.PipelineException;
import com.example.notemake_backend.util.ErrorKind;
import com.example.notemake_backend.util.ExtractionMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Gets a transcript for one video. Runs as a small state machine:
 * <pre>
 * CAPTIONS --ok--------------------------------> SUCCEEDED
 * CAPTIONS --no captions-----------------------> AUDIO   (FAILED when pinned to CAPTIONS)
 * CAPTIONS --transient, retries exhausted------> AUDIO   (FAILED when fallback is off or mode is pinned)
 * CAPTIONS --other failure---------------------> FAILED
 * AUDIO    --ok--------------------------------> SUCCEEDED
 * AUDIO    --any failure-----------------------> FAILED
 * </pre>
 * Retries with backoff are attached to the caption transition only; audio transcription gets a single attempt.
 * A ref pinned to AUDIO starts in the AUDIO state.
 */
@Service
public class ExtractionStrategy {
    private static final Logger LOGGER = LoggerFactory.getLogger(ExtractionStrategy.class);

    enum Step { CAPTIONS, AUDIO, SUCCEEDED, FAILED }

    /**
     * Current state plus whatever the last transition produced.
     */
    record ExtractionState(Step step, TranscriptResult result, PipelineException failure) {

        static ExtractionState at(Step step) {
            return new ExtractionState(step, null, null);
        }

        static ExtractionState succeeded(TranscriptResult result) {
            return new ExtractionState(Step.SUCCEEDED, result, null);
        }

        static ExtractionState failed(PipelineException failure) {
            return new ExtractionState(Step.FAILED, null, failure);
        }

        boolean terminal() {
            return step == Step.SUCCEEDED || step == Step.FAILED;
        }
    }

    private final CaptionEngine captions;
    private final TranscriptionEngine audio;
    private final RetryPolicy captionRetry;
    private final TimeLimiter limiter;
    private final Duration captionTimeout;
    private final Duration audioTimeout;

    @Autowired
    public ExtractionStrategy(CaptionEngine captions,
                              TranscriptionEngine audio,
                              ExtractionProperties props,
                              @Qualifier("collaboratorExecutor") ThreadPoolTaskExecutor collaboratorExecutor) {
        this(captions, audio,
                new RetryPolicy(props.getCaptionAttempts(), props.getInitialBackoff(), props.getMaxBackoff()),
                new TimeLimiter(collaboratorExecutor.getThreadPoolExecutor()),
                props.getCaptionTimeout(),
                props.getAudioTimeout());
    }

    ExtractionStrategy(CaptionEngine captions, TranscriptionEngine audio, RetryPolicy captionRetry,
                       TimeLimiter limiter, Duration captionTimeout, Duration audioTimeout) {
        this.captions = captions;
        this.audio = audio;
        this.captionRetry = captionRetry;
        this.limiter = limiter;
        this.captionTimeout = captionTimeout;
        this.audioTimeout = audioTimeout;
    }

    /**
     * @throws ExtractionFailedException when the machine ends in FAILED; {@link ExtractionFailedException#getCauseKind()}
     *                                   names the underlying failure.
     */
    public TranscriptResult extract(VideoRef ref, ExtractionOptions options) {
        ExtractionOptions opts = options != null ? options : ExtractionOptions.defaults();
        ExtractionState state = ExtractionState.at(ref.preferredMode() == ExtractionMode.AUDIO ? Step.AUDIO : Step.CAPTIONS);
        while (!state.terminal()) {
            state = switch (state.step()) {
                case CAPTIONS -> fromCaptions(ref, opts);
                case AUDIO -> fromAudio(ref, opts);
                default -> throw new IllegalStateException("Unexpected state " + state.step());
            };
        }
        if (state.step() == Step.SUCCEEDED) {
            LOGGER.info("EXTRACT done videoId={} mode={} segments={}", ref.videoId(),
                    state.result().sourceMode(), state.result().segmentCount());
            return state.result();
        }
        PipelineException failure = state.failure();
        LOGGER.warn("EXTRACT failed videoId={} kind={} message={}", ref.videoId(), failure.getKind(), failure.getMessage());
        throw failure instanceof ExtractionFailedException efe ? efe
                : new ExtractionFailedException("Extraction failed for " + ref.videoId() + ": " + failure.getMessage(), failure);
    }

    ExtractionState fromCaptions(VideoRef ref, ExtractionOptions opts) {
        boolean pinned = ref.preferredMode() == ExtractionMode.CAPTIONS;
        try {
            String label = "captions videoId=" + ref.videoId();
            TranscriptResult result = captionRetry.execute(label,
                    limiter.limit(label, captionTimeout, ErrorKind.NETWORK, () -> captions.fetch(ref, ref.language())));
            return ExtractionState.succeeded(result);
        } catch (PipelineException ex) {
            if (ex.getKind() == ErrorKind.NO_CAPTIONS) {
                if (pinned) {
                    return ExtractionState.failed(ex);
                }
                LOGGER.info("EXTRACT fallback videoId={} reason=NO_CAPTIONS", ref.videoId());
                return ExtractionState.at(Step.AUDIO);
            }
            if (ex.isTransient()) {
                if (opts.allowFallback() && !pinned) {
                    LOGGER.warn("EXTRACT fallback videoId={} reason={} attempts={}", ref.videoId(), ex.getKind(),
                            captionRetry.getMaxAttempts());
                    return ExtractionState.at(Step.AUDIO);
                }
                return ExtractionState.failed(ex);
            }
            return ExtractionState.failed(ex);
        }
    }

    ExtractionState fromAudio(VideoRef ref, ExtractionOptions opts) {
        TranscriptionEngine.Request request = new TranscriptionEngine.Request(ref, opts.modelSize(), opts.task(), ref.language());
        LOGGER.info("EXTRACT audio videoId={} engine={} model={} task={}", ref.videoId(), audio.name(),
                opts.modelSize(), opts.task().id());
        try {
            TranscriptResult result = limiter.call("audio videoId=" + ref.videoId(), audioTimeout,
                    () -> audio.transcribe(request));
            return ExtractionState.succeeded(result);
        } catch (PipelineException ex) {
            return ExtractionState.failed(new ExtractionFailedException(
                    "Audio transcription failed for " + ref.videoId() + ": " + ex.getMessage(), ex));
        }
    }
}
