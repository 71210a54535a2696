package com.example.notemake_backend.service;

import com.example.notemake_backend.exception.PipelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Duration;

/**
 * Bounded exponential backoff for transient failures ({@link com.example.notemake_backend.util.ErrorKind#isTransient()}).
 * Non-transient failures pass through on the first attempt; when attempts run out the last failure is rethrown.
 */
public class RetryPolicy {
    private static final Logger LOGGER = LoggerFactory.getLogger(RetryPolicy.class);

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final Scheduler backoffScheduler;

    public RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {
        this(maxAttempts, initialBackoff, maxBackoff, Schedulers.parallel());
    }

    public RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff, Scheduler backoffScheduler) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.initialBackoff = initialBackoff;
        this.maxBackoff = maxBackoff;
        this.backoffScheduler = backoffScheduler;
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ofMillis(1), Duration.ofMillis(1));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * @param label used in log lines, e.g. {@code "captions videoId=abc"}.
     */
    public Retry spec(String label) {
        return Retry.backoff(maxAttempts - 1, initialBackoff)
                .maxBackoff(maxBackoff)
                .jitter(0d)
                .scheduler(backoffScheduler)
                .filter(RetryPolicy::isTransient)
                .doBeforeRetry(signal -> LOGGER.info("RETRY {} attempt={} message={}", label,
                        signal.totalRetries() + 1, signal.failure().getMessage()))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    /**
     * Subscribes to {@code call} until it succeeds, fails non-transiently or runs out of attempts, then blocks for
     * the result.
     */
    public <T> T execute(String label, Mono<T> call) {
        Mono<T> attempts = maxAttempts > 1 ? call.retryWhen(spec(label)) : call;
        return TimeLimiter.await(label, attempts);
    }

    private static boolean isTransient(Throwable ex) {
        return ex instanceof PipelineException pe && pe.isTransient();
    }
}
