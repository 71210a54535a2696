package com.example.notemake_backend.service;

import com.example.notemake_backend.exception.PipelineException;
import com.example.notemake_backend.util.ErrorKind;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Runs a collaborator call on a separate executor and gives up after a deadline. A timeout surfaces as
 * {@link ErrorKind#TIMEOUT} so it goes through the same retry decision as network errors.
 * <p>
 * On timeout the worker thread is interrupted, which also stops any external process the call started.
 */
public class TimeLimiter {

    private final Scheduler scheduler;

    public TimeLimiter(ExecutorService executor) {
        this(Schedulers.fromExecutorService(executor, "collaborator"));
    }

    TimeLimiter(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * Runs on the subscribing thread without a deadline.
     */
    public static TimeLimiter direct() {
        return new TimeLimiter(Schedulers.immediate());
    }

    public <T> T call(String label, Duration timeout, Callable<T> task) {
        return call(label, timeout, ErrorKind.MODEL_ERROR, task);
    }

    /**
     * @param unexpectedKind kind reported when the task throws something other than a {@link PipelineException}.
     */
    public <T> T call(String label, Duration timeout, ErrorKind unexpectedKind, Callable<T> task) {
        return await(label, limit(label, timeout, unexpectedKind, task));
    }

    /**
     * Lazy form of {@link #call}; every subscription runs {@code task} again, so it composes with retries.
     */
    public <T> Mono<T> limit(String label, Duration timeout, ErrorKind unexpectedKind, Callable<T> task) {
        Mono<T> mono = Mono.fromCallable(() -> guarded(label, task)).subscribeOn(scheduler);
        if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
            mono = mono.timeout(timeout);
        }
        return mono.onErrorMap(ex -> !(ex instanceof PipelineException), ex -> translate(label, timeout, ex, unexpectedKind));
    }

    /**
     * Blocks for the result. An interrupt of the waiting thread cancels the call.
     */
    public static <T> T await(String label, Mono<T> mono) {
        try {
            return mono.block();
        } catch (RuntimeException ex) {
            if (Exceptions.unwrap(ex) instanceof InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new PipelineException(ErrorKind.CANCELLED, label + " interrupted", ie);
            }
            throw ex;
        }
    }

    private static <T> T guarded(String label, Callable<T> task) throws Exception {
        try {
            return task.call();
        } catch (OutOfMemoryError e) {
            throw new PipelineException(ErrorKind.RESOURCE_EXHAUSTED, label + " ran out of memory", e);
        }
    }

    private static PipelineException translate(String label, Duration timeout, Throwable ex, ErrorKind unexpectedKind) {
        if (ex instanceof TimeoutException) {
            return new PipelineException(ErrorKind.TIMEOUT, label + " timed out after " + timeout, ex);
        }
        if (ex instanceof RejectedExecutionException) {
            return new PipelineException(ErrorKind.RESOURCE_EXHAUSTED, "No capacity to run " + label, ex);
        }
        return new PipelineException(unexpectedKind, label + " failed: " + ex, ex);
    }
}
