package com.example.notemake_backend.dto.pipeline;

import com.example.notemake_backend.util.ErrorKind;
import com.example.notemake_backend.util.OutcomeStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * State of one batch run. Outcomes are indexed by input position, so duplicate refs each get their own slot and
 * a completed run always holds exactly one outcome per input item.
 */
public class BatchRun {

    private final String id;
    private final List<VideoRef> items;
    private final AtomicReferenceArray<PipelineOutcome> outcomes;
    private final Instant startedAt;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private volatile Instant completedAt;

    public BatchRun(String id, List<VideoRef> items, Instant startedAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.items = List.copyOf(items);
        this.outcomes = new AtomicReferenceArray<>(this.items.size());
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt");
    }

    public String getId() {
        return id;
    }

    public List<VideoRef> getItems() {
        return items;
    }

    public int size() {
        return items.size();
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public boolean isCompleted() {
        return completedAt != null;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * @return {@code true} when this call flipped the flag.
     */
    public boolean markCancelled() {
        return cancelled.compareAndSet(false, true);
    }

    public void markCompleted(Instant at) {
        this.completedAt = at;
    }

    /**
     * Records the outcome of item {@code index}. The first outcome for a slot wins.
     */
    public boolean record(int index, PipelineOutcome outcome) {
        return outcomes.compareAndSet(index, null, Objects.requireNonNull(outcome, "outcome"));
    }

    public PipelineOutcome outcomeAt(int index) {
        return outcomes.get(index);
    }

    /**
     * Outcomes recorded so far, in input order.
     */
    public List<PipelineOutcome> getOutcomes() {
        List<PipelineOutcome> out = new ArrayList<>(items.size());
        for (int i = 0; i < outcomes.length(); i++) {
            PipelineOutcome o = outcomes.get(i);
            if (o != null) {
                out.add(o);
            }
        }
        return Collections.unmodifiableList(out);
    }

    public BatchSummary summary() {
        int completed = 0, succeeded = 0, partial = 0, failed = 0, skipped = 0;
        for (int i = 0; i < outcomes.length(); i++) {
            PipelineOutcome o = outcomes.get(i);
            if (o == null) {
                continue;
            }
            completed++;
            if (o.status() == OutcomeStatus.SUCCESS) {
                succeeded++;
            } else if (o.status() == OutcomeStatus.PARTIAL) {
                partial++;
            } else {
                failed++;
                if (o.error() != null && o.error().kind() == ErrorKind.CANCELLED) {
                    skipped++;
                }
            }
        }
        return new BatchSummary(items.size(), completed, succeeded, partial, failed, skipped);
    }
}
