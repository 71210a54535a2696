package com.example.notemake_backend.service.batch;

import com.example.notemake_backend.dto.pipeline.BatchRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process lookup of batch runs by id. Finished runs are dropped after the retention window.
 */
@Component
public class BatchRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(BatchRegistry.class);

    private final Map<String, BatchRun> runs = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration retention;

    public BatchRegistry(Clock clock, @Value("${batch.retention:PT6H}") Duration retention) {
        this.clock = clock;
        this.retention = retention;
    }

    public void register(BatchRun run) {
        runs.put(run.getId(), run);
    }

    public void remove(String id) {
        runs.remove(id);
    }

    public Optional<BatchRun> find(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(runs.get(id));
    }

    public Collection<BatchRun> all() {
        return List.copyOf(runs.values());
    }

    @Scheduled(fixedDelayString = "${batch.registry-sweep-ms:600000}")
    public int evictFinished() {
        Instant cutoff = clock.instant().minus(retention);
        int before = runs.size();
        runs.values().removeIf(r -> r.isCompleted() && r.getCompletedAt().isBefore(cutoff));
        int removed = before - runs.size();
        if (removed > 0) {
            LOGGER.info("BATCH registry evicted={} remaining={}", removed, runs.size());
        }
        return removed;
    }
}
