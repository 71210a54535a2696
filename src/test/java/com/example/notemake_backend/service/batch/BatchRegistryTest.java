package com.example.notemake_backend.service.batch;

import com.example.notemake_backend.dto.pipeline.BatchRun;
import com.example.notemake_backend.dto.pipeline.VideoRef;
import com.example.notemake_backend.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BatchRegistryTest {

    @Test
    void finishedRunsAreEvictedAfterRetention() {
        MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        BatchRegistry registry = new BatchRegistry(clock, Duration.ofHours(6));
        BatchRun finished = new BatchRun("done", List.of(VideoRef.of("aaaaaaaaaaa")), clock.instant());
        BatchRun running = new BatchRun("running", List.of(VideoRef.of("bbbbbbbbbbb")), clock.instant());
        registry.register(finished);
        registry.register(running);
        finished.markCompleted(clock.instant());

        clock.advance(Duration.ofHours(5));
        assertThat(registry.evictFinished()).isZero();

        clock.advance(Duration.ofHours(2));
        assertThat(registry.evictFinished()).isEqualTo(1);
        assertThat(registry.find("done")).isEmpty();
        assertThat(registry.find("running")).containsSame(running);
        assertThat(registry.find(null)).isEmpty();
    }
}
