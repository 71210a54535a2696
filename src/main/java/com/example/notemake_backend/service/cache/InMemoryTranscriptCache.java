package com.example.notemake_backend.service.cache;

import com.example.notemake_backend.dto.pipeline.CacheEntry;
import com.example.notemake_backend.dto.pipeline.CacheKey;
import com.example.notemake_backend.dto.pipeline.CacheStats;
import com.example.notemake_backend.dto.pipeline.TranscriptResult;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Process-local cache. Entries do not survive a restart.
 */
public class InMemoryTranscriptCache implements TranscriptCache {

    private final ConcurrentMap<CacheKey, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration ttl;
    private final TranscriptPayloadCodec codec;

    public InMemoryTranscriptCache(Clock clock, Duration ttl, TranscriptPayloadCodec codec) {
        this.clock = clock;
        this.ttl = ttl;
        this.codec = codec;
    }

    public InMemoryTranscriptCache(Clock clock, Duration ttl) {
        this(clock, ttl, TranscriptPayloadCodec.standalone());
    }

    @Override
    public Optional<CacheEntry> get(CacheKey key) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        if (!entry.validAt(now)) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    @Override
    public CacheEntry put(CacheKey key, TranscriptResult payload) {
        return entries.compute(key, (k, old) -> CacheEntry.create(k, payload, clock.instant(), ttl));
    }

    @Override
    public CacheStats stats() {
        Instant now = clock.instant();
        long size = 0;
        Instant oldest = null;
        int count = 0;
        for (CacheEntry e : entries.values()) {
            count++;
            size += codec.sizeOf(e.payload());
            if (oldest == null || e.createdAt().isBefore(oldest)) {
                oldest = e.createdAt();
            }
        }
        return new CacheStats(count, size, oldest == null ? Duration.ZERO : Duration.between(oldest, now));
    }

    @Override
    public int clear(Predicate<CacheEntry> filter) {
        AtomicInteger removed = new AtomicInteger();
        entries.forEach((k, v) -> {
            if ((filter == null || filter.test(v)) && entries.remove(k, v)) {
                removed.incrementAndGet();
            }
        });
        return removed.get();
    }

    @Override
    public int purgeExpired() {
        Instant now = clock.instant();
        return clear(e -> !e.validAt(now));
    }
}
