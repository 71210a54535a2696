package com.example.notemake_backend.service.cache;

import com.example.notemake_backend.dto.pipeline.CacheEntry;
import com.example.notemake_backend.dto.pipeline.CacheKey;
import com.example.notemake_backend.dto.pipeline.CacheStats;
import com.example.notemake_backend.dto.pipeline.TranscriptResult;
import com.example.notemake_backend.exception.StorageUnavailableException;
import com.example.notemake_backend.model.TranscriptCacheEntry;
import com.example.notemake_backend.repository.TranscriptCacheEntryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Durable cache backed by the {@code transcript_cache_entry} table. Rows are keyed by the SHA-256 digest of the
 * cache key; timestamps are stored at millisecond precision so a save/load cycle is exact.
 */
public class JpaTranscriptCache implements TranscriptCache {
    private static final Logger LOGGER = LoggerFactory.getLogger(JpaTranscriptCache.class);
    private static final int LOCK_STRIPES = 64;

    private final TranscriptCacheEntryRepository repository;
    private final TransactionTemplate tx;
    private final TranscriptPayloadCodec codec;
    private final Clock clock;
    private final Duration ttl;
    private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];

    public JpaTranscriptCache(TranscriptCacheEntryRepository repository,
                              TransactionTemplate tx,
                              TranscriptPayloadCodec codec,
                              Clock clock,
                              Duration ttl) {
        this.repository = repository;
        this.tx = tx;
        this.codec = codec;
        this.clock = clock;
        this.ttl = ttl;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    @Override
    public Optional<CacheEntry> get(CacheKey key) {
        Optional<TranscriptCacheEntry> row = storage("read", () -> repository.findById(key.digest()));
        if (row.isEmpty()) {
            return Optional.empty();
        }
        TranscriptCacheEntry e = row.get();
        if (!now().isBefore(e.getExpiresAt())) {
            LOGGER.debug("CACHE expired key={} expiresAt={}", key.canonical(), e.getExpiresAt());
            return Optional.empty();
        }
        TranscriptResult payload;
        try {
            payload = codec.decode(e.getPayload());
        } catch (IllegalStateException ex) {
            LOGGER.warn("CACHE unreadable entry key={} treating as miss: {}", key.canonical(), ex.getMessage());
            return Optional.empty();
        }
        return Optional.of(new CacheEntry(key, payload, e.getCreatedAt(), e.getExpiresAt()));
    }

    @Override
    public CacheEntry put(CacheKey key, TranscriptResult payload) {
        String json = codec.encode(payload);
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            CacheEntry entry = CacheEntry.create(key, payload, now(), ttl);
            storage("write", () -> tx.execute(status -> {
                TranscriptCacheEntry row = repository.findById(key.digest())
                        .orElseGet(() -> new TranscriptCacheEntry(key.digest(), key.videoId(), key.language(),
                                key.mode(), key.schemaVersion()));
                row.setPayload(json);
                row.setPayloadSize(json.getBytes(StandardCharsets.UTF_8).length);
                row.setCreatedAt(entry.createdAt());
                row.setExpiresAt(entry.expiresAt());
                return repository.save(row);
            }));
            LOGGER.debug("CACHE put key={} expiresAt={}", key.canonical(), entry.expiresAt());
            return entry;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CacheStats stats() {
        return storage("stats", () -> {
            long count = repository.count();
            if (count == 0) {
                return CacheStats.empty();
            }
            Instant oldest = repository.oldestCreatedAt();
            Duration age = oldest == null ? Duration.ZERO : Duration.between(oldest, now());
            return new CacheStats(count, repository.totalPayloadSize(), age);
        });
    }

    @Override
    public int clear(Predicate<CacheEntry> filter) {
        return storage("clear", () -> tx.execute(status -> {
            if (filter == null) {
                long n = repository.count();
                repository.deleteAllInBatch();
                return (int) n;
            }
            List<TranscriptCacheEntry> doomed = new ArrayList<>();
            for (TranscriptCacheEntry row : repository.findAll()) {
                if (filter.test(toEntry(row))) {
                    doomed.add(row);
                }
            }
            repository.deleteAllInBatch(doomed);
            return doomed.size();
        }));
    }

    @Override
    public int purgeExpired() {
        Integer removed = storage("purge", () -> tx.execute(status -> repository.deleteExpired(now())));
        return removed == null ? 0 : removed;
    }

    private CacheEntry toEntry(TranscriptCacheEntry row) {
        CacheKey key = new CacheKey(row.getVideoId(), row.getLanguage(), row.getMode(), row.getSchemaVersion());
        TranscriptResult payload = null;
        try {
            payload = codec.decode(row.getPayload());
        } catch (IllegalStateException ex) {
            LOGGER.debug("CACHE unreadable payload key={}", row.getCacheKey());
        }
        return new CacheEntry(key, payload, row.getCreatedAt(), row.getExpiresAt());
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private ReentrantLock lockFor(CacheKey key) {
        return locks[Math.floorMod(key.hashCode(), LOCK_STRIPES)];
    }

    private <T> T storage(String op, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException | TransactionException e) {
            throw new StorageUnavailableException("Cache " + op + " failed: " + e.getMessage(), e);
        }
    }
}
