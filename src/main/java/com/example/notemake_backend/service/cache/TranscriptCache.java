package com.example.notemake_backend.service.cache;

import com.example.notemake_backend.dto.pipeline.CacheEntry;
import com.example.notemake_backend.dto.pipeline.CacheKey;
import com.example.notemake_backend.dto.pipeline.CacheStats;
import com.example.notemake_backend.dto.pipeline.TranscriptResult;
import com.example.notemake_backend.exception.StorageUnavailableException;

import java.util.Optional;
import java.util.function.Predicate;

/**
 * Key to transcript store with a fixed time-to-live. Implementations are safe for concurrent use and serialize
 * writes to the same key.
 */
public interface TranscriptCache {

    /**
     * @return the entry when present and unexpired; empty on miss or expiry.
     * @throws StorageUnavailableException when the storage medium cannot be read.
     */
    Optional<CacheEntry> get(CacheKey key);

    /**
     * Creates or replaces the entry for {@code key} with a fresh creation time.
     *
     * @throws StorageUnavailableException when the storage medium cannot be written.
     */
    CacheEntry put(CacheKey key, TranscriptResult payload);

    CacheStats stats();

    /**
     * Removes every entry (expired or not) matching {@code filter}; a {@code null} filter clears everything.
     *
     * @return number of removed entries.
     */
    int clear(Predicate<CacheEntry> filter);

    default int clear() {
        return clear(null);
    }

    /**
     * Drops entries whose expiry has passed.
     */
    int purgeExpired();
}
