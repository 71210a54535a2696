package com.example.notemake_backend.dto.pipeline;

import java.time.Duration;

/**
 * Read-only cache introspection.
 *
 * @param oldestEntryAge age of the oldest stored entry, {@link Duration#ZERO} when the cache is empty.
 */
public record CacheStats(long entryCount, long totalSizeBytes, Duration oldestEntryAge) {

    public static CacheStats empty() {
        return new CacheStats(0, 0, Duration.ZERO);
    }
}
