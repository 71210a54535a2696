package com.example.notemake_backend.dto.pipeline;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable cache record. {@code expiresAt = createdAt + TTL}; the entry is valid while {@code now < expiresAt}.
 */
public record CacheEntry(CacheKey key, TranscriptResult payload, Instant createdAt, Instant expiresAt) {

    public CacheEntry {
        if (key == null || createdAt == null || expiresAt == null) {
            throw new IllegalArgumentException("key, createdAt and expiresAt are required");
        }
        if (!expiresAt.isAfter(createdAt)) {
            throw new IllegalArgumentException("expiresAt must be after createdAt");
        }
    }

    public static CacheEntry create(CacheKey key, TranscriptResult payload, Instant createdAt, Duration ttl) {
        return new CacheEntry(key, payload, createdAt, createdAt.plus(ttl));
    }

    public boolean validAt(Instant now) {
        return now.isBefore(expiresAt);
    }

    public Duration ageAt(Instant now) {
        return Duration.between(createdAt, now);
    }
}
