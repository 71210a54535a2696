package com.example.notemake_backend.service.metadata;

import com.example.notemake_backend.dto.pipeline.VideoMetadata;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class InMemoryMetadataCache implements MetadataCache {

    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration ttl;

    public InMemoryMetadataCache(Clock clock, Duration ttl) {
        this.clock = clock;
        this.ttl = ttl;
    }

    @Override
    public Optional<VideoMetadata> get(String videoId) {
        Entry entry = entries.get(videoId);
        if (entry == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(entry.expiresAt())) {
            entries.remove(videoId, entry);
            return Optional.empty();
        }
        return Optional.of(entry.metadata());
    }

    @Override
    public void put(String videoId, VideoMetadata metadata) {
        entries.put(videoId, new Entry(metadata, clock.instant().plus(ttl)));
    }

    @Override
    public int purgeExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(e -> !now.isBefore(e.expiresAt()));
        return before - entries.size();
    }

    private record Entry(VideoMetadata metadata, Instant expiresAt) {
    }
}
