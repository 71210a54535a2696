package com.example.notemake_backend.service.metadata;

import com.example.notemake_backend.dto.pipeline.VideoMetadata;
import com.example.notemake_backend.exception.StorageUnavailableException;
import com.example.notemake_backend.model.VideoMetadataCacheEntry;
import com.example.notemake_backend.repository.VideoMetadataCacheEntryRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Durable metadata cache in the {@code video_metadata_cache} table, so lookups survive restarts.
 */
public class JpaMetadataCache implements MetadataCache {
    private static final Logger LOGGER = LoggerFactory.getLogger(JpaMetadataCache.class);

    private final VideoMetadataCacheEntryRepository repository;
    private final TransactionTemplate tx;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final Duration ttl;

    public JpaMetadataCache(VideoMetadataCacheEntryRepository repository,
                            TransactionTemplate tx,
                            ObjectMapper objectMapper,
                            Clock clock,
                            Duration ttl) {
        this.repository = repository;
        this.tx = tx;
        this.mapper = objectMapper.copy()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.clock = clock;
        this.ttl = ttl;
    }

    @Override
    public Optional<VideoMetadata> get(String videoId) {
        Optional<VideoMetadataCacheEntry> row = storage("read", () -> repository.findById(videoId));
        if (row.isEmpty() || !now().isBefore(row.get().getExpiresAt())) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(row.get().getPayload(), VideoMetadata.class));
        } catch (JsonProcessingException e) {
            LOGGER.warn("METADATA unreadable cache entry videoId={} treating as miss: {}", videoId, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    @Override
    public void put(String videoId, VideoMetadata metadata) {
        String json;
        try {
            json = mapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize metadata: " + e.getOriginalMessage(), e);
        }
        Instant now = now();
        storage("write", () -> tx.execute(status -> {
            VideoMetadataCacheEntry row = repository.findById(videoId)
                    .orElseGet(() -> new VideoMetadataCacheEntry(videoId));
            row.setPayload(json);
            row.setCreatedAt(now);
            row.setExpiresAt(now.plus(ttl));
            return repository.save(row);
        }));
    }

    @Override
    public int purgeExpired() {
        Integer removed = storage("purge", () -> tx.execute(status -> repository.deleteExpired(now())));
        return removed == null ? 0 : removed;
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private <T> T storage(String op, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException | TransactionException e) {
            throw new StorageUnavailableException("Metadata cache " + op + " failed: " + e.getMessage(), e);
        }
    }
}
