package com.example.notemake_backend.service.cache;

import com.example.notemake_backend.config.CacheProperties;
import com.example.notemake_backend.exception.StorageUnavailableException;
import com.example.notemake_backend.service.metadata.MetadataCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Removes expired cache entries on startup and then periodically.
 */
@Service
public class CacheCleanupService {
    private static final Logger LOGGER = LoggerFactory.getLogger(CacheCleanupService.class);

    private final TranscriptCache cache;
    private final MetadataCache metadataCache;
    private final CacheProperties properties;

    public CacheCleanupService(TranscriptCache cache, MetadataCache metadataCache, CacheProperties properties) {
        this.cache = cache;
        this.metadataCache = metadataCache;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        if (properties.isPurgeOnStartup()) {
            purge();
        }
    }

    @Scheduled(cron = "${notemake.cache.purge-cron:0 17 3 * * *}")
    public int purge() {
        try {
            int removed = cache.purgeExpired();
            int metadataRemoved = metadataCache.purgeExpired();
            if (removed > 0 || metadataRemoved > 0) {
                LOGGER.info("CACHE purge removed={} metadataRemoved={}", removed, metadataRemoved);
            }
            return removed;
        } catch (StorageUnavailableException e) {
            LOGGER.warn("CACHE purge skipped, storage unavailable: {}", e.getMessage());
            return 0;
        }
    }
}
