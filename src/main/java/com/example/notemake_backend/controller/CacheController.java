package com.example.notemake_backend.controller;

import com.example.notemake_backend.config.CacheProperties;
import com.example.notemake_backend.dto.pipeline.CacheEntry;
import com.example.notemake_backend.dto.web.CacheStatsResponse;
import com.example.notemake_backend.service.cache.TranscriptCache;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.function.Predicate;

@RestController
@RequestMapping("/v1/cache")
public class CacheController {

    private final TranscriptCache cache;
    private final CacheProperties properties;
    private final Clock clock;

    public CacheController(TranscriptCache cache, CacheProperties properties, Clock clock) {
        this.cache = cache;
        this.properties = properties;
        this.clock = clock;
    }

    @GetMapping("/stats")
    public CacheStatsResponse stats() {
        return CacheStatsResponse.from(cache.stats(), properties.getTtl().toDays());
    }

    /**
     * Without parameters clears everything. {@code videoId} limits to one video, {@code expiredOnly} to stale entries.
     */
    @DeleteMapping
    public Map<String, Integer> clear(@RequestParam(name = "videoId", required = false) String videoId,
                                      @RequestParam(name = "expiredOnly", defaultValue = "false") boolean expiredOnly) {
        int removed;
        if (videoId == null || videoId.isBlank()) {
            removed = expiredOnly ? cache.purgeExpired() : cache.clear();
        } else {
            Instant now = clock.instant();
            Predicate<CacheEntry> filter = e -> videoId.equals(e.key().videoId());
            if (expiredOnly) {
                filter = filter.and(e -> !e.validAt(now));
            }
            removed = cache.clear(filter);
        }
        return Map.of("removed", removed);
    }
}
