package com.example.notemake_backend.service.cache;

import com.example.notemake_backend.dto.pipeline.CacheEntry;
import com.example.notemake_backend.dto.pipeline.CacheKey;
import com.example.notemake_backend.dto.pipeline.CacheStats;
import com.example.notemake_backend.support.MutableClock;
import com.example.notemake_backend.support.Transcripts;
import com.example.notemake_backend.util.ExtractionMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryTranscriptCacheTest {

    private static final Duration TTL = Duration.ofDays(30);
    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private MutableClock clock;
    private InMemoryTranscriptCache cache;
    private final CacheKey key = new CacheKey("dQw4w9WgXcQ", "en", null, 1);

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        cache = new InMemoryTranscriptCache(clock, TTL);
    }

    @Test
    void entryIsValidUntilJustBeforeExpiry() {
        CacheEntry stored = cache.put(key, Transcripts.sample(ExtractionMode.CAPTIONS));
        assertThat(stored.expiresAt()).isEqualTo(T0.plus(TTL));

        clock.set(T0.plus(TTL).minusSeconds(1));
        assertThat(cache.get(key)).isPresent();

        clock.set(T0.plus(TTL).plusSeconds(1));
        assertThat(cache.get(key)).isEmpty();
    }

    @Test
    void entryExpiresExactlyAtExpiresAt() {
        cache.put(key, Transcripts.sample(ExtractionMode.CAPTIONS));
        clock.set(T0.plus(TTL));

        assertThat(cache.get(key)).isEmpty();
    }

    @Test
    void putOverwritesWithFreshCreationTime() {
        cache.put(key, Transcripts.sample(ExtractionMode.CAPTIONS));
        clock.advance(Duration.ofDays(5));
        CacheEntry second = cache.put(key, Transcripts.sample(ExtractionMode.AUDIO));

        assertThat(second.createdAt()).isEqualTo(T0.plus(Duration.ofDays(5)));
        assertThat(cache.get(key)).get().extracting(e -> e.payload().sourceMode()).isEqualTo(ExtractionMode.AUDIO);
        assertThat(cache.stats().entryCount()).isEqualTo(1);
    }

    @Test
    void differentKeyPartsDoNotCollide() {
        cache.put(key, Transcripts.sample(ExtractionMode.CAPTIONS));

        assertThat(cache.get(new CacheKey("dQw4w9WgXcQ", "de", null, 1))).isEmpty();
        assertThat(cache.get(new CacheKey("dQw4w9WgXcQ", "en", "AUDIO", 1))).isEmpty();
        assertThat(cache.get(new CacheKey("dQw4w9WgXcQ", "en", null, 2))).isEmpty();
    }

    @Test
    void clearWithPredicateRemovesOnlyMatchingEntries() {
        CacheKey other = new CacheKey("aaaaaaaaaaa", "en", null, 1);
        cache.put(key, Transcripts.sample(ExtractionMode.CAPTIONS));
        cache.put(other, Transcripts.sample(ExtractionMode.CAPTIONS));

        int removed = cache.clear(e -> e.key().videoId().equals("aaaaaaaaaaa"));

        assertThat(removed).isEqualTo(1);
        assertThat(cache.get(key)).isPresent();
        assertThat(cache.get(other)).isEmpty();
    }

    @Test
    void purgeExpiredDropsOnlyExpiredEntries() {
        cache.put(key, Transcripts.sample(ExtractionMode.CAPTIONS));
        clock.advance(Duration.ofDays(20));
        CacheKey fresh = new CacheKey("aaaaaaaaaaa", "en", null, 1);
        cache.put(fresh, Transcripts.sample(ExtractionMode.CAPTIONS));
        clock.advance(Duration.ofDays(15));

        assertThat(cache.purgeExpired()).isEqualTo(1);
        assertThat(cache.get(fresh)).isPresent();
    }

    @Test
    void statsReportCountSizeAndOldestAge() {
        assertThat(cache.stats()).isEqualTo(CacheStats.empty());

        cache.put(key, Transcripts.sample(ExtractionMode.CAPTIONS));
        clock.advance(Duration.ofHours(2));
        cache.put(new CacheKey("aaaaaaaaaaa", "en", null, 1), Transcripts.sample(ExtractionMode.CAPTIONS));

        CacheStats stats = cache.stats();
        assertThat(stats.entryCount()).isEqualTo(2);
        assertThat(stats.totalSizeBytes()).isPositive();
        assertThat(stats.oldestEntryAge()).isEqualTo(Duration.ofHours(2));
    }
}
