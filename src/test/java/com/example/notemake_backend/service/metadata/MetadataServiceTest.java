package com.example.notemake_backend.service.metadata;

import com.example.notemake_backend.dto.pipeline.VideoMetadata;
import com.example.notemake_backend.dto.pipeline.VideoRef;
import com.example.notemake_backend.exception.PipelineException;
import com.example.notemake_backend.exception.StorageUnavailableException;
import com.example.notemake_backend.support.MutableClock;
import com.example.notemake_backend.util.ErrorKind;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class MetadataServiceTest {

    private static MetadataCache memoryCache() {
        return new InMemoryMetadataCache(Clock.systemUTC(), Duration.ofDays(30));
    }

    private static VideoMetadata partial(String videoId, String title, String thumbnail) {
        return new VideoMetadata(videoId, null, title, null, null, null, null, null, null, null, null, thumbnail,
                null, null, null);
    }

    @Test
    void resolveCachesResultsForSameVideo() {
        AtomicInteger calls = new AtomicInteger();
        MetadataProvider provider = ref -> {
            calls.incrementAndGet();
            return Optional.of(partial(ref.videoId(), "title", null));
        };
        MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        MetadataService service = new MetadataService(List.of(provider), new InMemoryMetadataCache(clock, Duration.ofDays(30)));

        assertEquals("title", service.resolve(VideoRef.of("dQw4w9WgXcQ")).title());
        assertEquals("title", service.resolve(VideoRef.of("dQw4w9WgXcQ", "de")).title());
        assertEquals(1, calls.get());

        clock.advance(Duration.ofDays(29));
        service.resolve(VideoRef.of("dQw4w9WgXcQ"));
        assertEquals(1, calls.get());

        clock.advance(Duration.ofDays(2));
        service.resolve(VideoRef.of("dQw4w9WgXcQ"));
        assertEquals(2, calls.get());
    }

    @Test
    void unreachableCacheFallsBackToProviders() {
        MetadataCache down = new MetadataCache() {
            @Override
            public Optional<VideoMetadata> get(String videoId) {
                throw new StorageUnavailableException("db down", new IllegalStateException("refused"));
            }

            @Override
            public void put(String videoId, VideoMetadata metadata) {
                throw new StorageUnavailableException("db down", new IllegalStateException("refused"));
            }

            @Override
            public int purgeExpired() {
                return 0;
            }
        };
        MetadataService service = new MetadataService(
                List.<MetadataProvider>of(ref -> Optional.of(partial(ref.videoId(), "hello", null))), down);

        assertEquals("hello", service.resolve(VideoRef.of("dQw4w9WgXcQ")).title());
    }

    @Test
    void resolveMergesProviderResponses() {
        MetadataProvider titleProvider = ref -> Optional.of(partial(ref.videoId(), "hello", null));
        MetadataProvider thumbProvider = ref -> Optional.of(partial(ref.videoId(), "ignored", "thumb"));

        MetadataService service = new MetadataService(List.of(titleProvider, thumbProvider), memoryCache());
        VideoMetadata result = service.resolve(VideoRef.of("dQw4w9WgXcQ"));

        assertEquals("hello", result.title());
        assertEquals("thumb", result.thumbnail());
        assertEquals("https://www.youtube.com/watch?v=dQw4w9WgXcQ", result.url());
    }

    @Test
    void failingProviderIsSkippedWhenAnotherAnswers() {
        MetadataProvider broken = ref -> {
            throw new MetadataAccessException(ErrorKind.NETWORK, "down", null);
        };
        MetadataProvider working = ref -> Optional.of(partial(ref.videoId(), "hello", null));

        MetadataService service = new MetadataService(List.of(broken, working), memoryCache());

        assertEquals("hello", service.resolve(VideoRef.of("dQw4w9WgXcQ")).title());
    }

    @Test
    void allProvidersFailingKeepsLastFailureKind() {
        MetadataProvider broken = ref -> {
            throw new MetadataAccessException(ErrorKind.NETWORK, "down", null);
        };
        MetadataService service = new MetadataService(List.of(broken), memoryCache());

        PipelineException ex = assertThrows(PipelineException.class, () -> service.resolve(VideoRef.of("dQw4w9WgXcQ")));
        assertEquals(ErrorKind.NETWORK, ex.getKind());
    }

    @Test
    void unknownVideoIsNotFound() {
        MetadataService service = new MetadataService(List.<MetadataProvider>of(ref -> Optional.empty()), memoryCache());

        PipelineException ex = assertThrows(PipelineException.class, () -> service.resolve(VideoRef.of("dQw4w9WgXcQ")));
        assertEquals(ErrorKind.NOT_FOUND, ex.getKind());
    }

    @Test
    void resolveUrlRejectsNonVideoUrls() {
        MetadataService service = new MetadataService(List.of(), memoryCache());

        PipelineException ex = assertThrows(PipelineException.class, () -> service.resolveUrl("https://example.com/x"));
        assertEquals(ErrorKind.INVALID_REFERENCE, ex.getKind());
    }

    @Test
    void ytDlpInfoIsMappedToMetadata() throws Exception {
        JsonNode info = new ObjectMapper().readTree("""
                {"title":"Caching Deep Dive","uploader":"Backend Weekly","upload_date":"20240314","duration":600.4,
                 "view_count":12345,"tags":["cache"],"chapters":[{"title":"Intro","start_time":0,"end_time":8}]}""");

        VideoMetadata md = YtDlpMetadataProvider.toMetadata(VideoRef.of("dQw4w9WgXcQ"), info);

        assertEquals("Backend Weekly", md.channel());
        assertEquals(LocalDate.of(2024, 3, 14), md.publishedAt());
        assertEquals(600L, md.durationSec());
        assertEquals(12345L, md.viewCount());
        assertNull(md.likeCount());
        assertEquals(List.of("cache"), md.tags());
        assertEquals("Intro", md.chapters().get(0).title());
    }
}
