package com.example.notemake_backend.config;

import com.example.notemake_backend.dto.pipeline.CacheStats;
import com.example.notemake_backend.exception.StorageUnavailableException;
import com.example.notemake_backend.service.cache.TranscriptCache;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

@Configuration
public class HealthConfig {

    @Bean
    public HealthIndicator ffmpegHealth(@Value("${ffmpeg.binary:ffmpeg}") String ffmpegBin) {
        return () -> binaryHealth("ffmpeg", ffmpegBin, "-version");
    }

    @Bean
    public HealthIndicator ytDlpHealth(@Value("${downloader.ytdlp.bin:yt-dlp}") String ytdlp) {
        return () -> binaryHealth("ytDlp", ytdlp, "--version");
    }

    @Bean
    public HealthIndicator transcriptCacheHealth(TranscriptCache cache) {
        return () -> {
            try {
                CacheStats stats = cache.stats();
                return Health.up()
                        .withDetail("entries", stats.entryCount())
                        .withDetail("sizeBytes", stats.totalSizeBytes())
                        .build();
            } catch (StorageUnavailableException e) {
                return Health.down(e).withDetail("cache", "unavailable").build();
            }
        };
    }

    private Health binaryHealth(String name, String bin, String versionFlag) {
        try {
            var p = new ProcessBuilder(bin, versionFlag).redirectErrorStream(true).start();
            p.getInputStream().transferTo(java.io.OutputStream.nullOutputStream());
            if (p.waitFor(5, TimeUnit.SECONDS) && p.exitValue() == 0) {
                return Health.up().withDetail(name, "ok").build();
            }
            p.destroyForcibly();
        } catch (Exception e) {
            return Health.down().withDetail(name, "missing").withDetail("error", e.getMessage()).build();
        }
        return Health.down().withDetail(name, "missing").build();
    }
}
