package com.example.notemake_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Retry and timeout policy for collaborator calls made while building notes for one video.
 */
@ConfigurationProperties(prefix = "notemake.extraction")
public class ExtractionProperties {

    private int captionAttempts = 3;
    private int metadataAttempts = 3;
    private Duration initialBackoff = Duration.ofMillis(500);
    private Duration maxBackoff = Duration.ofSeconds(5);
    private Duration captionTimeout = Duration.ofSeconds(60);
    private Duration audioTimeout = Duration.ofMinutes(45);
    private Duration metadataTimeout = Duration.ofSeconds(60);
    private Duration summaryTimeout = Duration.ofSeconds(120);
    private String defaultModelSize = "base";

    public int getCaptionAttempts() {
        return captionAttempts;
    }

    public void setCaptionAttempts(int captionAttempts) {
        this.captionAttempts = captionAttempts;
    }

    public int getMetadataAttempts() {
        return metadataAttempts;
    }

    public void setMetadataAttempts(int metadataAttempts) {
        this.metadataAttempts = metadataAttempts;
    }

    public Duration getInitialBackoff() {
        return initialBackoff;
    }

    public void setInitialBackoff(Duration initialBackoff) {
        this.initialBackoff = initialBackoff;
    }

    public Duration getMaxBackoff() {
        return maxBackoff;
    }

    public void setMaxBackoff(Duration maxBackoff) {
        this.maxBackoff = maxBackoff;
    }

    public Duration getCaptionTimeout() {
        return captionTimeout;
    }

    public void setCaptionTimeout(Duration captionTimeout) {
        this.captionTimeout = captionTimeout;
    }

    public Duration getAudioTimeout() {
        return audioTimeout;
    }

    public void setAudioTimeout(Duration audioTimeout) {
        this.audioTimeout = audioTimeout;
    }

    public Duration getMetadataTimeout() {
        return metadataTimeout;
    }

    public void setMetadataTimeout(Duration metadataTimeout) {
        this.metadataTimeout = metadataTimeout;
    }

    public Duration getSummaryTimeout() {
        return summaryTimeout;
    }

    public void setSummaryTimeout(Duration summaryTimeout) {
        this.summaryTimeout = summaryTimeout;
    }

    public String getDefaultModelSize() {
        return defaultModelSize;
    }

    public void setDefaultModelSize(String defaultModelSize) {
        this.defaultModelSize = defaultModelSize;
    }
}
