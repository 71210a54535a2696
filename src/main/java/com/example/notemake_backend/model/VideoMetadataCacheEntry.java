package com.example.notemake_backend.model;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * Persisted metadata lookup, one row per video.
 */
@Entity
@Table(name = "video_metadata_cache")
public class VideoMetadataCacheEntry {
    @Id
    @Column(name = "video_id", nullable = false, updatable = false, length = 64)
    private String videoId;
    @Lob
    @Column(name = "payload", nullable = false)
    private String payload;
    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    protected VideoMetadataCacheEntry() {}

    public VideoMetadataCacheEntry(String videoId) {
        this.videoId = videoId;
    }

    public String getVideoId() { return videoId; }
    public String getPayload() { return payload; }
    public void setPayload(String payload) { this.payload = payload; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public Instant getExpiresAt() { return expiresAt; }
    public void setExpiresAt(Instant expiresAt) { this.expiresAt = expiresAt; }
}
