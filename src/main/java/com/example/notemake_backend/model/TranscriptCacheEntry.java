package com.example.notemake_backend.model;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * Persisted cache record. The payload is the JSON form of a transcript result.
 */
@Entity
@Table(name = "transcript_cache_entry")
public class TranscriptCacheEntry {
    @Id
    @Column(name = "cache_key", nullable = false, updatable = false, length = 64)
    private String cacheKey;
    @Column(name = "video_id", nullable = false, length = 64)
    private String videoId;
    @Column(name = "language", nullable = false, length = 16)
    private String language;
    @Column(name = "extraction_mode", nullable = false, length = 32)
    private String mode;
    @Column(name = "schema_version", nullable = false)
    private int schemaVersion;
    @Lob
    @Column(name = "payload", nullable = false)
    private String payload;
    @Column(name = "payload_size", nullable = false)
    private long payloadSize;
    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    protected TranscriptCacheEntry() {}

    public TranscriptCacheEntry(String cacheKey, String videoId, String language, String mode, int schemaVersion) {
        this.cacheKey = cacheKey;
        this.videoId = videoId;
        this.language = language;
        this.mode = mode;
        this.schemaVersion = schemaVersion;
    }

    public String getCacheKey() { return cacheKey; }
    public String getVideoId() { return videoId; }
    public String getLanguage() { return language; }
    public String getMode() { return mode; }
    public int getSchemaVersion() { return schemaVersion; }
    public String getPayload() { return payload; }
    public void setPayload(String payload) { this.payload = payload; }
    public long getPayloadSize() { return payloadSize; }
    public void setPayloadSize(long payloadSize) { this.payloadSize = payloadSize; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public Instant getExpiresAt() { return expiresAt; }
    public void setExpiresAt(Instant expiresAt) { this.expiresAt = expiresAt; }
}
