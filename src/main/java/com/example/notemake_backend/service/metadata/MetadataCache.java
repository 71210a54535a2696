package com.example.notemake_backend.service.metadata;

import com.example.notemake_backend.dto.pipeline.VideoMetadata;

import java.util.Optional;

/**
 * Stores resolved metadata per video id until its time-to-live runs out.
 */
public interface MetadataCache {

    Optional<VideoMetadata> get(String videoId);

    void put(String videoId, VideoMetadata metadata);

    int purgeExpired();
}
