package com.example.notemake_backend.service.metadata;

import com.example.notemake_backend.dto.pipeline.VideoMetadata;
import com.example.notemake_backend.dto.pipeline.VideoRef;

import java.util.Optional;

/**
 * One metadata source. Providers run in {@link org.springframework.core.annotation.Order} and their partial results
 * are merged field by field.
 */
public interface MetadataProvider {

    /**
     * @return partial metadata, or empty when this provider knows nothing about the video.
     * @throws MetadataAccessException when the source fails.
     */
    Optional<VideoMetadata> resolve(VideoRef ref);
}
