package com.example.notemake_backend.service.metadata;

import com.example.notemake_backend.dto.pipeline.VideoMetadata;
import com.example.notemake_backend.dto.pipeline.VideoRef;
import com.example.notemake_backend.exception.PipelineException;
import com.example.notemake_backend.exception.StorageUnavailableException;
import com.example.notemake_backend.util.ErrorKind;
import com.example.notemake_backend.util.VideoIdParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.annotation.AnnotationAwareOrderComparator;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Resolves video metadata by merging every provider's partial answer. Merged results go to the {@link MetadataCache};
 * a cache that cannot be reached only costs a provider round trip.
 */
@Service
public class MetadataService {
    private static final Logger LOGGER = LoggerFactory.getLogger(MetadataService.class);

    private final List<MetadataProvider> providers;
    private final MetadataCache cache;

    @Autowired
    public MetadataService(List<MetadataProvider> providers, MetadataCache cache) {
        this.providers = new ArrayList<>(providers);
        AnnotationAwareOrderComparator.sort(this.providers);
        this.cache = cache;
    }

    /**
     * @throws PipelineException {@code NOT_FOUND} when no provider knows the video, otherwise the last provider
     *                           failure (e.g. {@code NETWORK}) when every provider failed.
     */
    public VideoMetadata resolve(VideoRef ref) {
        String videoId = ref.videoId();
        Optional<VideoMetadata> cached = cached(videoId);
        if (cached.isPresent()) {
            return cached.get();
        }

        VideoMetadata result = VideoMetadata.empty(videoId, ref.watchUrl());
        boolean hasProviderResponse = false;
        PipelineException lastFailure = null;
        boolean notFound = false;

        for (MetadataProvider provider : providers) {
            try {
                Optional<VideoMetadata> partial = provider.resolve(ref);
                if (partial.isPresent()) {
                    result = result.merge(partial.get());
                    hasProviderResponse = true;
                }
            } catch (PipelineException ex) {
                lastFailure = ex;
                notFound |= ex.getKind() == ErrorKind.NOT_FOUND;
                LOGGER.warn("Metadata provider {} failed videoId={} kind={}: {}",
                        provider.getClass().getSimpleName(), videoId, ex.getKind(), ex.getMessage());
            }
        }

        if (!hasProviderResponse || !result.hasAnyData()) {
            if (notFound || lastFailure == null) {
                throw new PipelineException(ErrorKind.NOT_FOUND, "Video not found: " + videoId, lastFailure);
            }
            throw new PipelineException(lastFailure.getKind(), "Metadata unavailable for " + videoId + ": "
                    + lastFailure.getMessage(), lastFailure);
        }

        try {
            cache.put(videoId, result);
        } catch (StorageUnavailableException e) {
            LOGGER.warn("METADATA cache write skipped videoId={}: {}", videoId, e.getMessage());
        }
        return result;
    }

    public VideoMetadata resolveUrl(String rawUrl) {
        return resolve(VideoRef.of(VideoIdParser.requireVideoId(rawUrl)));
    }

    private Optional<VideoMetadata> cached(String videoId) {
        try {
            return cache.get(videoId);
        } catch (StorageUnavailableException e) {
            LOGGER.warn("METADATA cache read skipped videoId={}: {}", videoId, e.getMessage());
            return Optional.empty();
        }
    }
}
