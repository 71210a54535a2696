package com.example.notemake_backend.service.batch;

import com.example.notemake_backend.dto.pipeline.ErrorDetail;
import com.example.notemake_backend.dto.pipeline.VideoRef;

import java.util.List;
import java.util.Map;

/**
 * Expanded batch input.
 *
 * @param preFailed input positions already known to fail (e.g. private playlist entries), keyed by index.
 */
public record BatchPlan(List<VideoRef> refs, Map<Integer, ErrorDetail> preFailed) {

    public BatchPlan {
        refs = List.copyOf(refs);
        preFailed = preFailed == null ? Map.of() : Map.copyOf(preFailed);
    }

    public static BatchPlan of(List<VideoRef> refs) {
        return new BatchPlan(refs, Map.of());
    }

    public int size() {
        return refs.size();
    }
}
