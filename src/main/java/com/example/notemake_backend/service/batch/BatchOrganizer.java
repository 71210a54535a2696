package com.example.notemake_backend.service.batch;

import com.example.notemake_backend.dto.pipeline.PipelineOutcome;
import com.example.notemake_backend.dto.pipeline.VideoMetadata;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Groups batch outcomes for display. Groups keep first-seen order; outcomes without the grouping field land in
 * {@link #UNKNOWN}.
 */
@Component
public class BatchOrganizer {

    public static final String UNKNOWN = "Unknown";

    public enum GroupBy {
        CHANNEL,
        DATE;

        public static GroupBy parse(String value) {
            try {
                return GroupBy.valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException | NullPointerException e) {
                throw new IllegalArgumentException("Unknown groupBy: " + value, e);
            }
        }
    }

    public Map<String, List<PipelineOutcome>> organize(List<PipelineOutcome> outcomes, GroupBy groupBy) {
        return switch (groupBy) {
            case CHANNEL -> group(outcomes, md -> md.channel());
            case DATE -> group(outcomes, md -> md.publishedAt() == null ? null : md.publishedAt().toString());
        };
    }

    private static Map<String, List<PipelineOutcome>> group(List<PipelineOutcome> outcomes,
                                                            Function<VideoMetadata, String> field) {
        Map<String, List<PipelineOutcome>> out = new LinkedHashMap<>();
        for (PipelineOutcome o : outcomes) {
            String key = null;
            if (o.transcript() != null && o.transcript().metadata() != null) {
                key = field.apply(o.transcript().metadata());
            }
            out.computeIfAbsent(key == null || key.isBlank() ? UNKNOWN : key, k -> new ArrayList<>()).add(o);
        }
        return out;
    }
}
