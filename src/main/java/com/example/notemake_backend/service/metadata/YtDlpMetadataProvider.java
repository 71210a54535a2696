package com.example.notemake_backend.service.metadata;

import com.example.notemake_backend.dto.pipeline.Chapter;
import com.example.notemake_backend.dto.pipeline.VideoMetadata;
import com.example.notemake_backend.dto.pipeline.VideoRef;
import com.example.notemake_backend.exception.PipelineException;
import com.example.notemake_backend.service.YtDlpClient;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Component
@Order(10)
class YtDlpMetadataProvider implements MetadataProvider {

    private static final DateTimeFormatter UPLOAD_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private final YtDlpClient ytDlp;

    YtDlpMetadataProvider(YtDlpClient ytDlp) {
        this.ytDlp = ytDlp;
    }

    @Override
    public Optional<VideoMetadata> resolve(VideoRef ref) {
        JsonNode info;
        try {
            info = ytDlp.videoInfo(ref.watchUrl());
        } catch (PipelineException ex) {
            throw new MetadataAccessException(ex.getKind(), "yt-dlp metadata lookup failed: " + ex.getMessage(), ex);
        }
        return Optional.of(toMetadata(ref, info));
    }

    static VideoMetadata toMetadata(VideoRef ref, JsonNode info) {
        List<String> tags = new ArrayList<>();
        info.path("tags").forEach(t -> tags.add(t.asText()));
        List<String> categories = new ArrayList<>();
        info.path("categories").forEach(c -> categories.add(c.asText()));
        List<Chapter> chapters = new ArrayList<>();
        for (JsonNode c : info.path("chapters")) {
            chapters.add(new Chapter(c.path("title").asText(""), c.path("start_time").asDouble(0), c.path("end_time").asDouble(0)));
        }
        return new VideoMetadata(
                ref.videoId(),
                ref.watchUrl(),
                text(info, "title"),
                firstNonNull(text(info, "channel"), text(info, "uploader")),
                text(info, "channel_id"),
                parseDate(text(info, "upload_date")),
                info.hasNonNull("duration") ? Math.round(info.get("duration").asDouble()) : null,
                number(info, "view_count"),
                number(info, "like_count"),
                number(info, "comment_count"),
                text(info, "description"),
                text(info, "thumbnail"),
                tags,
                categories,
                chapters
        );
    }

    private static LocalDate parseDate(String yyyymmdd) {
        if (yyyymmdd == null) return null;
        try {
            return LocalDate.parse(yyyymmdd, UPLOAD_DATE);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String text(JsonNode node, String field) {
        if (!node.hasNonNull(field)) return null;
        String value = node.get(field).asText();
        return value.isBlank() ? null : value;
    }

    private static Long number(JsonNode node, String field) {
        return node.hasNonNull(field) && node.get(field).isNumber() ? node.get(field).asLong() : null;
    }

    private static <T> T firstNonNull(T a, T b) {
        return a != null ? a : b;
    }
}
