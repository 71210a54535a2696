package com.example.notemake_backend.dto.web;

import com.example.notemake_backend.dto.pipeline.Chapter;
import com.example.notemake_backend.dto.pipeline.VideoMetadata;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDate;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record MetadataResponse(
        String videoId,
        String url,
        String title,
        String channel,
        LocalDate publishedAt,
        Long durationSec,
        Long viewCount,
        Long likeCount,
        String thumbnail,
        List<String> tags,
        List<Chapter> chapters
) {

    public static MetadataResponse from(VideoMetadata md) {
        return new MetadataResponse(md.videoId(), md.url(), md.title(), md.channel(), md.publishedAt(),
                md.durationSec(), md.viewCount(), md.likeCount(), md.thumbnail(), md.tags(), md.chapters());
    }
}
