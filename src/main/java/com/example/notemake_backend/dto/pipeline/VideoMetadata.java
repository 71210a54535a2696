package com.example.notemake_backend.dto.pipeline;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Descriptive data about a video. Providers fill in what they know; {@link #merge(VideoMetadata)} keeps the first
 * non-null value per field.
 */
public record VideoMetadata(
        String videoId,
        String url,
        String title,
        String channel,
        String channelId,
        LocalDate publishedAt,
        Long durationSec,
        Long viewCount,
        Long likeCount,
        Long commentCount,
        String description,
        String thumbnail,
        List<String> tags,
        List<String> categories,
        List<Chapter> chapters
) {

    public VideoMetadata {
        tags = tags == null ? List.of() : List.copyOf(tags);
        categories = categories == null ? List.of() : List.copyOf(categories);
        chapters = chapters == null ? List.of() : List.copyOf(chapters);
    }

    public static VideoMetadata empty(String videoId, String url) {
        return new VideoMetadata(videoId, url, null, null, null, null, null, null, null, null, null, null, null, null, null);
    }

    public VideoMetadata merge(VideoMetadata other) {
        if (other == null) {
            return this;
        }
        return new VideoMetadata(
                firstNonNull(videoId, other.videoId()),
                firstNonNull(url, other.url()),
                firstNonNull(title, other.title()),
                firstNonNull(channel, other.channel()),
                firstNonNull(channelId, other.channelId()),
                firstNonNull(publishedAt, other.publishedAt()),
                firstNonNull(durationSec, other.durationSec()),
                firstNonNull(viewCount, other.viewCount()),
                firstNonNull(likeCount, other.likeCount()),
                firstNonNull(commentCount, other.commentCount()),
                firstNonNull(description, other.description()),
                firstNonNull(thumbnail, other.thumbnail()),
                tags.isEmpty() ? other.tags() : tags,
                categories.isEmpty() ? other.categories() : categories,
                chapters.isEmpty() ? other.chapters() : chapters
        );
    }

    /**
     * Returns a copy whose duration is at least {@code seconds}, so the metadata always covers the full transcript.
     */
    public VideoMetadata withDurationAtLeast(long seconds) {
        if (durationSec != null && durationSec >= seconds) {
            return this;
        }
        return new VideoMetadata(videoId, url, title, channel, channelId, publishedAt, seconds, viewCount, likeCount,
                commentCount, description, thumbnail, tags, categories, chapters);
    }

    public boolean hasAnyData() {
        return title != null || channel != null || durationSec != null || thumbnail != null;
    }

    public String displayTitle() {
        return title != null && !title.isBlank() ? title : videoId;
    }

    private static <T> T firstNonNull(T a, T b) {
        return a != null ? a : b;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VideoMetadata that)) return false;
        return Objects.equals(videoId, that.videoId) && Objects.equals(url, that.url) && Objects.equals(title, that.title)
                && Objects.equals(channel, that.channel) && Objects.equals(channelId, that.channelId)
                && Objects.equals(publishedAt, that.publishedAt) && Objects.equals(durationSec, that.durationSec)
                && Objects.equals(viewCount, that.viewCount) && Objects.equals(likeCount, that.likeCount)
                && Objects.equals(commentCount, that.commentCount) && Objects.equals(description, that.description)
                && Objects.equals(thumbnail, that.thumbnail) && tags.equals(that.tags)
                && categories.equals(that.categories) && chapters.equals(that.chapters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(videoId, url, title, channel, channelId, publishedAt, durationSec, viewCount, likeCount,
                commentCount, description, thumbnail, tags, categories, chapters);
    }
}
