package com.example.notemake_backend.dto.pipeline;

import com.example.notemake_backend.util.ExtractionMode;

import java.util.Locale;
import java.util.Objects;

/**
 * Immutable reference to one video: external id plus optional requested language and pinned extraction mode.
 *
 * @param videoId       external video identifier (e.g. the 11 character YouTube id).
 * @param language      requested transcript language, {@code null} for auto detection.
 * @param preferredMode pinned extraction mode, {@code null} lets the strategy fall back from captions to audio.
 */
public record VideoRef(String videoId, String language, ExtractionMode preferredMode) {

    public VideoRef {
        if (videoId == null || videoId.isBlank()) {
            throw new IllegalArgumentException("videoId is required");
        }
        videoId = videoId.trim();
        language = language == null || language.isBlank() ? null : language.trim().toLowerCase(Locale.ROOT);
    }

    public static VideoRef of(String videoId) {
        return new VideoRef(videoId, null, null);
    }

    public static VideoRef of(String videoId, String language) {
        return new VideoRef(videoId, language, null);
    }

    public String watchUrl() {
        return "https://www.youtube.com/watch?v=" + videoId;
    }

    public VideoRef withLanguage(String lang) {
        return Objects.equals(lang, language) ? this : new VideoRef(videoId, lang, preferredMode);
    }
}
