package com.example.notemake_backend.dto.pipeline;

import com.example.notemake_backend.util.AudioTask;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Composite cache key. Two requests with the same video id, language, requested mode and schema version map to
 * the same entry.
 *
 * @param mode requested extraction mode name, or {@link #AUTO_MODE} when the caller did not pin one. A translation
 *             request carries a {@code :translate} suffix, since its output differs from a plain transcription.
 */
public record CacheKey(String videoId, String language, String mode, int schemaVersion) {

    public static final String AUTO_LANGUAGE = "auto";
    public static final String AUTO_MODE = "AUTO";

    public CacheKey {
        if (videoId == null || videoId.isBlank()) {
            throw new IllegalArgumentException("videoId is required");
        }
        language = language == null || language.isBlank() ? AUTO_LANGUAGE : language;
        mode = mode == null || mode.isBlank() ? AUTO_MODE : mode;
    }

    public static final String TRANSLATION_LANGUAGE = "en";

    public static CacheKey of(VideoRef ref, int schemaVersion) {
        return of(ref, ExtractionOptions.defaults(), schemaVersion);
    }

    public static CacheKey of(VideoRef ref, ExtractionOptions options, int schemaVersion) {
        String mode = ref.preferredMode() == null ? AUTO_MODE : ref.preferredMode().name();
        if (options != null && options.task() == AudioTask.TRANSLATE) {
            // translation always yields English, whatever the source language
            return new CacheKey(ref.videoId(), TRANSLATION_LANGUAGE, mode + ":" + AudioTask.TRANSLATE.id(), schemaVersion);
        }
        return new CacheKey(ref.videoId(), ref.language(), mode, schemaVersion);
    }

    public String canonical() {
        return videoId + "|" + language + "|" + mode + "|v" + schemaVersion;
    }

    /**
     * Stable SHA-256 hex of {@link #canonical()}, used as the storage id.
     */
    public String digest() {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(canonical().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
