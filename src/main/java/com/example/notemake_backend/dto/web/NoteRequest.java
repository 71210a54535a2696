package com.example.notemake_backend.dto.web;

import com.example.notemake_backend.dto.pipeline.VideoRef;
import com.example.notemake_backend.util.ExtractionMode;
import com.example.notemake_backend.util.VideoIdParser;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.Locale;

/**
 * @param mode {@code captions} or {@code audio} pins the extraction mode; blank or {@code auto} lets it fall back.
 */
public record NoteRequest(
        @NotBlank @Size(max = 2048) String url,
        @Size(max = 16) String language,
        String mode,
        @Valid NoteOptionsRequest options
) {

    public VideoRef toVideoRef() {
        return new VideoRef(VideoIdParser.requireVideoId(url), language, parseMode(mode));
    }

    public static ExtractionMode parseMode(String value) {
        if (value == null || value.isBlank() || value.equalsIgnoreCase("auto")) {
            return null;
        }
        try {
            return ExtractionMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown mode: " + value, e);
        }
    }
}
