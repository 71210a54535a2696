package com.example.notemake_backend.dto.web;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Batch input as a URL list, a pasted text block (one URL per line), or both.
 */
public record BatchRequest(
        @Size(max = 1000) List<String> urls,
        @Size(max = 200_000) String urlListText,
        String language,
        String mode,
        @Min(1) @Max(64) Integer concurrency,
        @Min(0) @Max(5000) Integer maxVideos,
        @Valid NoteOptionsRequest options
) {

    @AssertTrue(message = "Either urls or urlListText is required")
    public boolean hasInput() {
        return (urls != null && !urls.isEmpty()) || (urlListText != null && !urlListText.isBlank());
    }
}
