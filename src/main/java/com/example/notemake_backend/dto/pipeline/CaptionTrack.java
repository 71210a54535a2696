package com.example.notemake_backend.dto.pipeline;

public record CaptionTrack(String languageCode, String name, boolean autoGenerated) {
}
