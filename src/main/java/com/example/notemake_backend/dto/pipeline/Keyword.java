package com.example.notemake_backend.dto.pipeline;

public record Keyword(String word, int count) {
}
