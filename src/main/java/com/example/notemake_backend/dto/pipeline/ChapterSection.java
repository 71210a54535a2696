package com.example.notemake_backend.dto.pipeline;

/**
 * Transcript text that falls inside one chapter.
 */
public record ChapterSection(int index, String title, double startSec, String text) {
}
