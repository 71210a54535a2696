package com.example.notemake_backend.dto.pipeline;

/**
 * One entry of an expanded playlist or channel.
 *
 * @param available {@code false} for private or deleted videos that are still listed.
 */
public record PlaylistEntry(String videoId, String title, boolean available) {
}
