package com.example.notemake_backend.service.playlist;

import com.example.notemake_backend.dto.pipeline.PlaylistEntry;
import com.example.notemake_backend.exception.PlaylistResolutionFailedException;

import java.util.List;

public interface PlaylistResolver {

    /**
     * Expands a playlist or channel reference into its videos, in listing order. Unavailable videos are kept and
     * flagged so callers can report them.
     *
     * @param maxVideos cap on entries, {@code 0} for no cap.
     * @throws PlaylistResolutionFailedException when the reference cannot be expanded at all.
     */
    List<PlaylistEntry> expand(String playlistRef, int maxVideos);
}
