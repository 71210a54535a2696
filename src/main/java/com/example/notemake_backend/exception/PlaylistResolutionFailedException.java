package com.example.notemake_backend.exception;

import com.example.notemake_backend.util.ErrorKind;

/**
 * The playlist (or channel) reference of a batch could not be expanded. Fails the whole batch.
 */
public class PlaylistResolutionFailedException extends PipelineException {

    private final String playlistRef;

    public PlaylistResolutionFailedException(String playlistRef, String message, Throwable cause) {
        super(ErrorKind.PLAYLIST_RESOLUTION_FAILED, message, cause);
        this.playlistRef = playlistRef;
    }

    public String getPlaylistRef() {
        return playlistRef;
    }
}
