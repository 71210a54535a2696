package com.example.notemake_backend.exception;

import com.example.notemake_backend.util.ErrorKind;

/**
 * The video has no caption track for the requested language. Expected; triggers the audio fallback.
 */
public class NoCaptionsException extends PipelineException {

    private final String videoId;
    private final String language;

    public NoCaptionsException(String videoId, String language) {
        super(ErrorKind.NO_CAPTIONS, "No captions for video " + videoId + " language=" + (language == null ? "auto" : language));
        this.videoId = videoId;
        this.language = language;
    }

    public String getVideoId() {
        return videoId;
    }

    public String getLanguage() {
        return language;
    }
}
