package com.example.notemake_backend.engine.Interfaces;

import com.example.notemake_backend.dto.pipeline.CaptionTrack;
import com.example.notemake_backend.dto.pipeline.TranscriptResult;
import com.example.notemake_backend.dto.pipeline.VideoRef;

import java.util.List;

/**
 * Fast transcript source: caption tracks published with the video.
 */
public interface CaptionEngine {

    /**
     * @param language requested language, {@code null} to pick the best available track.
     * @throws com.example.notemake_backend.exception.NoCaptionsException when no usable track exists.
     * @throws com.example.notemake_backend.exception.PipelineException  on network failures.
     */
    TranscriptResult fetch(VideoRef ref, String language);

    List<CaptionTrack> listTracks(VideoRef ref);
}
