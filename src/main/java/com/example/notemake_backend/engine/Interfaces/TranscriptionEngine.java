package com.example.notemake_backend.engine.Interfaces;

import com.example.notemake_backend.dto.pipeline.TranscriptResult;
import com.example.notemake_backend.dto.pipeline.VideoRef;
import com.example.notemake_backend.util.AudioTask;

/**
 * Slow transcript source: downloads the audio track and runs speech recognition on it.
 */
public interface TranscriptionEngine {
    record Request(VideoRef ref, String modelSize, AudioTask task, String langHint) {}

    String name();

    TranscriptResult transcribe(Request req) throws Exception;
}
