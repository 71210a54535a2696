package com.example.notemake_backend.dto.pipeline;

import com.example.notemake_backend.util.AudioTask;

import java.util.Locale;
import java.util.Set;

/**
 * Per request extraction settings.
 *
 * @param allowFallback whether a caption attempt that keeps failing transiently may fall back to audio.
 * @param modelSize     speech model size used by the audio engine.
 */
public record ExtractionOptions(boolean allowFallback, String modelSize, AudioTask task) {

    public static final Set<String> MODEL_SIZES = Set.of("tiny", "base", "small", "medium", "large");
    public static final String DEFAULT_MODEL_SIZE = "base";

    public ExtractionOptions {
        modelSize = modelSize == null || modelSize.isBlank() ? DEFAULT_MODEL_SIZE : modelSize.trim().toLowerCase(Locale.ROOT);
        if (!MODEL_SIZES.contains(modelSize)) {
            throw new IllegalArgumentException("Unknown model size: " + modelSize);
        }
        task = task == null ? AudioTask.TRANSCRIBE : task;
    }

    public static ExtractionOptions defaults() {
        return new ExtractionOptions(true, DEFAULT_MODEL_SIZE, AudioTask.TRANSCRIBE);
    }
}
