package com.example.notemake_backend.util;

/**
 * How a transcript was (or should be) obtained.
 */
public enum ExtractionMode {
    CAPTIONS,
    AUDIO
}
