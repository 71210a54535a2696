package com.example.notemake_backend.util;

import java.util.Locale;

public enum AudioTask {
    TRANSCRIBE,
    TRANSLATE;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
