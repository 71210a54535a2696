package com.example.notemake_backend.service.export;

import java.util.Locale;

public enum ExportFormat {
    MARKDOWN("md", "text/markdown"),
    JSON("json", "application/json"),
    PDF("pdf", "application/pdf");

    private final String extension;
    private final String contentType;

    ExportFormat(String extension, String contentType) {
        this.extension = extension;
        this.contentType = contentType;
    }

    public String getExtension() {
        return extension;
    }

    public String getContentType() {
        return contentType;
    }

    /**
     * Accepts the enum name or the file extension, case-insensitive.
     */
    public static ExportFormat parse(String value) {
        if (value == null || value.isBlank()) {
            return MARKDOWN;
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (ExportFormat f : values()) {
            if (f.name().toLowerCase(Locale.ROOT).equals(v) || f.extension.equals(v)) {
                return f;
            }
        }
        throw new IllegalArgumentException("Unknown export format: " + value);
    }
}
