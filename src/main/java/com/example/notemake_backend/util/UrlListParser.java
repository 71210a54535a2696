package com.example.notemake_backend.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses a plain text URL list: one entry per line, blank lines and {@code #} comments skipped.
 */
public final class UrlListParser {

    private UrlListParser() {
    }

    public static List<String> parse(String text) {
        List<String> out = new ArrayList<>();
        if (text == null) return out;
        for (String raw : text.split("\\R")) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            out.add(line);
        }
        return out;
    }

    /**
     * Splits inputs into accepted video refs and rejected strings, keeping input order in both lists.
     */
    public static Validation validate(List<String> inputs) {
        List<String> valid = new ArrayList<>();
        List<String> invalid = new ArrayList<>();
        for (String in : inputs) {
            if (in == null || in.isBlank()) continue;
            String s = in.trim();
            if (VideoIdParser.extractVideoId(s).isPresent() || VideoIdParser.isCollection(s)) {
                valid.add(s);
            } else {
                invalid.add(s);
            }
        }
        return new Validation(List.copyOf(valid), List.copyOf(invalid));
    }

    public record Validation(List<String> valid, List<String> invalid) {
    }
}
