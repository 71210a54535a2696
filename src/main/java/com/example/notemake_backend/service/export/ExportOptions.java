package com.example.notemake_backend.service.export;

/**
 * Layout switches for note exports.
 *
 * @param groupBySeconds group transcript lines into blocks of this many seconds, {@code 0} for one line per
 *                       segment.
 */
public record ExportOptions(
        boolean includeTimestamps,
        boolean clickableTimestamps,
        int groupBySeconds,
        boolean includeThumbnail,
        boolean includeDescription,
        boolean includeTags,
        boolean includeStatistics,
        boolean includeToc
) {

    public ExportOptions {
        groupBySeconds = Math.max(0, groupBySeconds);
    }

    public static ExportOptions defaults() {
        return new ExportOptions(true, true, 0, true, true, false, true, true);
    }
}
