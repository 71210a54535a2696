package com.example.notemake_backend.util;

public final class TimeFormat {

    private TimeFormat() {
    }

    /**
     * {@code MM:SS}, or {@code HH:MM:SS} from one hour on.
     */
    public static String timestamp(double seconds) {
        long total = (long) Math.max(0, seconds);
        long h = total / 3600;
        long m = (total % 3600) / 60;
        long s = total % 60;
        return h > 0 ? String.format("%02d:%02d:%02d", h, m, s) : String.format("%02d:%02d", m, s);
    }

    public static String duration(Long seconds) {
        if (seconds == null || seconds <= 0) return "Unknown";
        long h = seconds / 3600;
        long m = (seconds % 3600) / 60;
        long s = seconds % 60;
        if (h > 0) return h + "h " + m + "m " + s + "s";
        if (m > 0) return m + "m " + s + "s";
        return s + "s";
    }

    public static String timestampLink(String videoId, double seconds) {
        return "https://www.youtube.com/watch?v=" + videoId + "&t=" + (long) Math.max(0, seconds) + "s";
    }
}
