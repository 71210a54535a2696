package com.example.notemake_backend.util;

import com.example.notemake_backend.exception.PipelineException;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts YouTube video and playlist ids from the URL shapes users paste.
 */
public final class VideoIdParser {

    private static final Pattern BARE_ID = Pattern.compile("^[A-Za-z0-9_-]{11}$");
    private static final List<Pattern> VIDEO_PATTERNS = List.of(
            Pattern.compile("(?:youtube\\.com/watch\\?(?:.*&)?v=)([A-Za-z0-9_-]{11})"),
            Pattern.compile("(?:youtu\\.be/)([A-Za-z0-9_-]{11})"),
            Pattern.compile("(?:youtube\\.com/embed/)([A-Za-z0-9_-]{11})"),
            Pattern.compile("(?:youtube\\.com/v/)([A-Za-z0-9_-]{11})"),
            Pattern.compile("(?:youtube\\.com/shorts/)([A-Za-z0-9_-]{11})")
    );
    private static final Pattern PLAYLIST = Pattern.compile("[?&]list=([A-Za-z0-9_-]+)");
    private static final Pattern CHANNEL = Pattern.compile("youtube\\.com/(@[A-Za-z0-9_.-]+|channel/[A-Za-z0-9_-]+|c/[A-Za-z0-9_.-]+|user/[A-Za-z0-9_.-]+)");

    private VideoIdParser() {
    }

    public static Optional<String> extractVideoId(String input) {
        if (input == null) return Optional.empty();
        String s = input.trim();
        if (s.isEmpty()) return Optional.empty();
        if (BARE_ID.matcher(s).matches()) return Optional.of(s);
        for (Pattern p : VIDEO_PATTERNS) {
            Matcher m = p.matcher(s);
            if (m.find()) return Optional.of(m.group(1));
        }
        return Optional.empty();
    }

    public static Optional<String> extractPlaylistId(String input) {
        if (input == null) return Optional.empty();
        Matcher m = PLAYLIST.matcher(input.trim());
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }

    public static boolean isChannelUrl(String input) {
        return input != null && CHANNEL.matcher(input.trim()).find();
    }

    /**
     * A playlist URL without a video id, or a channel URL, is expanded rather than processed directly.
     */
    public static boolean isCollection(String input) {
        if (isChannelUrl(input)) return true;
        return extractPlaylistId(input).isPresent() && (input.contains("/playlist") || extractVideoId(input).isEmpty());
    }

    public static String requireVideoId(String input) {
        return extractVideoId(input).orElseThrow(() ->
                new PipelineException(ErrorKind.INVALID_REFERENCE, "Not a video URL or id: " + input));
    }

    public static String playlistUrl(String playlistId) {
        return "https://www.youtube.com/playlist?list=" + playlistId;
    }
}
