package com.example.notemake_backend.service.playlist;

import com.example.notemake_backend.dto.pipeline.PlaylistEntry;
import com.example.notemake_backend.exception.PipelineException;
import com.example.notemake_backend.exception.PlaylistResolutionFailedException;
import com.example.notemake_backend.service.YtDlpClient;
import com.example.notemake_backend.util.VideoIdParser;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@Component
public class YtDlpPlaylistResolver implements PlaylistResolver {
    private static final Logger LOGGER = LoggerFactory.getLogger(YtDlpPlaylistResolver.class);
    private static final Set<String> UNAVAILABLE_TITLES = Set.of("[private video]", "[deleted video]");
    private static final Set<String> UNAVAILABLE_STATES = Set.of("private", "needs_auth", "subscriber_only", "premium_only");

    private final YtDlpClient ytDlp;

    public YtDlpPlaylistResolver(YtDlpClient ytDlp) {
        this.ytDlp = ytDlp;
    }

    @Override
    public List<PlaylistEntry> expand(String playlistRef, int maxVideos) {
        String url = toUrl(playlistRef);
        JsonNode info;
        try {
            info = ytDlp.playlistInfo(url, Math.max(0, maxVideos));
        } catch (PipelineException ex) {
            throw new PlaylistResolutionFailedException(playlistRef,
                    "Failed to expand " + playlistRef + ": " + ex.getMessage(), ex);
        }
        List<PlaylistEntry> entries = new ArrayList<>();
        collect(info.path("entries"), entries);
        if (maxVideos > 0 && entries.size() > maxVideos) {
            entries = new ArrayList<>(entries.subList(0, maxVideos));
        }
        if (entries.isEmpty()) {
            throw new PlaylistResolutionFailedException(playlistRef, "No videos found in " + playlistRef, null);
        }
        long unavailable = entries.stream().filter(e -> !e.available()).count();
        LOGGER.info("PLAYLIST expanded ref={} entries={} unavailable={}", playlistRef, entries.size(), unavailable);
        return entries;
    }

    static String toUrl(String playlistRef) {
        if (playlistRef == null || playlistRef.isBlank()) {
            throw new PlaylistResolutionFailedException(playlistRef, "Playlist reference is empty", null);
        }
        String ref = playlistRef.trim();
        if (VideoIdParser.isChannelUrl(ref)) {
            return ref;
        }
        return VideoIdParser.extractPlaylistId(ref)
                .map(VideoIdParser::playlistUrl)
                .orElseThrow(() -> new PlaylistResolutionFailedException(ref, "Not a playlist or channel: " + ref, null));
    }

    // channel listings nest one playlist per tab
    private static void collect(JsonNode entries, List<PlaylistEntry> out) {
        if (entries == null || !entries.isArray()) {
            return;
        }
        for (JsonNode entry : entries) {
            if (entry == null || entry.isNull()) {
                continue;
            }
            if (entry.has("entries")) {
                collect(entry.get("entries"), out);
                continue;
            }
            String id = entry.path("id").asText("");
            if (VideoIdParser.extractVideoId(id).isEmpty()) {
                continue;
            }
            String title = entry.path("title").asText("Unknown");
            out.add(new PlaylistEntry(id, title, isAvailable(entry, title)));
        }
    }

    static boolean isAvailable(JsonNode entry, String title) {
        if (UNAVAILABLE_TITLES.contains(title.toLowerCase(Locale.ROOT))) {
            return false;
        }
        String availability = entry.path("availability").asText("");
        return !UNAVAILABLE_STATES.contains(availability.toLowerCase(Locale.ROOT));
    }
}
