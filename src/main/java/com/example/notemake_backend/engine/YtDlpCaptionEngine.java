package com.example.notemake_backend.engine;

import com.example.notemake_backend.dto.pipeline.CaptionTrack;
import com.example.notemake_backend.dto.pipeline.TranscriptResult;
import com.example.notemake_backend.dto.pipeline.TranscriptSegment;
import com.example.notemake_backend.dto.pipeline.VideoRef;
import com.example.notemake_backend.engine.Interfaces.CaptionEngine;
import com.example.notemake_backend.exception.NoCaptionsException;
import com.example.notemake_backend.exception.PipelineException;
import com.example.notemake_backend.service.YtDlpClient;
import com.example.notemake_backend.util.ErrorKind;
import com.example.notemake_backend.util.ExtractionMode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Reads caption tracks through yt-dlp's info JSON and downloads the chosen track in YouTube's {@code json3}
 * format. Manually uploaded tracks win over auto-generated ones.
 */
@Component
public class YtDlpCaptionEngine implements CaptionEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(YtDlpCaptionEngine.class);
    private static final Duration DOWNLOAD_TIMEOUT = Duration.ofSeconds(60);
    private static final String FALLBACK_LANGUAGE = "en";

    private final YtDlpClient ytDlp;
    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    public YtDlpCaptionEngine(YtDlpClient ytDlp,
                              @Qualifier("captionWebClient") WebClient webClient,
                              ObjectMapper objectMapper) {
        this.ytDlp = ytDlp;
        this.webClient = webClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public TranscriptResult fetch(VideoRef ref, String language) {
        JsonNode info = ytDlp.videoInfo(ref.watchUrl());
        Selected track = select(info, language)
                .orElseThrow(() -> new NoCaptionsException(ref.videoId(), language));
        LOGGER.info("CAPTIONS track videoId={} lang={} auto={}", ref.videoId(), track.language(), track.auto());

        String body = download(ref, track.url());
        List<TranscriptSegment> segments = parseJson3(body);
        if (segments.isEmpty()) {
            throw new NoCaptionsException(ref.videoId(), language);
        }
        return TranscriptResult.of(segments, ExtractionMode.CAPTIONS, track.language());
    }

    @Override
    public List<CaptionTrack> listTracks(VideoRef ref) {
        JsonNode info = ytDlp.videoInfo(ref.watchUrl());
        List<CaptionTrack> tracks = new ArrayList<>();
        collectTracks(info.path("subtitles"), false, tracks);
        collectTracks(info.path("automatic_captions"), true, tracks);
        return tracks;
    }

    private void collectTracks(JsonNode map, boolean auto, List<CaptionTrack> out) {
        Iterator<Map.Entry<String, JsonNode>> it = map.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            if (e.getKey().equals("live_chat")) continue;
            String name = null;
            for (JsonNode f : e.getValue()) {
                if (f.hasNonNull("name")) {
                    name = f.get("name").asText();
                    break;
                }
            }
            out.add(new CaptionTrack(e.getKey(), name != null ? name : e.getKey(), auto));
        }
    }

    Optional<Selected> select(JsonNode info, String requested) {
        JsonNode manual = info.path("subtitles");
        JsonNode auto = info.path("automatic_captions");
        if (requested != null) {
            return find(manual, requested, false).or(() -> find(auto, requested, true));
        }
        String videoLang = info.hasNonNull("language") ? info.get("language").asText() : null;
        if (videoLang != null) {
            Optional<Selected> preferred = find(manual, videoLang, false)
                    .or(() -> find(auto, videoLang + "-orig", true))
                    .or(() -> find(auto, videoLang, true));
            if (preferred.isPresent()) return preferred;
        }
        Iterator<String> names = manual.fieldNames();
        while (names.hasNext()) {
            String lang = names.next();
            if (lang.equals("live_chat")) continue;
            Optional<Selected> s = find(manual, lang, false);
            if (s.isPresent()) return s;
        }
        return find(auto, FALLBACK_LANGUAGE, true);
    }

    private Optional<Selected> find(JsonNode tracks, String language, boolean autoGenerated) {
        String want = language.toLowerCase(Locale.ROOT);
        Iterator<Map.Entry<String, JsonNode>> it = tracks.fields();
        JsonNode prefixMatch = null;
        String prefixLang = null;
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            String key = e.getKey().toLowerCase(Locale.ROOT);
            if (key.equals(want)) {
                return json3Url(e.getValue()).map(url -> new Selected(normalizeLang(e.getKey()), url, autoGenerated));
            }
            if (prefixMatch == null && (key.startsWith(want + "-") || want.startsWith(key + "-"))) {
                prefixMatch = e.getValue();
                prefixLang = e.getKey();
            }
        }
        if (prefixMatch != null) {
            String lang = normalizeLang(prefixLang);
            return json3Url(prefixMatch).map(url -> new Selected(lang, url, autoGenerated));
        }
        return Optional.empty();
    }

    private Optional<String> json3Url(JsonNode formats) {
        for (JsonNode f : formats) {
            if ("json3".equals(f.path("ext").asText()) && f.hasNonNull("url")) {
                return Optional.of(f.get("url").asText());
            }
        }
        return Optional.empty();
    }

    private static String normalizeLang(String key) {
        String k = key.toLowerCase(Locale.ROOT);
        return k.endsWith("-orig") ? k.substring(0, k.length() - 5) : k;
    }

    private String download(VideoRef ref, String url) {
        try {
            String body = webClient.get()
                    .uri(url)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(DOWNLOAD_TIMEOUT);
            if (body == null || body.isBlank()) {
                throw new NoCaptionsException(ref.videoId(), ref.language());
            }
            return body;
        } catch (WebClientResponseException ex) {
            int status = ex.getStatusCode().value();
            if (status == 404 || status == 403) {
                throw new NoCaptionsException(ref.videoId(), ref.language());
            }
            throw new PipelineException(ErrorKind.NETWORK, "Caption download failed status=" + status, ex);
        } catch (WebClientRequestException ex) {
            throw new PipelineException(ErrorKind.NETWORK, "Caption download failed: " + ex.getMessage(), ex);
        } catch (IllegalStateException ex) {
            // block(timeout) expired
            throw new PipelineException(ErrorKind.TIMEOUT, "Caption download timed out for " + ref.videoId(), ex);
        }
    }

    List<TranscriptSegment> parseJson3(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new PipelineException(ErrorKind.NETWORK, "Caption track is not valid json3", e);
        }
        List<TranscriptSegment> out = new ArrayList<>();
        for (JsonNode ev : root.path("events")) {
            if (!ev.has("segs")) continue;
            StringBuilder sb = new StringBuilder();
            for (JsonNode seg : ev.path("segs")) {
                sb.append(seg.path("utf8").asText(""));
            }
            String text = sb.toString().replace('\n', ' ').trim();
            if (text.isEmpty()) continue;
            long start = ev.path("tStartMs").asLong(0);
            long end = start + ev.path("dDurationMs").asLong(0);
            out.add(new TranscriptSegment(start, end, text));
        }
        return out;
    }

    record Selected(String language, String url, boolean auto) {}
}
