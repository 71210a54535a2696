package com.example.notemake_backend.service;

import com.example.notemake_backend.exception.PipelineException;
import com.example.notemake_backend.util.ErrorKind;
import com.example.notemake_backend.util.ProcessRunner;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Thin wrapper around the yt-dlp binary. Failures are classified into {@link ErrorKind}s from the tool output.
 */
@Component
public class YtDlpClient {
    private static final Logger LOGGER = LoggerFactory.getLogger(YtDlpClient.class);
    private static final long INFO_TIMEOUT_SECONDS = 120;
    private static final long DOWNLOAD_TIMEOUT_MINUTES = 30;
    private static final int LOG_SNIPPET_MAX = 2_000;

    private final ProcessRunner runner;
    private final ObjectMapper objectMapper;
    private final String ytdlp;
    private final String cookiesFile;

    public YtDlpClient(ProcessRunner runner,
                       ObjectMapper objectMapper,
                       @Value("${downloader.ytdlp.bin:yt-dlp}") String ytdlp,
                       @Value("${YTDLP_COOKIES_FILE:#{null}}") String cookiesFile) {
        this.runner = runner;
        this.objectMapper = objectMapper;
        this.ytdlp = ytdlp;
        this.cookiesFile = cookiesFile;
    }

    /**
     * Full info JSON of one video, no download.
     */
    public JsonNode videoInfo(String url) {
        List<String> cmd = new ArrayList<>(List.of(ytdlp, "-J", "--skip-download", "--no-playlist", "--no-warnings"));
        maybeAddCookies(cmd);
        cmd.add(url);
        return runJson(cmd, url, ErrorKind.NETWORK);
    }

    /**
     * Flat listing of a playlist or channel.
     *
     * @param maxVideos cap on entries, {@code 0} for all.
     */
    public JsonNode playlistInfo(String url, int maxVideos) {
        List<String> cmd = new ArrayList<>(List.of(ytdlp, "-J", "--flat-playlist", "--no-warnings"));
        if (maxVideos > 0) {
            cmd.add("--playlist-end");
            cmd.add(String.valueOf(maxVideos));
        }
        maybeAddCookies(cmd);
        cmd.add(url);
        return runJson(cmd, url, ErrorKind.PLAYLIST_RESOLUTION_FAILED);
    }

    /**
     * Downloads the best audio stream as mp3 into {@code dir}.
     */
    public Path downloadAudio(String url, String videoId, Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new PipelineException(ErrorKind.RESOURCE_EXHAUSTED, "Cannot create work dir " + dir, e);
        }
        List<String> cmd = new ArrayList<>(List.of(
                ytdlp,
                "--no-progress", "--no-playlist",
                "-f", "bestaudio/best",
                "-x", "--audio-format", "mp3", "--audio-quality", "192K"
        ));
        maybeAddCookies(cmd);
        cmd.add("-o");
        cmd.add(dir.resolve(videoId + ".%(ext)s").toString());
        cmd.add(url);

        ProcessRunner.Result result = exec(cmd, DOWNLOAD_TIMEOUT_MINUTES, TimeUnit.MINUTES, url);
        if (!result.ok()) {
            throw failure(result, url, ErrorKind.NETWORK);
        }
        Path mp3 = dir.resolve(videoId + ".mp3");
        if (Files.exists(mp3)) {
            LOGGER.info("yt-dlp audio OK videoId={} file={}", videoId, mp3);
            return mp3;
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().startsWith(videoId + "."))
                    .findFirst()
                    .orElseThrow(() -> new PipelineException(ErrorKind.MODEL_ERROR, "yt-dlp reported success but no audio file for " + videoId));
        } catch (IOException e) {
            throw new PipelineException(ErrorKind.MODEL_ERROR, "Cannot list work dir " + dir, e);
        }
    }

    private JsonNode runJson(List<String> cmd, String url, ErrorKind fallbackKind) {
        ProcessRunner.Result result = exec(cmd, INFO_TIMEOUT_SECONDS, TimeUnit.SECONDS, url);
        if (!result.ok()) {
            throw failure(result, url, fallbackKind);
        }
        try {
            return objectMapper.readTree(result.stdout());
        } catch (JsonProcessingException e) {
            throw new PipelineException(fallbackKind, "yt-dlp returned unreadable JSON for " + url, e);
        }
    }

    private ProcessRunner.Result exec(List<String> cmd, long timeout, TimeUnit unit, String url) {
        LOGGER.debug("yt-dlp exec url={} cmd={}", url, String.join(" ", cmd));
        try {
            return runner.run(cmd, timeout, unit);
        } catch (IOException e) {
            throw new PipelineException(ErrorKind.MODEL_ERROR, "yt-dlp not runnable (" + ytdlp + "): " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineException(ErrorKind.CANCELLED, "Interrupted while running yt-dlp for " + url, e);
        }
    }

    PipelineException failure(ProcessRunner.Result result, String url, ErrorKind fallbackKind) {
        String output = result.combined();
        if (result.timedOut()) {
            return new PipelineException(ErrorKind.TIMEOUT, "yt-dlp timed out for " + url);
        }
        ErrorKind kind = classify(output, fallbackKind);
        LOGGER.warn("yt-dlp failed url={} exit={} kind={} log={}", url, result.code(), kind, truncate(output));
        return new PipelineException(kind, "yt-dlp exit=" + result.code() + " for " + url + ": " + lastLine(output));
    }

    static ErrorKind classify(String output, ErrorKind fallbackKind) {
        if (output == null) {
            return fallbackKind;
        }
        String o = output.toLowerCase(Locale.ROOT).replace('’', '\'');
        if (o.contains("video unavailable") || o.contains("private video") || o.contains("has been removed")
                || o.contains("does not exist") || o.contains("http error 404") || o.contains("is not a valid url")
                || o.contains("unsupported url")) {
            return fallbackKind == ErrorKind.PLAYLIST_RESOLUTION_FAILED ? fallbackKind : ErrorKind.NOT_FOUND;
        }
        if (o.contains("timed out") || o.contains("read timeout")) {
            return ErrorKind.TIMEOUT;
        }
        if (o.contains("http error 429") || o.contains("too many requests") || o.contains("connection reset")
                || o.contains("temporary failure in name resolution") || o.contains("unable to download webpage")
                || o.contains("http error 5")) {
            return ErrorKind.NETWORK;
        }
        return fallbackKind;
    }

    private void maybeAddCookies(List<String> cmd) {
        if (cookiesFile == null || cookiesFile.isBlank()) {
            return;
        }
        Path cookiesPath = Path.of(cookiesFile).toAbsolutePath();
        if (Files.exists(cookiesPath)) {
            cmd.add("--cookies");
            cmd.add(cookiesPath.toString());
        } else {
            LOGGER.warn("yt-dlp cookies file configured but missing path={}", cookiesPath);
        }
    }

    private static String truncate(String output) {
        if (output == null || output.isBlank()) {
            return "<no output>";
        }
        return output.length() <= LOG_SNIPPET_MAX ? output : output.substring(0, LOG_SNIPPET_MAX) + "...";
    }

    private static String lastLine(String output) {
        if (output == null || output.isBlank()) {
            return "<no output>";
        }
        String[] lines = output.strip().split("\\R");
        return lines[lines.length - 1];
    }
}
