package com.example.notemake_backend.engine;

import com.example.notemake_backend.config.OpenAIAudioProperties;
import com.example.notemake_backend.dto.pipeline.TranscriptResult;
import com.example.notemake_backend.dto.pipeline.TranscriptSegment;
import com.example.notemake_backend.engine.Interfaces.TranscriptionEngine;
import com.example.notemake_backend.exception.PipelineException;
import com.example.notemake_backend.service.YtDlpClient;
import com.example.notemake_backend.util.AudioTask;
import com.example.notemake_backend.util.ErrorKind;
import com.example.notemake_backend.util.ExtractionMode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.HttpStatusCode;
import org.springframework.util.FileSystemUtils;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.PrematureCloseException;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Speech recognition through OpenAI's audio API. The audio is downloaded locally first and uploaded as multipart.
 */
public class OpenAITranscriptionEngine implements TranscriptionEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAITranscriptionEngine.class);
    private static final Duration RETRY_BACKOFF = Duration.ofMillis(200);

    private final YtDlpClient ytDlp;
    private final WebClient client;
    private final OpenAIAudioProperties props;
    private final Path workDir;
    private final ObjectMapper om = new ObjectMapper();

    public OpenAITranscriptionEngine(YtDlpClient ytDlp, WebClient client, OpenAIAudioProperties props, Path workDir) {
        this.ytDlp = ytDlp;
        this.client = client;
        this.props = props;
        this.workDir = workDir;
    }

    @Override
    public String name() {
        return "openai";
    }

    @Override
    public TranscriptResult transcribe(Request request) {
        String videoId = request.ref().videoId();
        Path jobDir = workDir.resolve("openai-" + videoId + "-" + UUID.randomUUID());
        try {
            Path audio = ytDlp.downloadAudio(request.ref().watchUrl(), videoId, jobDir);
            return upload(audio, request);
        } finally {
            try {
                FileSystemUtils.deleteRecursively(jobDir);
            } catch (IOException e) {
                LOGGER.warn("OpenAI ASR cleanup failed dir={}", jobDir, e);
            }
        }
    }

    TranscriptResult upload(Path audio, Request request) {
        var form = new LinkedMultiValueMap<String, Object>();
        form.add("file", new FileSystemResource(audio));
        form.add("model", props.getModel());
        form.add("response_format", "verbose_json");
        form.add("timestamp_granularities[]", "segment");
        boolean translate = request.task() == AudioTask.TRANSLATE;
        String langHint = request.langHint() == null ? null : request.langHint().toLowerCase(Locale.ROOT);
        if (!translate && langHint != null && !langHint.isBlank()) form.add("language", langHint);

        String videoId = request.ref().videoId();
        Mono<JsonNode> mono = client.post()
                .uri(translate ? "/v1/audio/translations" : "/v1/audio/transcriptions")
                .body(BodyInserters.fromMultipartData(form))
                .retrieve()
                .onStatus(HttpStatusCode::isError, resp ->
                        resp.bodyToMono(String.class).defaultIfEmpty("")
                                .map(body -> toFailure(resp.statusCode(), body)))
                .bodyToMono(String.class)
                .map(this::parseJson)
                .retryWhen(Retry.backoff(props.getMaxRetries(), RETRY_BACKOFF)
                        .filter(this::isRetryable)
                        .doBeforeRetry(signal -> LOGGER.warn("OpenAI ASR retry attempt={} videoId={} type={} message={}",
                                signal.totalRetriesInARow() + 1, videoId,
                                signal.failure().getClass().getSimpleName(), signal.failure().getMessage())))
                .onErrorMap(ex -> !(ex instanceof PipelineException), this::mapTransportError);

        JsonNode root = mono.block(Duration.ofSeconds(props.getTimeoutSeconds()));
        if (root == null) throw new PipelineException(ErrorKind.MODEL_ERROR, "Empty response from OpenAI ASR");
        return toResult(root, translate ? "en" : langHint);
    }

    TranscriptResult toResult(JsonNode root, String fallbackLang) {
        List<TranscriptSegment> segments = new ArrayList<>();
        for (JsonNode seg : root.path("segments")) {
            String text = seg.path("text").asText("").trim();
            if (text.isEmpty()) continue;
            long s = Math.round(seg.path("start").asDouble(0) * 1000.0);
            long e = Math.round(seg.path("end").asDouble(0) * 1000.0);
            segments.add(new TranscriptSegment(Math.max(0, s), Math.max(0, e), text));
        }
        if (segments.isEmpty()) {
            String text = root.path("text").asText("").trim();
            if (text.isEmpty()) throw new PipelineException(ErrorKind.MODEL_ERROR, "OpenAI ASR returned no text");
            long durationMs = Math.round(root.path("duration").asDouble(0) * 1000.0);
            segments.add(new TranscriptSegment(0, durationMs, text));
        }
        String lang = root.hasNonNull("language") ? normalizeLanguage(root.get("language").asText()) : fallbackLang;
        return TranscriptResult.of(segments, ExtractionMode.AUDIO, lang);
    }

    // verbose_json reports full names ("english"); keep iso codes as they are
    private static String normalizeLanguage(String lang) {
        String l = lang.toLowerCase(Locale.ROOT);
        return switch (l) {
            case "english" -> "en";
            case "dutch" -> "nl";
            case "german" -> "de";
            case "french" -> "fr";
            case "spanish" -> "es";
            default -> l;
        };
    }

    private PipelineException toFailure(HttpStatusCode status, String body) {
        String msg = "OpenAI ASR error %s: %s".formatted(status, truncate(body, 500));
        if (status.value() == 429 || status.value() == 413) {
            return new PipelineException(ErrorKind.RESOURCE_EXHAUSTED, msg);
        }
        if (status.is5xxServerError()) {
            return new PipelineException(ErrorKind.NETWORK, msg);
        }
        return new PipelineException(ErrorKind.MODEL_ERROR, msg);
    }

    private JsonNode parseJson(String body) {
        try {
            return om.readTree(body);
        } catch (JsonProcessingException e) {
            throw new PipelineException(ErrorKind.MODEL_ERROR, "OpenAI ASR unreadable response length="
                    + (body == null ? 0 : body.length()), e);
        }
    }

    private Throwable mapTransportError(Throwable ex) {
        return new PipelineException(ErrorKind.NETWORK, "OpenAI ASR transport failure: " + ex.getMessage(), ex);
    }

    private boolean isRetryable(Throwable throwable) {
        if (throwable instanceof PipelineException pe) return pe.getKind() == ErrorKind.NETWORK;
        return hasCause(throwable, PrematureCloseException.class) || throwable instanceof WebClientRequestException;
    }

    private boolean hasCause(Throwable throwable, Class<? extends Throwable> target) {
        Throwable cursor = throwable;
        while (cursor != null) {
            if (target.isInstance(cursor)) return true;
            cursor = cursor.getCause();
        }
        return false;
    }

    private static String truncate(String body, int max) {
        if (body == null) return "";
        return body.length() <= max ? body : body.substring(0, max) + "...";
    }
}
