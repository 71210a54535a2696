package com.example.notemake_backend.service.metadata;

import com.example.notemake_backend.dto.pipeline.VideoMetadata;
import com.example.notemake_backend.dto.pipeline.VideoRef;
import com.example.notemake_backend.util.ErrorKind;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * oEmbed lookup. Only knows title, channel and thumbnail, but works when yt-dlp is missing or blocked.
 */
@Component
@Order(50)
class NoembedMetadataProvider implements MetadataProvider {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;

    NoembedMetadataProvider(@Qualifier("metadataWebClient") WebClient webClient,
                            ObjectMapper objectMapper,
                            @Value("${metadata.noembed.base-url:https://noembed.com}") String baseUrl) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
    }

    @Override
    public Optional<VideoMetadata> resolve(VideoRef ref) {
        String endpoint = baseUrl + "/embed?url=" + URLEncoder.encode(ref.watchUrl(), StandardCharsets.UTF_8);
        try {
            String payload = webClient.get()
                    .uri(endpoint)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block();
            if (payload == null || payload.isBlank()) {
                return Optional.empty();
            }
            JsonNode node = objectMapper.readTree(payload);
            if (node.hasNonNull("error")) {
                // noembed answers 200 with {"error": "..."} for unknown videos
                return Optional.empty();
            }
            VideoMetadata base = VideoMetadata.empty(ref.videoId(), ref.watchUrl());
            return Optional.of(new VideoMetadata(base.videoId(), base.url(),
                    textOrNull(node, "title"), textOrNull(node, "author_name"), null, null, null, null, null, null,
                    null, textOrNull(node, "thumbnail_url"), null, null, null));
        } catch (WebClientResponseException ex) {
            HttpStatusCode status = ex.getStatusCode();
            if (status.is4xxClientError()) {
                return Optional.empty();
            }
            throw new MetadataAccessException(ErrorKind.NETWORK, "noembed lookup failed", ex);
        } catch (WebClientRequestException | IOException ex) {
            throw new MetadataAccessException(ErrorKind.NETWORK, "noembed lookup failed", ex);
        }
    }

    private String textOrNull(JsonNode node, String field) {
        if (node == null || !node.hasNonNull(field)) {
            return null;
        }
        var value = node.get(field).asText();
        return value != null && !value.isBlank() ? value : null;
    }
}
