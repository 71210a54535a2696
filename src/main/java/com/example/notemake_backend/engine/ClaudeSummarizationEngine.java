package com.example.notemake_backend.engine;

import com.example.notemake_backend.config.AiProperties;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.Map;

/**
 * Anthropic Messages API.
 */
public class ClaudeSummarizationEngine extends AbstractSummarizationEngine {

    public ClaudeSummarizationEngine(WebClient client, AiProperties.Provider props) {
        super(client, props);
    }

    @Override
    public String name() {
        return "claude";
    }

    @Override
    protected String endpoint() {
        return "/v1/messages";
    }

    @Override
    protected Object requestBody(String prompt, int maxTokens) {
        return Map.of(
                "model", props.getModel(),
                "max_tokens", maxTokens,
                "temperature", props.getTemperature(),
                "messages", List.of(Map.of("role", "user", "content", prompt))
        );
    }

    @Override
    protected String extractText(JsonNode root) {
        StringBuilder sb = new StringBuilder();
        for (JsonNode block : root.path("content")) {
            if ("text".equals(block.path("type").asText()) && block.hasNonNull("text")) {
                sb.append(block.get("text").asText());
            }
        }
        return sb.length() == 0 ? null : sb.toString();
    }
}
