package com.example.notemake_backend.engine;

import com.example.notemake_backend.config.AiProperties;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.Map;

/**
 * OpenAI Chat Completions API.
 */
public class OpenAISummarizationEngine extends AbstractSummarizationEngine {

    public OpenAISummarizationEngine(WebClient client, AiProperties.Provider props) {
        super(client, props);
    }

    @Override
    public String name() {
        return "openai";
    }

    @Override
    protected String endpoint() {
        return "/v1/chat/completions";
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
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        return content.isTextual() ? content.asText() : null;
    }
}
