package com.example.notemake_backend.config;

import com.example.notemake_backend.engine.ClaudeSummarizationEngine;
import com.example.notemake_backend.engine.OpenAISummarizationEngine;
import com.example.notemake_backend.engine.Interfaces.SummarizationEngine;
import io.netty.channel.ChannelOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * Picks the summarization provider with {@code ai.provider}. Exactly one {@link SummarizationEngine} bean exists.
 */
@Configuration
public class AiClientConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(AiClientConfig.class);
    private static final String ANTHROPIC_VERSION = "2023-06-01";

    @Bean
    @ConditionalOnProperty(name = "ai.provider", havingValue = "claude", matchIfMissing = true)
    public SummarizationEngine claudeSummarizationEngine(AiProperties properties) {
        AiProperties.Provider p = properties.getClaude();
        WebClient client = baseBuilder(p)
                .defaultHeader("x-api-key", p.hasApiKey() ? p.getApiKey().trim() : "")
                .defaultHeader("anthropic-version", ANTHROPIC_VERSION)
                .build();
        LOGGER.info("AI provider=claude model={} configured={}", p.getModel(), p.hasApiKey());
        return new ClaudeSummarizationEngine(client, p);
    }

    @Bean
    @ConditionalOnProperty(name = "ai.provider", havingValue = "openai")
    public SummarizationEngine openAiSummarizationEngine(AiProperties properties) {
        AiProperties.Provider p = properties.getOpenai();
        WebClient client = baseBuilder(p)
                .defaultHeader("Authorization", "Bearer " + (p.hasApiKey() ? p.getApiKey().trim() : ""))
                .build();
        LOGGER.info("AI provider=openai model={} configured={}", p.getModel(), p.hasApiKey());
        return new OpenAISummarizationEngine(client, p);
    }

    private WebClient.Builder baseBuilder(AiProperties.Provider p) {
        HttpClient http = HttpClient.create()
                .responseTimeout(p.getTimeout())
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000);
        return WebClient.builder()
                .baseUrl(p.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(http))
                .defaultHeader("Content-Type", MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader("Accept", MediaType.APPLICATION_JSON_VALUE)
                .codecs(c -> c.defaultCodecs().maxInMemorySize(4 * 1024 * 1024));
    }
}
