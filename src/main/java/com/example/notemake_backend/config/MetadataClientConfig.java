package com.example.notemake_backend.config;

import io.netty.channel.ChannelOption;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * Plain HTTP clients for oEmbed lookups and caption track downloads.
 */
@Configuration
public class MetadataClientConfig {

    private static final String BROWSER_UA = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
            + "(KHTML, like Gecko) Chrome/124.0 Safari/537.36";

    @Bean
    @Qualifier("metadataWebClient")
    public WebClient metadataWebClient(WebClient.Builder builder) {
        return build(builder, Duration.ofSeconds(10), 4 * 1024 * 1024);
    }

    @Bean
    @Qualifier("captionWebClient")
    public WebClient captionWebClient(WebClient.Builder builder) {
        // long videos produce multi-megabyte json3 tracks
        return build(builder, Duration.ofSeconds(30), 32 * 1024 * 1024);
    }

    private WebClient build(WebClient.Builder builder, Duration responseTimeout, int maxInMemory) {
        HttpClient http = HttpClient.create()
                .followRedirect(true)
                .compress(true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Duration.ofSeconds(5).toMillis())
                .responseTimeout(responseTimeout);

        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(cfg -> cfg.defaultCodecs().maxInMemorySize(maxInMemory))
                .build();

        return builder.clone()
                .clientConnector(new ReactorClientHttpConnector(http))
                .exchangeStrategies(strategies)
                .defaultHeader(HttpHeaders.USER_AGENT, BROWSER_UA)
                .defaultHeader(HttpHeaders.ACCEPT_LANGUAGE, "en-US,en;q=0.9")
                .build();
    }
}
