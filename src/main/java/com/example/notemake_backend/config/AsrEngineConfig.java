package com.example.notemake_backend.config;

import com.example.notemake_backend.engine.OpenAITranscriptionEngine;
import com.example.notemake_backend.engine.WhisperLocalTranscriptionEngine;
import com.example.notemake_backend.engine.Interfaces.TranscriptionEngine;
import com.example.notemake_backend.service.YtDlpClient;
import com.example.notemake_backend.util.ProcessRunner;
import io.netty.channel.ChannelOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.HttpProtocol;
import reactor.netty.http.client.HttpClient;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Selects the audio transcription engine with {@code engine.asr}.
 */
@Configuration
@EnableConfigurationProperties(OpenAIAudioProperties.class)
public class AsrEngineConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(AsrEngineConfig.class);

    @Bean
    @ConditionalOnProperty(name = "engine.asr", havingValue = "whisper-local", matchIfMissing = true)
    public TranscriptionEngine whisperLocalEngine(
            YtDlpClient ytDlp,
            ProcessRunner runner,
            ExtractionProperties extraction,
            @Value("${ffmpeg.binary:ffmpeg}") String ffmpegBin,
            @Value("${asr.whisper.cmd:whisper}") String whisperCmd,
            @Value("${asr.whisper.device:}") String device,
            @Value("${engine.asr.workDir:./data/work}") String workDir
    ) {
        return new WhisperLocalTranscriptionEngine(ytDlp, runner, ffmpegBin, whisperCmd, device,
                extraction.getAudioTimeout(), Path.of(workDir));
    }

    @Bean("openAiAudioWebClient")
    @ConditionalOnProperty(name = "engine.asr", havingValue = "openai")
    WebClient openAiAudioWebClient(OpenAIAudioProperties props) {
        HttpClient httpClient = HttpClient.create()
                // HTTP/1.1 only; large multipart uploads over h2 were unreliable
                .protocol(HttpProtocol.HTTP11)
                .compress(false)
                .responseTimeout(Duration.ofSeconds(props.getTimeoutSeconds()))
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000);
        LOGGER.info("Configuring OpenAI audio WebClient baseUrl={} model={} timeout={}s",
                props.getBaseUrl(), props.getModel(), props.getTimeoutSeconds());
        String key = props.getApiKey() == null ? "" : props.getApiKey().trim();
        return WebClient.builder()
                .baseUrl(props.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader("Authorization", "Bearer " + key)
                .defaultHeader("Accept", "application/json")
                .codecs(c -> c.defaultCodecs().maxInMemorySize(32 * 1024 * 1024))
                .build();
    }

    @Bean
    @ConditionalOnProperty(name = "engine.asr", havingValue = "openai")
    public TranscriptionEngine openAiTranscriptionEngine(
            YtDlpClient ytDlp,
            OpenAIAudioProperties props,
            @Qualifier("openAiAudioWebClient") WebClient client,
            @Value("${engine.asr.workDir:./data/work}") String workDir
    ) {
        return new OpenAITranscriptionEngine(ytDlp, client, props, Path.of(workDir));
    }
}
