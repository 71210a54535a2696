package com.example.notemake_backend.engine;

import com.example.notemake_backend.config.AiProperties;
import com.example.notemake_backend.engine.Interfaces.SummarizationEngine;
import com.example.notemake_backend.exception.PipelineException;
import com.example.notemake_backend.util.ErrorKind;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Prompting and response parsing shared by the chat style providers. Subclasses only build the request body and
 * pull the completion text out of the response.
 */
public abstract class AbstractSummarizationEngine implements SummarizationEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractSummarizationEngine.class);
    static final int MAX_INPUT_CHARS = 15_000;
    static final int MAX_SECTION_CHARS = 10_000;
    private static final Duration RETRY_BACKOFF = Duration.ofMillis(500);

    protected final WebClient client;
    protected final AiProperties.Provider props;

    protected AbstractSummarizationEngine(WebClient client, AiProperties.Provider props) {
        this.client = client;
        this.props = props;
    }

    @Override
    public boolean isConfigured() {
        return props.hasApiKey();
    }

    @Override
    public String summarize(String text, int maxWords) {
        String prompt = """
                Please provide a concise summary of the following video transcript in approximately %d words.
                Focus on the main points and key takeaways.

                Transcript:
                %s

                Summary:""".formatted(maxWords, truncate(text, MAX_INPUT_CHARS));
        return complete(prompt, 1024).strip();
    }

    @Override
    public List<String> extractKeyPoints(String text, int count) {
        String prompt = """
                Analyze the following video transcript and extract exactly %d key points or main ideas.
                Format each point as a clear, concise bullet point.

                Transcript:
                %s

                Key Points (return only the numbered list):""".formatted(count, truncate(text, MAX_INPUT_CHARS));
        return parseList(complete(prompt, 1024), count, false);
    }

    @Override
    public String analyzeSentiment(String text) {
        String prompt = """
                Analyze the sentiment and tone of the following transcript.
                Provide:
                1. Overall sentiment (positive/negative/neutral)
                2. Tone (e.g., educational, entertaining, serious, casual)
                3. Target audience (e.g., beginners, experts, general public)
                4. Content type (e.g., tutorial, discussion, lecture, entertainment)

                Transcript:
                %s

                Analysis:""".formatted(truncate(text, MAX_SECTION_CHARS));
        return complete(prompt, 512).strip();
    }

    @Override
    public List<String> generateQuestions(String text, int count) {
        String prompt = """
                Based on the following transcript, generate %d thought-provoking discussion questions
                that could be used for study or reflection.

                Transcript:
                %s

                Questions:""".formatted(count, truncate(text, MAX_INPUT_CHARS));
        return parseList(complete(prompt, 512), count, true);
    }

    @Override
    public String summarizeChapter(String title, String text) {
        String prompt = """
                Summarize the following section titled "%s" in 2-3 sentences.

                Content:
                %s

                Summary:""".formatted(title, truncate(text, MAX_SECTION_CHARS));
        return complete(prompt, 256).strip();
    }

    /**
     * Sends one user prompt and returns the completion text.
     */
    protected String complete(String prompt, int maxTokens) {
        if (!isConfigured()) {
            throw new PipelineException(ErrorKind.PROVIDER_ERROR, name() + " API key is not configured");
        }
        int tokens = Math.min(maxTokens, props.getMaxTokens());
        JsonNode root = client.post()
                .uri(endpoint())
                .bodyValue(requestBody(prompt, tokens))
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::toFailure)
                .bodyToMono(JsonNode.class)
                .retryWhen(Retry.backoff(props.getMaxRetries(), RETRY_BACKOFF)
                        .filter(AbstractSummarizationEngine::isRetryable)
                        .doBeforeRetry(signal -> LOGGER.warn("AI retry provider={} attempt={} message={}",
                                name(), signal.totalRetriesInARow() + 1, signal.failure().getMessage())))
                .onErrorMap(ex -> !(ex instanceof PipelineException),
                        ex -> new PipelineException(ErrorKind.PROVIDER_ERROR, name() + " request failed: " + ex.getMessage(), ex))
                .block(props.getTimeout());
        if (root == null) {
            throw new PipelineException(ErrorKind.PROVIDER_ERROR, name() + " returned an empty response");
        }
        String text = extractText(root);
        if (text == null || text.isBlank()) {
            throw new PipelineException(ErrorKind.PROVIDER_ERROR, name() + " response had no completion text");
        }
        return text;
    }

    protected abstract String endpoint();

    protected abstract Object requestBody(String prompt, int maxTokens);

    /**
     * @return completion text, or {@code null} when the body is not in the expected shape.
     */
    protected abstract String extractText(JsonNode root);

    private Mono<? extends Throwable> toFailure(ClientResponse resp) {
        int status = resp.statusCode().value();
        return resp.bodyToMono(String.class).defaultIfEmpty("").map(body -> {
            String msg = "%s error %d: %s".formatted(name(), status, truncate(body, 300));
            ErrorKind kind = status == 429 ? ErrorKind.QUOTA_EXCEEDED : ErrorKind.PROVIDER_ERROR;
            if (status >= 500) kind = ErrorKind.NETWORK;
            return new PipelineException(kind, msg);
        });
    }

    private static boolean isRetryable(Throwable ex) {
        if (ex instanceof PipelineException pe) return pe.getKind() == ErrorKind.NETWORK;
        return ex instanceof WebClientRequestException;
    }

    /**
     * Turns a numbered or bulleted completion into a list. Questions keep only lines with a question mark.
     */
    static List<String> parseList(String content, int limit, boolean questions) {
        List<String> items = new ArrayList<>();
        for (String raw : content.split("\\R")) {
            String line = raw.strip();
            if (line.isEmpty()) continue;
            char first = line.charAt(0);
            boolean listItem = Character.isDigit(first) || first == '-' || first == '•' || first == '*';
            if (questions ? !(listItem || line.contains("?")) : !listItem) continue;
            String item = line.replaceFirst("^[0-9.\\-•*)\\s]+", "").strip();
            if (item.isEmpty()) continue;
            if (questions && !item.contains("?")) continue;
            items.add(item);
            if (items.size() >= limit) break;
        }
        return items;
    }

    static String truncate(String text, int max) {
        if (text == null) return "";
        return text.length() <= max ? text : text.substring(0, max);
    }
}
