package com.example.notemake_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Summarization provider selection and credentials.
 */
@ConfigurationProperties(prefix = "ai")
public class AiProperties {

    private boolean enabled = true;
    /** {@code claude} or {@code openai}. */
    private String provider = "claude";
    private Provider claude = new Provider("https://api.anthropic.com", "claude-3-5-sonnet-20241022");
    private Provider openai = new Provider("https://api.openai.com", "gpt-4-turbo-preview");

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public Provider getClaude() {
        return claude;
    }

    public void setClaude(Provider claude) {
        this.claude = claude;
    }

    public Provider getOpenai() {
        return openai;
    }

    public void setOpenai(Provider openai) {
        this.openai = openai;
    }

    public static class Provider {
        private String baseUrl;
        private String apiKey;
        private String model;
        private int maxTokens = 2000;
        private double temperature = 0.3;
        private Duration timeout = Duration.ofSeconds(120);
        private int maxRetries = 2;

        public Provider() {
        }

        public Provider(String baseUrl, String model) {
            this.baseUrl = baseUrl;
            this.model = model;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }
}
