package com.example.notemake_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Sizing of the batch executors and the per-run concurrency bounds.
 */
@ConfigurationProperties(prefix = "batch")
public class BatchExecutorProperties {

    private int defaultConcurrency = 2;
    private int maxConcurrency = 8;
    private int executorThreads = 8;
    private int executorQueueCapacity = 200;
    private int collaboratorThreads = 16;
    private int maxVideos = 0;

    public int getDefaultConcurrency() {
        return defaultConcurrency;
    }

    public void setDefaultConcurrency(int defaultConcurrency) {
        this.defaultConcurrency = defaultConcurrency;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public int getExecutorThreads() {
        return executorThreads;
    }

    public void setExecutorThreads(int executorThreads) {
        this.executorThreads = executorThreads;
    }

    public int getExecutorQueueCapacity() {
        return executorQueueCapacity;
    }

    public void setExecutorQueueCapacity(int executorQueueCapacity) {
        this.executorQueueCapacity = executorQueueCapacity;
    }

    public int getCollaboratorThreads() {
        return collaboratorThreads;
    }

    public void setCollaboratorThreads(int collaboratorThreads) {
        this.collaboratorThreads = collaboratorThreads;
    }

    /**
     * Default cap on videos taken from a playlist or channel, {@code 0} for no cap.
     */
    public int getMaxVideos() {
        return maxVideos;
    }

    public void setMaxVideos(int maxVideos) {
        this.maxVideos = maxVideos;
    }

    /**
     * Clamps a requested concurrency into {@code [1, maxConcurrency]}; non-positive requests use the default.
     */
    public int effectiveConcurrency(Integer requested) {
        int value = requested == null || requested <= 0 ? defaultConcurrency : requested;
        return Math.max(1, Math.min(value, Math.max(1, maxConcurrency)));
    }
}
