package com.example.notemake_backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools for batch runs. Dispatch and item execution use separate pools so a dispatcher waiting for a
 * permit never occupies a thread an item needs; collaborator calls get their own pool for per-call timeouts.
 */
@Configuration
@EnableConfigurationProperties(BatchExecutorProperties.class)
public class BatchExecutorConfig {

    @Bean(name = "batchTaskExecutor")
    public ThreadPoolTaskExecutor batchTaskExecutor(BatchExecutorProperties properties) {
        int threads = Math.max(properties.getExecutorThreads(), properties.getMaxConcurrency());
        return executor(threads, properties.getExecutorQueueCapacity(), "batch-");
    }

    @Bean(name = "batchDispatchExecutor")
    public ThreadPoolTaskExecutor batchDispatchExecutor(BatchExecutorProperties properties) {
        return executor(2, properties.getExecutorQueueCapacity(), "batch-dispatch-");
    }

    @Bean(name = "collaboratorExecutor")
    public ThreadPoolTaskExecutor collaboratorExecutor(BatchExecutorProperties properties) {
        int threads = Math.max(properties.getCollaboratorThreads(), properties.getMaxConcurrency() * 2);
        return executor(threads, properties.getExecutorQueueCapacity(), "collaborator-");
    }

    private ThreadPoolTaskExecutor executor(int threads, int queue, String prefix) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(queue);
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
