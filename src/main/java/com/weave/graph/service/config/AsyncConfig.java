package com.weave.graph.service.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor configuration for I/O-bound work outside the request threads.
 */
@Slf4j
@Configuration
public class AsyncConfig {

    /**
     * Executor backing the embedding HTTP client. Sized for a linking pass
     * that fans out one request per historical node.
     */
    @Bean(name = "embeddingExecutor")
    public ThreadPoolTaskExecutor embeddingExecutor() {
        log.info("Initializing embedding executor with platform thread pool");
        return createPlatformThreadPool("embedding-", 4, 16, 1000);
    }

    // ==================== Helper Methods ====================

    private ThreadPoolTaskExecutor createPlatformThreadPool(String prefix, int coreSize,
                                                             int maxSize, int queueCapacity) {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
