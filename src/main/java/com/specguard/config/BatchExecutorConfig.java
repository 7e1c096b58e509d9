package com.specguard.config;

import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pool for batch interpretation.
 *
 * Interpretation is CPU-bound, so core and max size are equal; a core size of 0
 * means one thread per available processor.
 */
@Configuration
public class BatchExecutorConfig {

    private static final Logger log = LoggerFactory.getLogger(BatchExecutorConfig.class);

    @Bean(name = "interpreterExecutor")
    public Executor interpreterExecutor(
            @Value("${specguard.batch.core-pool-size:0}") int corePoolSize,
            @Value("${specguard.batch.queue-capacity:1000}") int queueCapacity
    ) {
        int threads = corePoolSize > 0 ? corePoolSize : Runtime.getRuntime().availableProcessors();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("ir-interpreter-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("[Batch] Executor configured: threads={}, queue={}", threads, queueCapacity);
        return executor;
    }
}
