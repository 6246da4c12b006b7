package com.eyelevel.imageprocessor.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configures the managed thread pool on which submitted batches run. Each batch occupies one
 * thread of this pool for its whole lifetime; per-file fan-out uses a separate, short-lived pool.
 */
@Configuration
public class TaskExecutorConfig {

    /**
     * Pool sizes come from {@code spring.task.execution.pool.*} in application.yaml.
     *
     * @return the executor used by {@code BatchSubmissionService}.
     */
    @Bean("applicationTaskExecutor")
    public AsyncTaskExecutor applicationTaskExecutor(
            @Value("${spring.task.execution.pool.core-size:2}") int coreSize,
            @Value("${spring.task.execution.pool.max-size:4}") int maxSize,
            @Value("${spring.task.execution.pool.queue-capacity:50}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("batch-runner-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
