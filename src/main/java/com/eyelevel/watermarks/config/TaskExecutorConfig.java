package com.eyelevel.watermarks.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Configures the bounded worker pool that watermarks the chunks of the running job, and the
 * clock shared by every time-dependent lifecycle decision.
 */
@Configuration
public class TaskExecutorConfig {

    /**
     * Creates the chunk worker pool. Its width is {@code app.processing.max-parallel-workers};
     * only one job runs at a time, so the pool is never shared between jobs.
     *
     * @param config The processing configuration.
     * @return A configured AsyncTaskExecutor bean.
     */
    @Bean("chunkWorkerExecutor")
    public AsyncTaskExecutor chunkWorkerExecutor(final WatermarkProcessingConfig config) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int workers = Math.max(1, config.getMaxParallelWorkers());
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setThreadNamePrefix("chunk-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock systemClock() {
        return Clock.systemDefaultZone();
    }
}
