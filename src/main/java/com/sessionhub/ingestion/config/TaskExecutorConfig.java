package com.sessionhub.ingestion.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class TaskExecutorConfig {

    @Value("${app.acquisition.pool.core-size:2}")
    private int coreSize;

    @Value("${app.acquisition.pool.max-size:4}")
    private int maxSize;

    @Value("${app.acquisition.pool.queue-capacity:200}")
    private int queueCapacity;

    @Bean("acquisitionExecutor")
    public TaskExecutor acquisitionExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(Math.max(coreSize, maxSize));
        executor.setQueueCapacity(queueCapacity);
        executor.setRejectedExecutionHandler(new java.util.concurrent.ThreadPoolExecutor.CallerRunsPolicy());
        executor.setThreadNamePrefix("AssetAcquisition-");
        executor.initialize();
        return executor;
    }
}
