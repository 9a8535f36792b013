package com.poolintel.schedule.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded pool for fetching upstream sources concurrently.
 */
@Configuration
public class FetchExecutorConfig {

    @Bean(name = "fetchExecutor")
    public ThreadPoolTaskExecutor fetchExecutor(ReconcilerProperties properties) {
        int parallelism = Math.max(1, properties.getHttp().getFetchParallelism());
        ThreadPoolTaskExecutor exec = new ThreadPoolTaskExecutor();
        exec.setCorePoolSize(parallelism);
        exec.setMaxPoolSize(parallelism);
        exec.setQueueCapacity(50);
        exec.setThreadNamePrefix("source-fetch-");
        exec.initialize();
        return exec;
    }
}
