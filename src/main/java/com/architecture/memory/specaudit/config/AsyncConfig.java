package com.architecture.memory.specaudit.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Thread pools: a bounded pool for parallel schema reads and a single thread for external
 * recommendation calls, so at most one call is outstanding at a time.
 */
@Configuration
public class AsyncConfig {

    @Value("${spec-audit.loader.parallelism:4}")
    private int loaderParallelism;

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService schemaLoadExecutor() {
        return Executors.newFixedThreadPool(Math.max(1, loaderParallelism),
                new CustomizableThreadFactory("schema-load-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService recommendationExecutor() {
        return Executors.newSingleThreadExecutor(new CustomizableThreadFactory("recommender-"));
    }
}
