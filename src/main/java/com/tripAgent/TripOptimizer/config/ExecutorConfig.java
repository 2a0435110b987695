package com.tripAgent.TripOptimizer.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Two pools: window tasks block on source tasks, so they must never share threads.
 */
@Configuration
public class ExecutorConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService sourceExecutor() {
        CustomizableThreadFactory factory = new CustomizableThreadFactory("candidate-source-");
        factory.setDaemon(true);
        return Executors.newCachedThreadPool(factory);
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService windowExecutor(OptimizerProperties properties) {
        CustomizableThreadFactory factory = new CustomizableThreadFactory("trip-window-");
        factory.setDaemon(true);
        return Executors.newFixedThreadPool(Math.max(1, properties.getWorkerPoolSize()), factory);
    }
}
