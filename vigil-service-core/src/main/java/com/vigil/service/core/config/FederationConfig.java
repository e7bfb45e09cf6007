package com.vigil.service.core.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/** Threads used by the federation engine: one pool for query branches, one low-priority lane for GC. */
@Configuration
public class FederationConfig {

    public static final String FEDERATION_EXECUTOR = "federationExecutor";
    public static final String SEGMENT_GC_SCHEDULER = "segmentGcScheduler";

    @Bean(name = FEDERATION_EXECUTOR)
    public ThreadPoolTaskExecutor federationExecutor(FederationProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int workers = Math.max(1, properties.getFederation().getWorkers());
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setThreadNamePrefix("vigil-federation-");
        executor.setDaemon(true);
        executor.initialize();
        return executor;
    }

    @Bean(name = SEGMENT_GC_SCHEDULER)
    public TaskScheduler segmentGcScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadPriority(Thread.MIN_PRIORITY);
        scheduler.setThreadNamePrefix("vigil-segment-gc-");
        scheduler.setDaemon(true);
        scheduler.initialize();
        return scheduler;
    }
}
