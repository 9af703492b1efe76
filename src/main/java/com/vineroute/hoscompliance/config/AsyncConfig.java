package com.vineroute.hoscompliance.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pool for waypoints posted to /api/time-clock/waypoints/async.
 * - Core: 4 threads, Max: 16
 * - Queue: 1000 samples (a fleet's worth of buffered GPS after a dead zone)
 * - CallerRunsPolicy: if the queue is full the request thread does the work, nothing is dropped
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    @Bean("waypointTaskExecutor")
    public Executor waypointTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("waypoint-async-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }
}
