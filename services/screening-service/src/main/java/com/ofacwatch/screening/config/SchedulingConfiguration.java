package com.ofacwatch.screening.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Thread pool for source cadences, manual triggers and the sanctions list refresh.
 * Time-limited fetch and extraction calls run on the per-source lanes of
 * {@link com.ofacwatch.screening.pipeline.TimeBoundedInvoker}.
 */
@Configuration
@Slf4j
public class SchedulingConfiguration {

    @Bean(name = "taskScheduler")
    public ThreadPoolTaskScheduler taskScheduler(ScreeningProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getScheduler().getPoolSize());
        scheduler.setThreadNamePrefix("ofacwatch-poll-");

        // In-flight cycles finish their current phase on shutdown
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds((int) properties.getScheduler().getShutdownAwait().toSeconds());
        scheduler.setErrorHandler(t -> log.error("Unhandled error in scheduled task", t));

        scheduler.initialize();
        log.info("Initialized polling scheduler - Pool: {}", properties.getScheduler().getPoolSize());
        return scheduler;
    }
}
