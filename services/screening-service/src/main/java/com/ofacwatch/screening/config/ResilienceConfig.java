package com.ofacwatch.screening.config;

import com.ofacwatch.screening.pipeline.TimeBoundedInvoker;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Resilience4j time limiters for the blocking phases of a polling cycle.
 *
 * Timeout Strategy:
 * - fetch: one HTTP request per source and cycle
 * - extraction: one document
 * - a timed out call is interrupted and fails its cycle
 */
@Configuration
@Slf4j
public class ResilienceConfig {

    @Bean
    public TimeLimiterRegistry timeLimiterRegistry(ScreeningProperties properties) {
        TimeLimiterConfig defaultConfig = TimeLimiterConfig.custom()
            .timeoutDuration(Duration.ofSeconds(30))
            .cancelRunningFuture(true)
            .build();

        TimeLimiterConfig fetchConfig = TimeLimiterConfig.from(defaultConfig)
            .timeoutDuration(properties.getFetchTimeout())
            .build();

        TimeLimiterConfig extractionConfig = TimeLimiterConfig.from(defaultConfig)
            .timeoutDuration(properties.getExtractTimeout())
            .build();

        TimeLimiterRegistry registry = TimeLimiterRegistry.of(defaultConfig);
        registry.timeLimiter(TimeBoundedInvoker.FETCH, fetchConfig);
        registry.timeLimiter(TimeBoundedInvoker.EXTRACTION, extractionConfig);

        log.info("Time limiters configured - fetch: {}, extraction: {}",
            properties.getFetchTimeout(), properties.getExtractTimeout());

        return registry;
    }
}
