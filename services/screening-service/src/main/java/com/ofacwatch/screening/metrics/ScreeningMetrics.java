package com.ofacwatch.screening.metrics;

import com.ofacwatch.screening.domain.MatchLabel;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer meters for polling cycles, alerts and snapshot refreshes
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ScreeningMetrics {

    private final MeterRegistry meterRegistry;

    /**
     * Record a finished polling cycle
     */
    public void recordCycle(String sourceId, String outcome, Duration duration) {
        Counter.builder("ofacwatch.cycles.total")
                .description("Polling cycles by source and outcome")
                .tag("source", sourceId)
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();

        Timer.builder("ofacwatch.cycle.duration")
                .description("Time taken by one fetch-extract-match-emit cycle")
                .tag("source", sourceId)
                .register(meterRegistry)
                .record(duration);

        log.debug("Recorded cycle: source={}, outcome={}, duration={}ms", sourceId, outcome, duration.toMillis());
    }

    public void recordAlert(MatchLabel label) {
        Counter.builder("ofacwatch.alerts.total")
                .description("Alerts emitted by label")
                .tag("label", label.name())
                .register(meterRegistry)
                .increment();
    }

    public void recordDuplicateSuppressed() {
        Counter.builder("ofacwatch.alerts.duplicates.total")
                .description("Detections suppressed because the dedup key was already recorded")
                .register(meterRegistry)
                .increment();
    }

    public void recordPublishFailure() {
        Counter.builder("ofacwatch.alerts.publish.failures.total")
                .description("Alerts the presenter failed to accept")
                .register(meterRegistry)
                .increment();
    }

    public void recordSnapshotRefresh(String outcome) {
        Counter.builder("ofacwatch.snapshot.refresh.total")
                .description("Sanctions list refresh attempts by outcome")
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }
}
