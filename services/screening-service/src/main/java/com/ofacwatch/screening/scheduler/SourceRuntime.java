package com.ofacwatch.screening.scheduler;

import com.ofacwatch.screening.domain.SourceConfig;

import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Mutable runtime state of one source. The claim flag allows a single cycle at a time.
 */
class SourceRuntime {

    final SourceConfig config;
    private final AtomicBoolean claimed = new AtomicBoolean();
    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong alerts = new AtomicLong();

    volatile SourceState state = SourceState.IDLE;
    volatile ScheduledFuture<?> future;
    private volatile Instant lastSuccessAt;
    private volatile Instant lastFailureAt;
    private volatile String lastError;

    SourceRuntime(SourceConfig config) {
        this.config = config;
    }

    boolean claim() {
        return claimed.compareAndSet(false, true);
    }

    void release() {
        state = SourceState.IDLE;
        claimed.set(false);
    }

    boolean busy() {
        return claimed.get();
    }

    // Details and IDLE are written before the counter; snapshot() reads the counters first.
    void succeeded(int emitted) {
        alerts.addAndGet(emitted);
        lastSuccessAt = Instant.now();
        state = SourceState.IDLE;
        completed.incrementAndGet();
    }

    void failed(Exception cause) {
        lastFailureAt = Instant.now();
        lastError = cause.getMessage();
        state = SourceState.IDLE;
        failed.incrementAndGet();
    }

    SourceStatus snapshot() {
        long completedCycles = completed.get();
        long failedCycles = failed.get();
        return new SourceStatus(config.sourceId(), config.url(), state,
                completedCycles, failedCycles, alerts.get(), lastSuccessAt, lastFailureAt, lastError);
    }
}
