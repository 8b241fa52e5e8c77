package com.ofacwatch.screening.scheduler;

import com.ofacwatch.screening.domain.Mention;
import com.ofacwatch.screening.domain.RawDocument;
import com.ofacwatch.screening.domain.SourceConfig;
import com.ofacwatch.screening.exception.ExtractionException;
import com.ofacwatch.screening.exception.FetchException;
import com.ofacwatch.screening.exception.SnapshotUnavailableException;
import com.ofacwatch.screening.index.IndexLease;
import com.ofacwatch.screening.index.IndexSnapshotManager;
import com.ofacwatch.screening.metrics.ScreeningMetrics;
import com.ofacwatch.screening.pipeline.ScreenedMention;
import com.ofacwatch.screening.pipeline.ScreeningPipeline;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Polls every configured source on its own fixed-delay cadence.
 *
 * <p>A cycle runs {@code FETCHING -> EXTRACTING -> MATCHING -> EMITTING} and always ends IDLE.
 * At most one cycle per source runs at a time; sources never wait on each other. A failed cycle
 * is logged and counted and the source simply waits for its next tick.</p>
 *
 * <p>On {@link #stop()} no new cycle or phase starts; a phase already running completes, and
 * the caller waits up to the configured drain time for in-flight cycles.</p>
 */
@Slf4j
public class PollingScheduler implements SmartLifecycle {

    private final Map<String, SourceRuntime> sources = new LinkedHashMap<>();
    private final ScreeningPipeline pipeline;
    private final IndexSnapshotManager snapshotManager;
    private final ScreeningMetrics metrics;
    private final TaskScheduler taskScheduler;
    private final boolean autoStartup;
    private final Duration initialDelay;
    private final Duration shutdownAwait;

    private final Object idleMonitor = new Object();
    private volatile boolean running;
    private volatile boolean stopping;

    public PollingScheduler(List<SourceConfig> sourceConfigs,
                            ScreeningPipeline pipeline,
                            IndexSnapshotManager snapshotManager,
                            ScreeningMetrics metrics,
                            TaskScheduler taskScheduler,
                            boolean autoStartup,
                            Duration initialDelay,
                            Duration shutdownAwait) {
        for (SourceConfig config : sourceConfigs) {
            if (config.fetchInterval() == null || config.fetchInterval().isNegative() || config.fetchInterval().isZero()) {
                throw new IllegalArgumentException("Source " + config.sourceId() + " needs a positive fetch interval");
            }
            if (sources.putIfAbsent(config.sourceId(), new SourceRuntime(config)) != null) {
                throw new IllegalArgumentException("Duplicate source id " + config.sourceId());
            }
        }
        this.pipeline = pipeline;
        this.snapshotManager = snapshotManager;
        this.metrics = metrics;
        this.taskScheduler = taskScheduler;
        this.autoStartup = autoStartup;
        this.initialDelay = initialDelay == null ? Duration.ZERO : initialDelay;
        this.shutdownAwait = shutdownAwait == null ? Duration.ofSeconds(30) : shutdownAwait;
    }

    @Override
    public void start() {
        if (running) {
            return;
        }
        stopping = false;
        Instant firstRun = Instant.now().plus(initialDelay);
        for (SourceRuntime source : sources.values()) {
            source.future = taskScheduler.scheduleWithFixedDelay(
                    () -> runScheduled(source), firstRun, source.config.fetchInterval());
        }
        running = true;
        log.info("Polling scheduler started for {} sources", sources.size());
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        stopping = true;
        for (SourceRuntime source : sources.values()) {
            if (source.future != null) {
                source.future.cancel(false);
            }
        }
        if (!awaitIdle(shutdownAwait)) {
            log.warn("Polling cycles still running after {}; giving up waiting", shutdownAwait);
        }
        running = false;
        log.info("Polling scheduler stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }

    /**
     * Start one cycle for {@code sourceId} outside its schedule.
     *
     * @return true if a cycle was started; false if the source is unknown, already in a cycle
     * or the scheduler is stopping
     */
    public boolean triggerNow(String sourceId) {
        SourceRuntime source = sources.get(sourceId);
        if (source == null || stopping) {
            return false;
        }
        if (!source.claim()) {
            log.debug("Trigger ignored, source {} is already in a cycle", sourceId);
            return false;
        }
        try {
            taskScheduler.schedule(() -> runClaimed(source), Instant.now());
        } catch (TaskRejectedException e) {
            source.release();
            log.warn("Trigger for source {} rejected: {}", sourceId, e.getMessage());
            return false;
        }
        log.info("Triggered cycle for source {}", sourceId);
        return true;
    }

    public boolean isKnownSource(String sourceId) {
        return sources.containsKey(sourceId);
    }

    public Optional<SourceStatus> status(String sourceId) {
        return Optional.ofNullable(sources.get(sourceId)).map(SourceRuntime::snapshot);
    }

    public List<SourceStatus> statuses() {
        Collection<SourceRuntime> all = sources.values();
        List<SourceStatus> result = new ArrayList<>(all.size());
        for (SourceRuntime source : all) {
            result.add(source.snapshot());
        }
        return result;
    }

    /**
     * Wait until no cycle is running.
     *
     * @return true if every source is idle
     */
    public boolean awaitIdle(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (idleMonitor) {
            while (anyBusy()) {
                long remainingMillis = (deadline - System.nanoTime()) / 1_000_000;
                if (remainingMillis <= 0) {
                    return false;
                }
                try {
                    idleMonitor.wait(remainingMillis);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return !anyBusy();
                }
            }
        }
        return true;
    }

    private boolean anyBusy() {
        for (SourceRuntime source : sources.values()) {
            if (source.busy()) {
                return true;
            }
        }
        return false;
    }

    private void runScheduled(SourceRuntime source) {
        if (stopping) {
            return;
        }
        if (!source.claim()) {
            log.debug("Skipping tick for source {}, previous cycle still running", source.config.sourceId());
            return;
        }
        runClaimed(source);
    }

    private void runClaimed(SourceRuntime source) {
        SourceConfig config = source.config;
        Instant started = Instant.now();
        String outcome = "success";
        try {
            int emitted = runCycle(source);
            source.succeeded(emitted);
            log.info("Cycle for source {} finished, {} new alerts", config.sourceId(), emitted);
        } catch (CycleCancelledException e) {
            outcome = "cancelled";
            log.info("Source {}: {}", config.sourceId(), e.getMessage());
        } catch (FetchException e) {
            outcome = "fetch_failed";
            source.failed(e);
            log.warn("Fetch failed for source {} [{}]: {}", config.sourceId(), e.getErrorCode().getCode(), e.getMessage());
        } catch (ExtractionException e) {
            outcome = "extraction_failed";
            source.failed(e);
            log.warn("Extraction failed for source {} [{}]: {}", config.sourceId(), e.getErrorCode().getCode(), e.getMessage());
        } catch (SnapshotUnavailableException e) {
            outcome = "snapshot_unavailable";
            source.failed(e);
            log.warn("Source {} skipped, no sanctions snapshot loaded yet", config.sourceId());
        } catch (RuntimeException e) {
            outcome = "error";
            source.failed(e);
            log.error("Cycle for source {} failed unexpectedly", config.sourceId(), e);
        } finally {
            source.release();
            metrics.recordCycle(config.sourceId(), outcome, Duration.between(started, Instant.now()));
            synchronized (idleMonitor) {
                idleMonitor.notifyAll();
            }
        }
    }

    private int runCycle(SourceRuntime source)
            throws FetchException, ExtractionException, SnapshotUnavailableException {
        SourceConfig config = source.config;
        try (IndexLease lease = snapshotManager.acquire()) {
            enter(source, SourceState.FETCHING);
            List<RawDocument> documents = pipeline.fetch(config);

            enter(source, SourceState.EXTRACTING);
            List<Mention> mentions = pipeline.extract(config, documents);

            enter(source, SourceState.MATCHING);
            List<ScreenedMention> screened = pipeline.match(mentions, lease.index());

            enter(source, SourceState.EMITTING);
            return pipeline.emit(screened);
        }
    }

    private void enter(SourceRuntime source, SourceState phase) {
        if (stopping) {
            throw new CycleCancelledException(phase);
        }
        source.state = phase;
    }
}
