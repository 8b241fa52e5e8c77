package com.ofacwatch.screening.sync;

import com.ofacwatch.screening.domain.SanctionEntity;
import com.ofacwatch.screening.exception.ListSyncException;
import com.ofacwatch.screening.exception.MalformedSnapshotException;
import com.ofacwatch.screening.index.BlockingKeyStrategy;
import com.ofacwatch.screening.index.IndexSnapshotManager;
import com.ofacwatch.screening.index.SanctionsIndex;
import com.ofacwatch.screening.metrics.ScreeningMetrics;
import com.ofacwatch.screening.normalize.NameNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Instant;
import java.util.List;

/**
 * Periodically downloads the sanctions list and installs a freshly built index.
 *
 * <p>A failed refresh leaves the previous generation in service.</p>
 */
@Slf4j
@RequiredArgsConstructor
public class SnapshotRefreshJob {

    private final ListSync listSync;
    private final NameNormalizer normalizer;
    private final BlockingKeyStrategy blockingStrategy;
    private final IndexSnapshotManager snapshotManager;
    private final ScreeningMetrics metrics;
    private final boolean enabled;

    private volatile Instant lastAttemptAt;
    private volatile Instant lastSuccessAt;
    private volatile String lastError;

    /**
     * Refresh the sanctions list.
     * Runs at startup, then every {@code ofacwatch.screening.snapshot.refresh-interval}.
     */
    @Scheduled(fixedDelayString = "${ofacwatch.screening.snapshot.refresh-interval:PT12H}",
            initialDelayString = "${ofacwatch.screening.snapshot.initial-delay:PT0S}")
    public void refresh() {
        if (!enabled) {
            log.debug("Sanctions list refresh disabled");
            return;
        }
        log.info("=== Scheduled Job: Refresh Sanctions List ===");
        refreshNow();
    }

    /**
     * Download, build and install a new generation now.
     *
     * @return true if a new index was installed
     */
    public synchronized boolean refreshNow() {
        lastAttemptAt = Instant.now();
        try {
            List<SanctionEntity> entities = listSync.currentSnapshot();
            SanctionsIndex index = SanctionsIndex.build(entities, normalizer, blockingStrategy,
                    snapshotManager.nextGeneration());
            snapshotManager.install(index);

            lastSuccessAt = Instant.now();
            lastError = null;
            metrics.recordSnapshotRefresh("success");
            return true;
        } catch (MalformedSnapshotException e) {
            keepPrevious("malformed", e);
        } catch (ListSyncException e) {
            keepPrevious("sync_failed", e);
        } catch (RuntimeException e) {
            keepPrevious("error", e);
        }
        return false;
    }

    public SnapshotStatus status() {
        return snapshotManager.current()
                .map(index -> new SnapshotStatus(index.generation(), index.size(), index.builtAt(),
                        lastAttemptAt, lastSuccessAt, lastError))
                .orElseGet(() -> new SnapshotStatus(0, 0, null, lastAttemptAt, lastSuccessAt, lastError));
    }

    private void keepPrevious(String outcome, Exception e) {
        lastError = e.getMessage();
        metrics.recordSnapshotRefresh(outcome);
        String serving = snapshotManager.current()
                .map(index -> "generation " + index.generation())
                .orElse("no index");
        log.error("Sanctions list refresh failed ({}), still serving {}", outcome, serving, e);
    }
}
