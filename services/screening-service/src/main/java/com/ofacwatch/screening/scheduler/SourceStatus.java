package com.ofacwatch.screening.scheduler;

import java.time.Instant;

/**
 * Point-in-time view of one source's polling state.
 */
public record SourceStatus(
        String sourceId,
        String url,
        SourceState state,
        long completedCycles,
        long failedCycles,
        long alertsEmitted,
        Instant lastSuccessAt,
        Instant lastFailureAt,
        String lastError
) {
}
