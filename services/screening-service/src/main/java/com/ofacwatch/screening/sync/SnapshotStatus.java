package com.ofacwatch.screening.sync;

import java.time.Instant;

/**
 * Outcome of the latest sanctions list refreshes.
 *
 * @param generation generation of the index being served, 0 when none is loaded
 * @param size       number of entities in the served index
 * @param loadedAt   when the served index was built
 */
public record SnapshotStatus(
        long generation,
        int size,
        Instant loadedAt,
        Instant lastAttemptAt,
        Instant lastSuccessAt,
        String lastError
) {
}
