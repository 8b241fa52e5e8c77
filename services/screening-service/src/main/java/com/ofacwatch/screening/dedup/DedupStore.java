package com.ofacwatch.screening.dedup;

import com.ofacwatch.screening.domain.AlertRecord;

import java.util.Optional;

/**
 * Keeps one alert per dedup key. {@link #recordIfNew} is the only write path.
 */
public interface DedupStore {

    /**
     * Store {@code record} under {@code key} unless the key is already present.
     * Atomic: among concurrent callers with the same key exactly one gets {@code true};
     * the stored record is never replaced.
     *
     * @return true if this call stored the record, false if the key was already recorded
     */
    boolean recordIfNew(String key, AlertRecord record);

    Optional<AlertRecord> find(String key);

    long size();
}
