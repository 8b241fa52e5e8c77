package com.ofacwatch.screening.dedup;

import com.ofacwatch.screening.domain.AlertRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local store. Uniqueness holds for the lifetime of the process only.
 */
@Slf4j
public class InMemoryDedupStore implements DedupStore {

    private final ConcurrentMap<String, AlertRecord> records = new ConcurrentHashMap<>();

    @Override
    public boolean recordIfNew(String key, AlertRecord record) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(record, "record");
        boolean stored = records.putIfAbsent(key, record) == null;
        if (!stored) {
            log.debug("Dedup key already recorded: {}", key);
        }
        return stored;
    }

    @Override
    public Optional<AlertRecord> find(String key) {
        return Optional.ofNullable(records.get(key));
    }

    @Override
    public long size() {
        return records.size();
    }
}
