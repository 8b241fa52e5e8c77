package com.ofacwatch.screening.index;

import com.ofacwatch.screening.exception.SnapshotUnavailableException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current {@link SanctionsIndex} generation and tracks who still reads older ones.
 *
 * <p>Readers pin a generation with {@link #acquire()} for the duration of a cycle. Installing
 * a new index retires the previous generation; a retired generation is released once its
 * last lease is closed. There is never a moment without an index once the first one is installed.</p>
 */
@Slf4j
public class IndexSnapshotManager {

    private final AtomicReference<Generation> current = new AtomicReference<>();
    private final Set<Generation> pendingRelease = ConcurrentHashMap.newKeySet();
    private final AtomicLong generationSequence = new AtomicLong();

    /**
     * Next generation number to build an index with.
     */
    public long nextGeneration() {
        return generationSequence.incrementAndGet();
    }

    /**
     * Pin the current generation.
     *
     * @throws SnapshotUnavailableException if no index was installed yet
     */
    public IndexLease acquire() throws SnapshotUnavailableException {
        while (true) {
            Generation generation = current.get();
            if (generation == null) {
                throw new SnapshotUnavailableException();
            }
            generation.leases.incrementAndGet();
            if (current.get() == generation) {
                return new IndexLease(this, generation);
            }
            // swapped while pinning; let go and pin the new one
            release(generation);
        }
    }

    /**
     * Make {@code index} the current generation. In-flight readers keep the one they pinned.
     */
    public void install(SanctionsIndex index) {
        Generation installed = new Generation(index);
        Generation previous = current.getAndSet(installed);
        log.info("Installed sanctions index generation {} with {} entities", index.generation(), index.size());

        if (previous != null) {
            previous.retired = true;
            pendingRelease.add(previous);
            if (previous.leases.get() == 0) {
                releaseRetired(previous);
            } else {
                log.debug("Generation {} retired with {} active leases", previous.index.generation(), previous.leases.get());
            }
        }
    }

    public Optional<SanctionsIndex> current() {
        Generation generation = current.get();
        return generation == null ? Optional.empty() : Optional.of(generation.index);
    }

    /**
     * Generations that were replaced but are still pinned by a reader.
     */
    public List<Long> pendingReleaseGenerations() {
        return pendingRelease.stream()
                .map(generation -> generation.index.generation())
                .sorted()
                .toList();
    }

    public int activeLeases() {
        Generation generation = current.get();
        return generation == null ? 0 : generation.leases.get();
    }

    void release(Generation generation) {
        if (generation.leases.decrementAndGet() == 0 && generation.retired) {
            releaseRetired(generation);
        }
    }

    private void releaseRetired(Generation generation) {
        if (pendingRelease.remove(generation)) {
            log.debug("Released sanctions index generation {}", generation.index.generation());
        }
    }

    static final class Generation {
        final SanctionsIndex index;
        final AtomicInteger leases = new AtomicInteger();
        volatile boolean retired;

        Generation(SanctionsIndex index) {
            this.index = index;
        }
    }
}
