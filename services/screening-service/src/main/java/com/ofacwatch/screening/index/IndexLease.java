package com.ofacwatch.screening.index;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A reader's pin on one index generation. Close it when the cycle is done.
 */
public final class IndexLease implements AutoCloseable {

    private final IndexSnapshotManager manager;
    private final IndexSnapshotManager.Generation generation;
    private final AtomicBoolean closed = new AtomicBoolean();

    IndexLease(IndexSnapshotManager manager, IndexSnapshotManager.Generation generation) {
        this.manager = manager;
        this.generation = generation;
    }

    public SanctionsIndex index() {
        return generation.index;
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            manager.release(generation);
        }
    }
}
