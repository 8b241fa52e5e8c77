package com.ofacwatch.screening.sync;

import com.ofacwatch.screening.domain.SanctionEntity;
import com.ofacwatch.screening.exception.ListSyncException;
import com.ofacwatch.screening.exception.MalformedSnapshotException;

import java.util.List;

/**
 * Source of sanctions list snapshots.
 */
public interface ListSync {

    /**
     * Download and parse the current list.
     *
     * @throws ListSyncException          when the list cannot be downloaded
     * @throws MalformedSnapshotException when the downloaded list cannot be parsed
     */
    List<SanctionEntity> currentSnapshot() throws ListSyncException, MalformedSnapshotException;
}
