package com.ofacwatch.screening.exception;

import com.ofacwatch.common.exception.ErrorCode;
import com.ofacwatch.common.exception.OfacWatchException;

/**
 * Raised when matching is attempted before the first snapshot was installed.
 */
public class SnapshotUnavailableException extends OfacWatchException {

    public SnapshotUnavailableException() {
        super(ErrorCode.LIST_SNAPSHOT_UNAVAILABLE);
    }
}
