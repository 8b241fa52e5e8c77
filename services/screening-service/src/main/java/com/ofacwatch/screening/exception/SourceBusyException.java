package com.ofacwatch.screening.exception;

import com.ofacwatch.common.exception.ErrorCode;
import com.ofacwatch.common.exception.OfacWatchException;

/**
 * A manual trigger found the source already in a cycle, or the scheduler stopping.
 */
public class SourceBusyException extends OfacWatchException {

    public SourceBusyException(String sourceId) {
        super(ErrorCode.SRC_CYCLE_BUSY, "Source " + sourceId + " is already in a cycle or the scheduler is stopping");
        withMetadata("sourceId", sourceId);
    }
}
