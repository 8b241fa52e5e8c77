package com.ofacwatch.screening.exception;

import com.ofacwatch.common.exception.ErrorCode;
import com.ofacwatch.common.exception.OfacWatchException;
import lombok.Getter;

/**
 * Network or parsing failure while fetching a source. Transient: the source is retried at its next tick.
 */
@Getter
public class FetchException extends OfacWatchException {

    private final String sourceId;

    public FetchException(String sourceId, String message, Throwable cause) {
        super(ErrorCode.SRC_FETCH_FAILED, message, cause);
        this.sourceId = sourceId;
        withMetadata("sourceId", sourceId);
    }

    private FetchException(ErrorCode errorCode, String sourceId, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.sourceId = sourceId;
        withMetadata("sourceId", sourceId);
    }

    public static FetchException timeout(String sourceId, Throwable cause) {
        return new FetchException(ErrorCode.SRC_FETCH_TIMEOUT, sourceId, "Fetch timed out for source " + sourceId, cause);
    }
}
