package com.ofacwatch.screening.exception;

import com.ofacwatch.common.exception.ErrorCode;
import com.ofacwatch.common.exception.OfacWatchException;

/**
 * The sanctions list could not be downloaded.
 */
public class ListSyncException extends OfacWatchException {

    public ListSyncException(String message, Throwable cause) {
        super(ErrorCode.LIST_SYNC_FAILED, message, cause);
    }
}
