package com.ofacwatch.screening.exception;

import com.ofacwatch.common.exception.ErrorCode;
import com.ofacwatch.common.exception.OfacWatchException;

/**
 * A sanctions list snapshot could not be turned into an index. Fatal to that refresh attempt only.
 */
public class MalformedSnapshotException extends OfacWatchException {

    public MalformedSnapshotException(String message) {
        super(ErrorCode.LIST_MALFORMED_SNAPSHOT, message);
    }

    public MalformedSnapshotException(String message, Throwable cause) {
        super(ErrorCode.LIST_MALFORMED_SNAPSHOT, message, cause);
    }
}
