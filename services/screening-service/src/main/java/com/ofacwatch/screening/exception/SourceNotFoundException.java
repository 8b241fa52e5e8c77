package com.ofacwatch.screening.exception;

import com.ofacwatch.common.exception.ErrorCode;
import com.ofacwatch.common.exception.OfacWatchException;

public class SourceNotFoundException extends OfacWatchException {

    public SourceNotFoundException(String sourceId) {
        super(ErrorCode.SRC_NOT_FOUND, "Source not configured: " + sourceId);
        withMetadata("sourceId", sourceId);
    }
}
