package com.ofacwatch.screening.exception;

import com.ofacwatch.common.exception.ErrorCode;
import com.ofacwatch.common.exception.OfacWatchException;

/**
 * Extraction failed or timed out. Treated like a fetch failure: the cycle aborts without partial alerts.
 */
public class ExtractionException extends OfacWatchException {

    public ExtractionException(String message, Throwable cause) {
        super(ErrorCode.EXT_EXTRACTION_FAILED, message, cause);
    }

    private ExtractionException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    public static ExtractionException timeout(String sourceItemId, Throwable cause) {
        return new ExtractionException(ErrorCode.EXT_EXTRACTION_TIMEOUT,
                "Extraction timed out for item " + sourceItemId, cause);
    }
}
