package com.ofacwatch.common.exception;

import org.springframework.http.HttpStatus;

/**
 * Error codes for the OFAC Watch services
 * Format: MODULE_CATEGORY_SPECIFIC_ERROR
 */
public enum ErrorCode {

    // ===== SOURCE POLLING ERRORS (SRC_XXX) =====
    SRC_FETCH_FAILED("SRC_001", "Fetching the source failed"),
    SRC_FETCH_TIMEOUT("SRC_002", "Fetching the source timed out"),
    SRC_NOT_FOUND("SRC_003", "Source not configured"),
    SRC_CYCLE_BUSY("SRC_004", "A polling cycle is already running for this source"),

    // ===== EXTRACTION ERRORS (EXT_XXX) =====
    EXT_EXTRACTION_FAILED("EXT_001", "Name extraction failed"),
    EXT_EXTRACTION_TIMEOUT("EXT_002", "Name extraction timed out"),

    // ===== SANCTIONS LIST ERRORS (LIST_XXX) =====
    LIST_MALFORMED_SNAPSHOT("LIST_001", "Sanctions list snapshot is malformed"),
    LIST_SYNC_FAILED("LIST_002", "Sanctions list download failed"),
    LIST_SNAPSHOT_UNAVAILABLE("LIST_003", "No sanctions list snapshot has been loaded yet"),

    // ===== VALIDATION ERRORS (VAL_XXX) =====
    VAL_REQUIRED_FIELD("VAL_001", "Required field is missing"),
    VAL_OUT_OF_RANGE("VAL_002", "Value is out of allowed range"),

    // ===== CONFIGURATION ERRORS (CONFIG_XXX) =====
    CONFIG_INVALID_THRESHOLDS("CONFIG_001", "Classification thresholds must satisfy 0 <= low < high <= 1"),

    // ===== SYSTEM ERRORS (SYS_XXX) =====
    SYS_INTERNAL_ERROR("SYS_001", "Internal system error");

    private final String code;
    private final String defaultMessage;

    ErrorCode(String code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }

    /**
     * Get HTTP status for this error code
     */
    public HttpStatus getStatus() {
        return switch (this) {
            case SRC_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case SRC_CYCLE_BUSY -> HttpStatus.CONFLICT;
            case VAL_REQUIRED_FIELD, VAL_OUT_OF_RANGE -> HttpStatus.BAD_REQUEST;
            case SRC_FETCH_TIMEOUT, EXT_EXTRACTION_TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case SRC_FETCH_FAILED, LIST_SYNC_FAILED -> HttpStatus.BAD_GATEWAY;
            case LIST_SNAPSHOT_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
