package com.ofacwatch.common.exception;

import lombok.Getter;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Base exception class for all OFAC Watch failures
 */
@Getter
public class OfacWatchException extends Exception {

    private final String errorId;
    private final ErrorCode errorCode;
    private final String userMessage;
    private final Map<String, Object> metadata;
    private final Instant timestamp;

    public OfacWatchException(ErrorCode errorCode) {
        this(errorCode, errorCode.getDefaultMessage(), null, null);
    }

    public OfacWatchException(ErrorCode errorCode, String userMessage) {
        this(errorCode, userMessage, null, null);
    }

    public OfacWatchException(ErrorCode errorCode, String userMessage, Throwable cause) {
        this(errorCode, userMessage, cause, null);
    }

    public OfacWatchException(ErrorCode errorCode, String userMessage, Throwable cause, Map<String, Object> metadata) {
        super(buildMessage(errorCode, userMessage), cause);
        this.errorId = UUID.randomUUID().toString();
        this.errorCode = errorCode;
        this.userMessage = userMessage != null ? userMessage : errorCode.getDefaultMessage();
        this.metadata = metadata != null ? new HashMap<>(metadata) : new HashMap<>();
        this.timestamp = Instant.now();
    }

    /**
     * Add metadata to the exception
     */
    public OfacWatchException withMetadata(String key, Object value) {
        this.metadata.put(key, value);
        return this;
    }

    /**
     * Get error response for API
     */
    public ErrorResponse toErrorResponse(String path) {
        return ErrorResponse.builder()
            .errorId(errorId)
            .status(errorCode.getStatus().value())
            .error(errorCode.getCode())
            .message(userMessage)
            .path(path)
            .timestamp(timestamp)
            .details(metadata.isEmpty() ? null : metadata)
            .build();
    }

    private static String buildMessage(ErrorCode errorCode, String userMessage) {
        return String.format("[%s] %s", errorCode.getCode(),
            userMessage != null ? userMessage : errorCode.getDefaultMessage());
    }
}
