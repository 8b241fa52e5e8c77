package com.ofacwatch.screening.controller;

import com.ofacwatch.common.exception.ErrorCode;
import com.ofacwatch.common.exception.ErrorResponse;
import com.ofacwatch.common.exception.OfacWatchException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;

/**
 * Maps exceptions of the monitor API to {@link ErrorResponse}.
 */
@RestControllerAdvice
@Slf4j
public class MonitorExceptionHandler {

    @ExceptionHandler(OfacWatchException.class)
    public ResponseEntity<ErrorResponse> handleOfacWatchException(
            OfacWatchException ex, HttpServletRequest request) {
        HttpStatus status = ex.getErrorCode().getStatus();
        if (status.is5xxServerError()) {
            log.error("Request {} failed: {}", request.getRequestURI(), ex.getMessage(), ex);
        } else {
            log.warn("Request {} rejected: {}", request.getRequestURI(), ex.getMessage());
        }
        return ResponseEntity.status(status).body(ex.toErrorResponse(request.getRequestURI()));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(
            MissingServletRequestParameterException ex, HttpServletRequest request) {
        log.warn("Missing parameter: {}", ex.getParameterName());
        return badRequest(ErrorCode.VAL_REQUIRED_FIELD, ex.getMessage(), request,
                Map.of("parameter", ex.getParameterName()));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        log.warn("Invalid value for parameter {}: {}", ex.getName(), ex.getValue());
        return badRequest(ErrorCode.VAL_OUT_OF_RANGE,
                "Invalid value for parameter '" + ex.getName() + "'", request,
                Map.of("parameter", ex.getName()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error on {}", request.getRequestURI(), ex);
        ErrorResponse error = ErrorResponse.builder()
                .timestamp(Instant.now())
                .status(HttpStatus.INTERNAL_SERVER_ERROR.value())
                .error(ErrorCode.SYS_INTERNAL_ERROR.getCode())
                .message(ErrorCode.SYS_INTERNAL_ERROR.getDefaultMessage())
                .path(request.getRequestURI())
                .build();
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    private static ResponseEntity<ErrorResponse> badRequest(ErrorCode code, String message,
                                                            HttpServletRequest request, Map<String, Object> details) {
        ErrorResponse error = ErrorResponse.builder()
                .timestamp(Instant.now())
                .status(HttpStatus.BAD_REQUEST.value())
                .error(code.getCode())
                .message(message)
                .path(request.getRequestURI())
                .details(details)
                .build();
        return ResponseEntity.badRequest().body(error);
    }
}
