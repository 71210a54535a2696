package com.example.notemake_backend.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps pipeline failures that escape a controller to a JSON error body.
 */
@RestControllerAdvice(basePackages = "com.example.notemake_backend.controller")
public class ApiExceptionHandler {
    private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(PipelineException.class)
    public ResponseEntity<Map<String, Object>> handlePipelineException(PipelineException ex) {
        HttpStatus status = statusFor(ex);
        if (status.is5xxServerError()) {
            LOGGER.warn("Pipeline error code={} status={} message={}", ex.getErrorCode(), status.value(), ex.getMessage());
        } else {
            LOGGER.info("Pipeline request rejected code={} status={} message={}", ex.getErrorCode(), status.value(), ex.getMessage());
        }
        return ResponseEntity.status(status).body(errorBody(ex.getErrorCode(), ex.getMessage(), status));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadArgument(IllegalArgumentException ex) {
        LOGGER.info("Request rejected message={}", ex.getMessage());
        return ResponseEntity.badRequest().body(errorBody("BAD_REQUEST", ex.getMessage(), HttpStatus.BAD_REQUEST));
    }

    private HttpStatus statusFor(PipelineException ex) {
        return switch (ex.getKind()) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID_REFERENCE -> HttpStatus.BAD_REQUEST;
            case PLAYLIST_RESOLUTION_FAILED, NETWORK -> HttpStatus.BAD_GATEWAY;
            case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case STORAGE_UNAVAILABLE, RESOURCE_EXHAUSTED -> HttpStatus.SERVICE_UNAVAILABLE;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private Map<String, Object> errorBody(String code, String message, HttpStatus status) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("errorCode", code);
        body.put("message", message);
        body.put("status", status.value());
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
