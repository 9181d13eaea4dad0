package com.weatherdesk.backend.config;

import com.weatherdesk.backend.exception.BackendException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobalErrorHandler {

    @ExceptionHandler(BackendException.class)
    public ResponseEntity<Map<String, Object>> handleBackend(BackendException ex) {
        if (ex.retryable()) {
            log.warn("Retryable failure: {}", ex.getMessage());
        } else {
            log.debug("Request failed: {}", ex.getMessage());
        }
        return ResponseEntity.status(ex.status()).body(body(ex.getMessage(), ex.retryable()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadInput(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(body(ex.getMessage(), false));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> handleStatus(ResponseStatusException ex) {
        return ResponseEntity.status(ex.getStatusCode()).body(body(ex.getReason(), false));
    }

    @ExceptionHandler(Throwable.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Throwable ex) {
        log.error("Unhandled error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body("Internal server error", false));
    }

    private static Map<String, Object> body(String message, boolean retryable) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("error", message);
        m.put("retryable", retryable);
        return m;
    }
}
