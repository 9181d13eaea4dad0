package com.weatherdesk.backend.exception;

import org.springframework.http.HttpStatus;

import java.time.Duration;

/** No pooled connection became free before the caller's deadline. */
public class PoolTimeoutException extends BackendException {

    public PoolTimeoutException(Duration waited) {
        super("No database connection available within " + waited.toMillis() + " ms",
                HttpStatus.SERVICE_UNAVAILABLE, true);
    }

    public PoolTimeoutException(String message) {
        super(message, HttpStatus.SERVICE_UNAVAILABLE, true);
    }
}
