package com.weatherdesk.backend.exception;

import org.springframework.http.HttpStatus;

/**
 * Base type for the failures the core reports to its callers. Each failure
 * carries the HTTP status it maps to and whether a caller may retry it.
 */
public abstract class BackendException extends RuntimeException {

    private final HttpStatus status;
    private final boolean retryable;

    protected BackendException(String message, HttpStatus status, boolean retryable) {
        super(message);
        this.status = status;
        this.retryable = retryable;
    }

    protected BackendException(String message, Throwable cause, HttpStatus status, boolean retryable) {
        super(message, cause);
        this.status = status;
        this.retryable = retryable;
    }

    public HttpStatus status() {
        return status;
    }

    public boolean retryable() {
        return retryable;
    }
}
