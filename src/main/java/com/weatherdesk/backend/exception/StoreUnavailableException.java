package com.weatherdesk.backend.exception;

import org.springframework.http.HttpStatus;

/** A query against the backing store failed. */
public class StoreUnavailableException extends BackendException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause, HttpStatus.SERVICE_UNAVAILABLE, true);
    }
}
