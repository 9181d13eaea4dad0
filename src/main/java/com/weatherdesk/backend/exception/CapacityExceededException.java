package com.weatherdesk.backend.exception;

import org.springframework.http.HttpStatus;

/** A configured size limit (live sessions) has been reached. */
public class CapacityExceededException extends BackendException {

    public CapacityExceededException(String message) {
        super(message, HttpStatus.SERVICE_UNAVAILABLE, true);
    }
}
