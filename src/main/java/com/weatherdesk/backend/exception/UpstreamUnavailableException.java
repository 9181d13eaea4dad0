package com.weatherdesk.backend.exception;

import org.springframework.http.HttpStatus;

/**
 * The weather provider failed or missed its deadline. The cache is left as it
 * was before the lookup.
 */
public class UpstreamUnavailableException extends BackendException {

    private final boolean timedOut;

    public UpstreamUnavailableException(String message, Throwable cause, boolean timedOut) {
        super(message, cause, HttpStatus.BAD_GATEWAY, true);
        this.timedOut = timedOut;
    }

    public boolean timedOut() {
        return timedOut;
    }
}
