package com.weatherdesk.backend.exception;

import org.springframework.http.HttpStatus;

public class UnknownCityException extends BackendException {

    public UnknownCityException(String city) {
        super("Weather data not available for city: " + city, HttpStatus.NOT_FOUND, false);
    }
}
