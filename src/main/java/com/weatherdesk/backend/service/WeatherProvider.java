package com.weatherdesk.backend.service;

import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Upstream source of current temperatures. Emits one reading in degrees
 * Celsius, completes empty when the city is unknown, or errors when the
 * provider is unreachable.
 */
public interface WeatherProvider {

    Mono<Double> currentTemperature(String city);

    /** Humidity and time zone for a normalized city key, if the provider knows them. */
    default Optional<CityProfile> profile(String city) {
        return Optional.empty();
    }
}
