package com.weatherdesk.backend.service;

import java.util.OptionalDouble;

/**
 * Obtains a fresh reading for a normalized city key from the upstream provider.
 * An empty result means the provider has no data for that city.
 */
@FunctionalInterface
public interface ReadingFetcher {

    OptionalDouble fetch(String city) throws Exception;
}
