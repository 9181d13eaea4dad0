package com.weatherdesk.backend.service;

import com.weatherdesk.backend.config.BackendSettings;
import com.weatherdesk.backend.dto.CityWeather;
import com.weatherdesk.backend.dto.WeatherReport;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.Exceptions;

import java.time.Duration;
import java.util.OptionalDouble;

/**
 * Serves weather lookups from the {@link WeatherCache}, going to the
 * {@link WeatherProvider} only when the cache needs a new reading. Each fetch
 * is bounded by the configured deadline; a missed deadline surfaces as an
 * upstream failure and leaves the cache untouched.
 * <p>
 * Blocks on the provider, so call it off the event loop.
 */
@Service
public class WeatherService {

    private final WeatherCache cache;
    private final WeatherProvider provider;
    private final WeatherMetrics metrics;
    private final Duration fetchTimeout;

    @Autowired
    public WeatherService(WeatherCache cache, WeatherProvider provider, WeatherMetrics metrics,
                          BackendSettings settings) {
        this(cache, provider, metrics, settings.fetchTimeout());
    }

    public WeatherService(WeatherCache cache, WeatherProvider provider, WeatherMetrics metrics,
                          Duration fetchTimeout) {
        this.cache = cache;
        this.provider = provider;
        this.metrics = metrics;
        this.fetchTimeout = fetchTimeout;
    }

    public CityWeather lookup(String city) {
        return cache.recordAndGet(city, this::fetch);
    }

    /** Looks the city up and adds the metrics its profile allows. */
    public WeatherReport report(String city) {
        CityWeather weather = lookup(city);
        return provider.profile(weather.city())
                .map(profile -> metrics.describe(weather, profile))
                .orElseGet(() -> WeatherReport.withoutMetrics(weather));
    }

    private OptionalDouble fetch(String city) throws InterruptedException {
        Double value;
        try {
            value = provider.currentTemperature(city)
                    .timeout(fetchTimeout)
                    .block();
        } catch (RuntimeException e) {
            // block() wraps an interrupt in a RuntimeException and clears the flag
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                throw (InterruptedException) cause;
            }
            throw e;
        }
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }
}
