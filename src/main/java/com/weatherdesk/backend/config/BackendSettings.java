package com.weatherdesk.backend.config;

import java.time.Duration;

/**
 * Limits and timeouts for the shared in-memory state and the connection pool.
 * Built once at startup by {@link BackendConfig} and handed to each component.
 *
 * @param cacheTtl          how long the newest reading of a city counts as fresh
 * @param maxCities         maximum number of cities tracked by the weather cache
 * @param maxReadings       readings retained per city
 * @param fetchTimeout      deadline for one upstream weather fetch
 * @param maxSessions       maximum number of live sessions
 * @param sessionExpiry     lifetime of a session from creation
 * @param poolSize          number of pooled database connections
 * @param acquireTimeout    how long a caller waits for a pooled connection
 */
public record BackendSettings(Duration cacheTtl,
                              int maxCities,
                              int maxReadings,
                              Duration fetchTimeout,
                              int maxSessions,
                              Duration sessionExpiry,
                              int poolSize,
                              Duration acquireTimeout) {

    public BackendSettings {
        requirePositive(cacheTtl, "cacheTtl");
        requirePositive(fetchTimeout, "fetchTimeout");
        requirePositive(sessionExpiry, "sessionExpiry");
        requirePositive(acquireTimeout, "acquireTimeout");
        if (maxCities < 1) throw new IllegalArgumentException("maxCities must be >= 1");
        if (maxReadings < 1) throw new IllegalArgumentException("maxReadings must be >= 1");
        if (maxSessions < 1) throw new IllegalArgumentException("maxSessions must be >= 1");
        if (poolSize < 1) throw new IllegalArgumentException("poolSize must be >= 1");
    }

    /** Defaults matching application.properties; handy for tests. */
    public static BackendSettings defaults() {
        return new BackendSettings(Duration.ofMinutes(1), 100, 10, Duration.ofSeconds(5),
                1000, Duration.ofMinutes(30), 5, Duration.ofSeconds(2));
    }

    private static void requirePositive(Duration d, String name) {
        if (d == null || d.isNegative() || d.isZero()) {
            throw new IllegalArgumentException(name + " must be a positive duration");
        }
    }
}
