package com.weatherdesk.backend.service;

import com.weatherdesk.backend.dto.CityWeather;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded reading history and usage counter for one city. All mutable state is
 * guarded by the entry's own monitor, so lookups for the same city are
 * linearizable while other cities are untouched.
 */
final class WeatherEntry {

    private final String city;
    private final int maxReadings;
    private final Deque<Reading> readings;
    private long requestCount;
    private volatile long lastAccess;
    private boolean evicted;

    WeatherEntry(String city, int maxReadings, long lastAccess) {
        this.city = city;
        this.maxReadings = maxReadings;
        this.readings = new ArrayDeque<>(maxReadings);
        this.lastAccess = lastAccess;
    }

    String city() {
        return city;
    }

    long lastAccess() {
        return lastAccess;
    }

    /**
     * Counts a lookup served from the retained readings.
     *
     * @return the result, or null when the entry is stale, empty or evicted
     */
    synchronized CityWeather hitIfFresh(Instant now, Duration ttl, long tick) {
        if (evicted || readings.isEmpty()) {
            return null;
        }
        if (Duration.between(readings.peekLast().observedAt(), now).compareTo(ttl) >= 0) {
            return null;
        }
        lastAccess = tick;
        requestCount++;
        return view(true);
    }

    /**
     * Appends a freshly fetched reading and counts the lookup.
     *
     * @return the result, or null if the entry was evicted meanwhile
     */
    synchronized CityWeather append(Reading reading, long tick) {
        if (evicted) {
            return null;
        }
        if (readings.size() == maxReadings) {
            readings.pollFirst();
        }
        readings.addLast(reading);
        lastAccess = tick;
        requestCount++;
        return view(false);
    }

    synchronized void markEvicted() {
        evicted = true;
    }

    synchronized int readingCount() {
        return readings.size();
    }

    synchronized long requestCount() {
        return requestCount;
    }

    synchronized List<Reading> readings() {
        return List.copyOf(readings);
    }

    private CityWeather view(boolean cached) {
        List<Double> values = new ArrayList<>(readings.size());
        for (Reading r : readings) {
            values.add(r.value());
        }
        return new CityWeather(city, WeatherCache.weightedAverage(values), requestCount, cached);
    }
}
