package com.weatherdesk.backend.service;

import com.weatherdesk.backend.config.BackendSettings;
import com.weatherdesk.backend.dto.CityWeather;
import com.weatherdesk.backend.exception.BackendException;
import com.weatherdesk.backend.exception.UnknownCityException;
import com.weatherdesk.backend.exception.UpstreamUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded per-city weather cache.
 * <p>
 * At most {@code maxCities} cities are tracked, least recently used first out,
 * and each keeps at most {@code maxReadings} readings. Lookups of a known city
 * only synchronize on that city's entry. Admitting a new city takes a short
 * admission lock so the city bound is never exceeded, even transiently.
 * Upstream fetches always run outside any lock.
 */
@Service
@Slf4j
public class WeatherCache {

    private final Map<String, WeatherEntry> entries = new ConcurrentHashMap<>();
    private final Object admissionLock = new Object();
    private final AtomicLong accessTicks = new AtomicLong();
    private final AtomicLong totalRequests = new AtomicLong();
    private final Duration ttl;
    private final int maxCities;
    private final int maxReadings;
    private final Clock clock;

    @Autowired
    public WeatherCache(BackendSettings settings, Clock clock) {
        this(settings.cacheTtl(), settings.maxCities(), settings.maxReadings(), clock);
    }

    public WeatherCache(Duration ttl, int maxCities, int maxReadings, Clock clock) {
        this.ttl = ttl;
        this.maxCities = maxCities;
        this.maxReadings = maxReadings;
        this.clock = clock;
    }

    /**
     * Looks up a city, fetching a new reading only when the cached one is
     * missing or older than the TTL. Every completed call is counted exactly
     * once; a failed fetch leaves the cache unchanged.
     *
     * @throws IllegalArgumentException     if the city is blank
     * @throws UpstreamUnavailableException if the fetcher fails or times out
     * @throws UnknownCityException         if the provider has no data for the city
     */
    public CityWeather recordAndGet(String city, ReadingFetcher fetcher) {
        String key = normalize(city);

        WeatherEntry existing = entries.get(key);
        if (existing != null) {
            CityWeather hit = existing.hitIfFresh(clock.instant(), ttl, accessTicks.incrementAndGet());
            if (hit != null) {
                totalRequests.incrementAndGet();
                return hit;
            }
        }

        Reading reading = new Reading(fetch(key, fetcher), clock.instant());
        while (true) {
            WeatherEntry entry = entries.get(key);
            if (entry == null) {
                entry = admit(key);
            }
            CityWeather result = entry.append(reading, accessTicks.incrementAndGet());
            if (result != null) {
                totalRequests.incrementAndGet();
                return result;
            }
            // evicted between lookup and append; admit it again
        }
    }

    /** Number of cities currently tracked. */
    public int size() {
        return entries.size();
    }

    /** Lookups completed since startup, across all cities including evicted ones. */
    public long totalRequests() {
        return totalRequests.get();
    }

    public int maxCities() {
        return maxCities;
    }

    public int maxReadings() {
        return maxReadings;
    }

    /** Retained readings for a city, oldest first. */
    public List<Reading> readings(String city) {
        WeatherEntry entry = entries.get(normalize(city));
        return entry == null ? List.of() : entry.readings();
    }

    public Optional<Long> requestCount(String city) {
        WeatherEntry entry = entries.get(normalize(city));
        return entry == null ? Optional.empty() : Optional.of(entry.requestCount());
    }

    public void clear() {
        synchronized (admissionLock) {
            entries.values().forEach(WeatherEntry::markEvicted);
            entries.clear();
        }
    }

    /**
     * Average where the reading at position {@code i} (0 = oldest) has weight
     * {@code i + 1}.
     */
    public static double weightedAverage(List<Double> values) {
        if (values.isEmpty()) {
            return 0;
        }
        double weighted = 0;
        long weights = 0;
        for (int i = 0; i < values.size(); i++) {
            int w = i + 1;
            weighted += values.get(i) * w;
            weights += w;
        }
        return weighted / weights;
    }

    static String normalize(String city) {
        if (city == null || city.isBlank()) {
            throw new IllegalArgumentException("City parameter is required");
        }
        return city.trim().toLowerCase(Locale.ROOT);
    }

    private double fetch(String key, ReadingFetcher fetcher) {
        OptionalDouble value;
        try {
            value = fetcher.fetch(key);
        } catch (BackendException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamUnavailableException("Weather lookup interrupted for " + key, e, false);
        } catch (Exception e) {
            boolean timedOut = isTimeout(e);
            log.warn("Weather fetch failed for {}: {}", key, timedOut ? "timed out" : e.getMessage());
            throw new UpstreamUnavailableException(
                    timedOut ? "Weather provider timed out" : "Weather provider unavailable", e, timedOut);
        }
        if (value == null || value.isEmpty()) {
            throw new UnknownCityException(key);
        }
        double v = value.getAsDouble();
        if (Double.isNaN(v) || Double.isInfinite(v)) {
            throw new UpstreamUnavailableException("Weather provider returned an invalid reading", null, false);
        }
        return v;
    }

    private WeatherEntry admit(String key) {
        synchronized (admissionLock) {
            WeatherEntry entry = entries.get(key);
            if (entry != null) {
                return entry;
            }
            while (entries.size() >= maxCities) {
                evictLeastRecentlyUsed();
            }
            entry = new WeatherEntry(key, maxReadings, accessTicks.incrementAndGet());
            entries.put(key, entry);
            return entry;
        }
    }

    private void evictLeastRecentlyUsed() {
        WeatherEntry victim = null;
        for (WeatherEntry e : entries.values()) {
            if (victim == null || e.lastAccess() < victim.lastAccess()) {
                victim = e;
            }
        }
        if (victim != null) {
            victim.markEvicted();
            entries.remove(victim.city(), victim);
            log.debug("Evicted {} from weather cache", victim.city());
        }
    }

    private static boolean isTimeout(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof TimeoutException) {
                return true;
            }
        }
        return false;
    }
}
