package com.weatherdesk.backend.service;

import com.weatherdesk.backend.dto.CityWeather;
import com.weatherdesk.backend.exception.UnknownCityException;
import com.weatherdesk.backend.exception.UpstreamUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class WeatherCacheTest {

    private static final Duration TTL = Duration.ofMinutes(1);

    private MutableClock clock;
    private WeatherCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        cache = new WeatherCache(TTL, 3, 4, clock);
    }

    @Test
    void weightedAverageUsesLinearRecencyWeights() {
        assertEquals(16.67, WeatherCache.weightedAverage(List.of(10.0, 20.0)), 0.005);
        // (1*1 + 2*2 + 3*3) / 6
        assertEquals(14.0 / 6.0, WeatherCache.weightedAverage(List.of(1.0, 2.0, 3.0)), 1e-9);
        assertEquals(5.0, WeatherCache.weightedAverage(List.of(5.0)), 1e-9);
        assertEquals(0.0, WeatherCache.weightedAverage(List.of()), 1e-9);
    }

    @Test
    void freshHitDoesNotCallFetcher() {
        AtomicInteger calls = new AtomicInteger();
        ReadingFetcher fetcher = city -> {
            calls.incrementAndGet();
            return OptionalDouble.of(12.0);
        };

        CityWeather first = cache.recordAndGet("London", fetcher);
        clock.advance(Duration.ofSeconds(30));
        CityWeather second = cache.recordAndGet("  LONDON ", fetcher);

        assertEquals(1, calls.get());
        assertFalse(first.cached());
        assertTrue(second.cached());
        assertEquals("london", second.city());
        assertEquals(2, second.reqCount());
        assertEquals(12.0, second.avgTemp(), 1e-9);
    }

    @Test
    void staleEntryFetchesAndAveragesByRecency() {
        double[] next = {10.0, 20.0};
        AtomicInteger calls = new AtomicInteger();
        ReadingFetcher fetcher = city -> OptionalDouble.of(next[calls.getAndIncrement()]);

        cache.recordAndGet("paris", fetcher);
        clock.advance(TTL);
        CityWeather result = cache.recordAndGet("paris", fetcher);

        assertEquals(2, calls.get());
        assertFalse(result.cached());
        assertEquals(2, result.reqCount());
        assertEquals(16.67, result.avgTemp(), 0.005);
    }

    @Test
    void readingsPerCityAreBounded() {
        AtomicInteger n = new AtomicInteger();
        ReadingFetcher fetcher = city -> OptionalDouble.of(n.incrementAndGet());

        for (int i = 0; i < 10; i++) {
            cache.recordAndGet("rome", fetcher);
            clock.advance(TTL);
        }

        List<Reading> readings = cache.readings("rome");
        assertEquals(4, readings.size());
        assertEquals(List.of(7.0, 8.0, 9.0, 10.0), readings.stream().map(Reading::value).toList());
        assertEquals(10L, cache.requestCount("rome").orElseThrow());
    }

    @Test
    void citiesAreBoundedWithLeastRecentlyUsedEvicted() {
        ReadingFetcher fetcher = city -> OptionalDouble.of(1.0);

        cache.recordAndGet("a", fetcher);
        cache.recordAndGet("b", fetcher);
        cache.recordAndGet("c", fetcher);
        cache.recordAndGet("a", fetcher); // a is now more recent than b
        cache.recordAndGet("d", fetcher);

        assertEquals(3, cache.size());
        assertTrue(cache.requestCount("b").isEmpty());
        assertEquals(2L, cache.requestCount("a").orElseThrow());
        assertTrue(cache.requestCount("c").isPresent());
        assertTrue(cache.requestCount("d").isPresent());
        assertEquals(5, cache.totalRequests());
    }

    @Test
    void cityCountNeverExceedsBoundUnderConcurrency() throws Exception {
        WeatherCache bounded = new WeatherCache(TTL, 5, 3, clock);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        List<Future<?>> futures = new ArrayList<>();
        AtomicInteger maxSeen = new AtomicInteger();
        for (int i = 0; i < 400; i++) {
            String city = "city-" + (i % 40);
            futures.add(pool.submit(() -> {
                bounded.recordAndGet(city, c -> OptionalDouble.of(3.0));
                maxSeen.accumulateAndGet(bounded.size(), Math::max);
            }));
        }
        for (Future<?> f : futures) {
            f.get(10, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertTrue(maxSeen.get() <= 5, "saw " + maxSeen.get() + " cities");
        assertTrue(bounded.size() <= 5);
        assertEquals(400, bounded.totalRequests());
    }

    @Test
    void concurrentLookupsForSameCityAreAllCounted() throws Exception {
        WeatherCache shared = new WeatherCache(TTL, 10, 5, clock);
        int threads = 16;
        int perThread = 250;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    shared.recordAndGet("Tokyo", c -> OptionalDouble.of(25.0));
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) {
            f.get(20, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertEquals((long) threads * perThread, shared.requestCount("tokyo").orElseThrow());
        assertEquals((long) threads * perThread, shared.totalRequests());
    }

    @Test
    void upstreamFailureLeavesCacheUnchanged() {
        ReadingFetcher failing = city -> {
            throw new IOException("connection refused");
        };

        UpstreamUnavailableException ex = assertThrows(UpstreamUnavailableException.class,
                () -> cache.recordAndGet("berlin", failing));
        assertFalse(ex.timedOut());
        assertTrue(ex.retryable());
        assertEquals(0, cache.size());
        assertEquals(0, cache.totalRequests());

        cache.recordAndGet("berlin", city -> OptionalDouble.of(12.0));
        clock.advance(TTL);
        assertThrows(UpstreamUnavailableException.class, () -> cache.recordAndGet("berlin", failing));
        assertEquals(1, cache.readings("berlin").size());
        assertEquals(1L, cache.requestCount("berlin").orElseThrow());
    }

    @Test
    void timeoutIsReportedAsUpstreamTimeout() {
        ReadingFetcher slow = city -> {
            throw new RuntimeException(new TimeoutException("deadline"));
        };

        UpstreamUnavailableException ex = assertThrows(UpstreamUnavailableException.class,
                () -> cache.recordAndGet("madrid", slow));
        assertTrue(ex.timedOut());
        assertEquals(0, cache.size());
    }

    @Test
    void unknownCityIsNotCached() {
        assertThrows(UnknownCityException.class, () -> cache.recordAndGet("atlantis", c -> OptionalDouble.empty()));
        assertEquals(0, cache.size());
    }

    @Test
    void blankCityIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> cache.recordAndGet("  ", c -> OptionalDouble.of(1.0)));
        assertThrows(IllegalArgumentException.class, () -> cache.recordAndGet(null, c -> OptionalDouble.of(1.0)));
    }

    @Test
    void nonFiniteReadingIsRejected() {
        assertThrows(UpstreamUnavailableException.class,
                () -> cache.recordAndGet("oslo", c -> OptionalDouble.of(Double.NaN)));
        assertEquals(0, cache.size());
    }
}
