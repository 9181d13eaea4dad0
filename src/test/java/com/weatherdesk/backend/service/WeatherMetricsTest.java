package com.weatherdesk.backend.service;

import com.weatherdesk.backend.dto.CityWeather;
import com.weatherdesk.backend.dto.WeatherReport;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;

class WeatherMetricsTest {

    private static final CityProfile LONDON = new CityProfile(70, ZoneId.of("Europe/London"));
    private static final CityProfile TOKYO = new CityProfile(75, ZoneId.of("Asia/Tokyo"));

    // 13:00 in London (BST), 21:00 in Tokyo
    private final MutableClock clock = new MutableClock(Instant.parse("2024-07-01T12:00:00Z"));
    private final WeatherMetrics metrics = new WeatherMetrics(clock);

    @Test
    void comfortUsesTheCitysLocalHour() {
        assertEquals(13, metrics.localHour(LONDON));
        assertEquals(21, metrics.localHour(TOKYO));

        WeatherReport london = metrics.describe(new CityWeather("london", 20.0, 1, false), LONDON);
        WeatherReport tokyo = metrics.describe(new CityWeather("tokyo", 20.0, 1, false), TOKYO);

        assertEquals(20.0 / 1.70, london.comfortScore(), 1e-9);
        assertEquals(20.0 * 0.8 / 1.75, tokyo.comfortScore(), 1e-9);
    }

    @Test
    void daytimeWindowIncludesBothEnds() {
        // 08:00 UTC is 09:00 in London during BST
        MutableClock morning = new MutableClock(Instant.parse("2024-07-01T08:00:00Z"));
        WeatherMetrics m = new WeatherMetrics(morning);
        CityWeather w = new CityWeather("london", 10.0, 1, false);

        assertEquals(10.0 / 1.70, m.describe(w, LONDON).comfortScore(), 1e-9);
        morning.advance(Duration.ofHours(8));
        assertEquals(17, m.localHour(LONDON));
        assertEquals(10.0 / 1.70, m.describe(w, LONDON).comfortScore(), 1e-9);
        morning.advance(Duration.ofHours(1));
        assertEquals(10.0 * 0.8 / 1.70, m.describe(w, LONDON).comfortScore(), 1e-9);
    }

    @Test
    void heatIndexAndZoneAreReported() {
        WeatherReport report = metrics.describe(new CityWeather("tokyo", 25.0, 3, true), TOKYO);

        assertEquals(25.0 + 7.5 + 25.0 * 75 * 0.001, report.heatIndex(), 1e-9);
        assertEquals(75.0, report.humidity());
        assertEquals("Asia/Tokyo", report.timezone());
        assertEquals(3, report.weather().reqCount());
    }
}
