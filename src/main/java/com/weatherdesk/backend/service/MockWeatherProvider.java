package com.weatherdesk.backend.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.ZoneId;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Stand-in for a real weather API: a fixed table of base temperatures with
 * a little jitter so repeated fetches produce different readings.
 */
@Component
@Slf4j
public class MockWeatherProvider implements WeatherProvider {

    private static final double JITTER = 3.0;

    private static final Map<String, Double> BASE_TEMPS = Map.of(
            "london", 15.5,
            "paris", 18.2,
            "new york", 22.1,
            "tokyo", 25.3,
            "berlin", 12.8,
            "madrid", 28.4,
            "rome", 24.7,
            "moscow", 8.3,
            "sydney", 21.6,
            "toronto", 16.9);

    private static final Map<String, CityProfile> PROFILES = Map.of(
            "london", profile(70, "Europe/London"),
            "paris", profile(65, "Europe/Paris"),
            "new york", profile(60, "America/New_York"),
            "tokyo", profile(75, "Asia/Tokyo"),
            "berlin", profile(68, "Europe/Berlin"),
            "madrid", profile(45, "Europe/Madrid"),
            "rome", profile(55, "Europe/Rome"),
            "moscow", profile(80, "Europe/Moscow"),
            "sydney", profile(62, "Australia/Sydney"),
            "toronto", profile(72, "America/Toronto"));

    @Override
    public Mono<Double> currentTemperature(String city) {
        return Mono.fromSupplier(() -> BASE_TEMPS.get(city))
                .map(base -> base + ThreadLocalRandom.current().nextDouble(-JITTER, JITTER))
                .doOnNext(t -> log.debug("Mock reading for {}: {}", city, t));
    }

    @Override
    public Optional<CityProfile> profile(String city) {
        return Optional.ofNullable(PROFILES.get(city));
    }

    private static CityProfile profile(double humidity, String zone) {
        return new CityProfile(humidity, ZoneId.of(zone));
    }
}
