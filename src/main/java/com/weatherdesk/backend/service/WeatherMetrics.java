package com.weatherdesk.backend.service;

import com.weatherdesk.backend.dto.CityWeather;
import com.weatherdesk.backend.dto.WeatherReport;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZonedDateTime;

/**
 * Derives heat index and comfort score from a cached average. The daytime
 * window for the comfort score is judged by the hour in the city's own zone.
 */
@Component
public class WeatherMetrics {

    static final int DAY_START_HOUR = 9;
    static final int DAY_END_HOUR = 17;
    static final double NIGHT_FACTOR = 0.8;

    private final Clock clock;

    public WeatherMetrics(Clock clock) {
        this.clock = clock;
    }

    public WeatherReport describe(CityWeather weather, CityProfile profile) {
        double avg = weather.avgTemp();
        double humidity = profile.humidity();
        return new WeatherReport(weather, humidity, heatIndex(avg, humidity),
                comfortScore(avg, humidity, localHour(profile)), profile.zone().getId());
    }

    static double heatIndex(double avgTemp, double humidity) {
        return avgTemp + humidity * 0.1 + avgTemp * humidity * 0.001;
    }

    static double comfortScore(double avgTemp, double humidity, int localHour) {
        double factor = localHour >= DAY_START_HOUR && localHour <= DAY_END_HOUR ? 1.0 : NIGHT_FACTOR;
        return avgTemp * factor / (1 + humidity / 100);
    }

    int localHour(CityProfile profile) {
        return ZonedDateTime.ofInstant(clock.instant(), profile.zone()).getHour();
    }
}
