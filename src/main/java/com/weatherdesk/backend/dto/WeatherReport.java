package com.weatherdesk.backend.dto;

/**
 * A weather lookup together with the metrics derived from it. The derived
 * fields are null when the provider has no profile for the city.
 *
 * @param weather      the cached lookup result
 * @param humidity     relative humidity in percent
 * @param heatIndex    apparent temperature from the average and humidity
 * @param comfortScore humidity-damped average, lowered outside local daytime
 * @param timezone     the city's zone id
 */
public record WeatherReport(CityWeather weather, Double humidity, Double heatIndex,
                            Double comfortScore, String timezone) {

    public static WeatherReport withoutMetrics(CityWeather weather) {
        return new WeatherReport(weather, null, null, null, null);
    }
}
