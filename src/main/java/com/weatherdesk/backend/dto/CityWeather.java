package com.weatherdesk.backend.dto;

/**
 * Result of one weather lookup.
 *
 * @param city     normalized city key
 * @param avgTemp  recency-weighted average of the retained readings
 * @param reqCount completed lookups for this city, this one included
 * @param cached   true when no upstream fetch was needed
 */
public record CityWeather(String city, double avgTemp, long reqCount, boolean cached) {
}
