package com.weatherdesk.backend.service;

import java.time.ZoneId;

/**
 * Static facts about a city that the derived weather metrics need.
 *
 * @param humidity relative humidity in percent
 * @param zone     the city's local time zone
 */
public record CityProfile(double humidity, ZoneId zone) {
}
