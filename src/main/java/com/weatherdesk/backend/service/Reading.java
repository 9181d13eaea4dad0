package com.weatherdesk.backend.service;

import java.time.Instant;

/** One temperature observation for a city. */
public record Reading(double value, Instant observedAt) {
}
