package com.weatherdesk.backend.controller;

import com.weatherdesk.backend.dto.StatsSnapshot;
import com.weatherdesk.backend.service.AuthService;
import com.weatherdesk.backend.service.SessionStore;
import com.weatherdesk.backend.service.StatsAggregator;
import com.weatherdesk.backend.service.WeatherCache;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class OpsController {

    private final StatsAggregator statsAggregator;
    private final AuthService auth;
    private final SessionStore sessionStore;
    private final WeatherCache weatherCache;

    @Value("${spring.application.name:weatherdesk-backend}")
    private String serviceName;

    @Value("${backend.version:0.1.0}")
    private String version;

    /** Counts from the store and the in-memory caches; degraded rather than failed on store outages. */
    @GetMapping("/db-stats")
    public Mono<StatsSnapshot> dbStats() {
        return Mono.fromCallable(statsAggregator::snapshot)
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/config")
    public ResponseEntity<Map<String, Object>> config(
            @RequestHeader(value = AuthController.SESSION_HEADER, required = false) String token) {
        if (auth.authorize(token).isEmpty()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(Map.of("error", "Authentication required"));
        }
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("serviceName", serviceName);
        m.put("version", version);
        m.put("activeSessions", sessionStore.size());
        m.put("maxSessions", sessionStore.maxSessions());
        m.put("cacheSize", weatherCache.size());
        m.put("maxCities", weatherCache.maxCities());
        return ResponseEntity.ok(m);
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("status", "healthy");
        m.put("service", serviceName);
        m.put("timestamp", Instant.now().toString());
        return m;
    }
}
