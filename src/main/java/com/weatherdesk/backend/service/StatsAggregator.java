package com.weatherdesk.backend.service;

import com.weatherdesk.backend.config.BackendSettings;
import com.weatherdesk.backend.dto.StatsSnapshot;
import com.weatherdesk.backend.exception.PoolTimeoutException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * Builds {@link StatsSnapshot}s from the session store, the weather cache and
 * one count query. A store outage degrades the snapshot instead of failing it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StatsAggregator {

    static final String TOTAL_USERS = "totalUsers";

    private final ConnectionPool pool;
    private final WeatherCache weatherCache;
    private final SessionStore sessionStore;
    private final BackendSettings settings;

    public StatsSnapshot snapshot() {
        Long totalUsers = countUsers();
        StatsSnapshot.CacheStatus cacheStatus =
                new StatsSnapshot.CacheStatus(weatherCache.size(), sessionStore.size());
        List<String> missing = totalUsers == null ? List.of(TOTAL_USERS) : List.of();
        return new StatsSnapshot(totalUsers, weatherCache.totalRequests(), cacheStatus,
                !missing.isEmpty(), missing);
    }

    private Long countUsers() {
        try {
            return pool.withConnection(settings.acquireTimeout(), conn -> {
                try (Statement s = conn.createStatement();
                     ResultSet rs = s.executeQuery("SELECT COUNT(*) FROM users")) {
                    return rs.next() ? rs.getLong(1) : 0L;
                }
            });
        } catch (SQLException | PoolTimeoutException e) {
            log.warn("User count unavailable, returning partial stats: {}", e.getMessage());
            return null;
        }
    }
}
