package com.weatherdesk.backend.config;

import com.weatherdesk.backend.service.ConnectionPool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.sql.DriverManager;
import java.time.Clock;
import java.time.Duration;

@Configuration
@Slf4j
public class BackendConfig {

    @Value("${backend.cache.ttl:PT1M}")
    private Duration cacheTtl;

    @Value("${backend.cache.max-cities:100}")
    private int maxCities;

    @Value("${backend.cache.max-readings:10}")
    private int maxReadings;

    @Value("${backend.weather.fetch-timeout:PT5S}")
    private Duration fetchTimeout;

    @Value("${backend.session.max-sessions:1000}")
    private int maxSessions;

    @Value("${backend.session.expiry:PT30M}")
    private Duration sessionExpiry;

    @Value("${backend.pool.size:5}")
    private int poolSize;

    @Value("${backend.pool.acquire-timeout:PT2S}")
    private Duration acquireTimeout;

    @Value("${backend.db.url:jdbc:sqlite:data/app.db}")
    private String dbUrl;

    @Bean
    public BackendSettings backendSettings() {
        BackendSettings settings = new BackendSettings(cacheTtl, maxCities, maxReadings, fetchTimeout,
                maxSessions, sessionExpiry, poolSize, acquireTimeout);
        log.info("Backend settings: {}", settings);
        return settings;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Pool of connections to the backing SQLite store. Closed by Spring on
     * shutdown through {@link ConnectionPool#close()}.
     */
    @Bean(destroyMethod = "close")
    public ConnectionPool connectionPool(BackendSettings settings) {
        ConnectionPool.ensureParentDirectory(dbUrl);
        return new ConnectionPool(() -> DriverManager.getConnection(dbUrl), settings.poolSize());
    }
}
