package com.weatherdesk.backend.service;

import com.weatherdesk.backend.config.BackendSettings;
import com.weatherdesk.backend.exception.StoreUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

/**
 * Single place that decides whether a request is authenticated. A login
 * succeeds only when the username exists and the password matches its stored
 * hash; there is no other path to a session.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuthService {

    private final ConnectionPool pool;
    private final SessionStore sessionStore;
    private final PasswordHasher hasher;
    private final BackendSettings settings;

    private record Credentials(long id, String username, String passwordHash) {}

    /**
     * Verifies credentials and opens a session.
     *
     * @return the new session, or empty if the credentials are invalid
     * @throws StoreUnavailableException if the user lookup fails
     */
    public Optional<Session> login(String username, String password) {
        if (username == null || username.isEmpty() || password == null || password.isEmpty()) {
            return Optional.empty();
        }
        Optional<Credentials> found = findByUsername(username);
        if (found.isEmpty()) {
            hasher.matchDecoy(password);
            log.info("Login rejected");
            return Optional.empty();
        }
        Credentials c = found.get();
        if (!hasher.matches(password, c.passwordHash())) {
            log.info("Login rejected");
            return Optional.empty();
        }
        Session session = sessionStore.create(c.id(), c.username());
        log.info("User {} logged in", c.username());
        return Optional.of(session);
    }

    public void logout(String token) {
        sessionStore.destroy(token);
    }

    /** Session for the token, or empty when the request is unauthenticated. */
    public Optional<Session> authorize(String token) {
        return sessionStore.validate(token);
    }

    private Optional<Credentials> findByUsername(String username) {
        final String sql = "SELECT id, username, password_hash FROM users WHERE username = ?";
        try {
            return pool.withConnection(settings.acquireTimeout(), conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    ps.setString(1, username);
                    try (ResultSet rs = ps.executeQuery()) {
                        if (!rs.next()) {
                            return Optional.empty();
                        }
                        return Optional.of(new Credentials(rs.getLong("id"), rs.getString("username"),
                                rs.getString("password_hash")));
                    }
                }
            });
        } catch (SQLException e) {
            log.error("User lookup failed", e);
            throw new StoreUnavailableException("Login is temporarily unavailable", e);
        }
    }
}
