package com.weatherdesk.backend.service;

import com.weatherdesk.backend.config.BackendSettings;
import com.weatherdesk.backend.exception.CapacityExceededException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;

/**
 * Thread-safe mapping from session token to authenticated identity.
 * <p>
 * Live sessions are bounded by a semaphore holding one permit per free slot.
 * A permit is taken before a session is inserted and given back by whichever
 * caller actually removes that session from the map, so the bound holds
 * without locking the map.
 */
@Service
@Slf4j
public class SessionStore {

    private static final int TOKEN_BYTES = 32;

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final SecureRandom random = new SecureRandom();
    private final Base64.Encoder encoder = Base64.getUrlEncoder().withoutPadding();
    private final Semaphore slots;
    private final int maxSessions;
    private final Duration expiry;
    private final Clock clock;

    @Autowired
    public SessionStore(BackendSettings settings, Clock clock) {
        this(settings.maxSessions(), settings.sessionExpiry(), clock);
    }

    public SessionStore(int maxSessions, Duration expiry, Clock clock) {
        this.maxSessions = maxSessions;
        this.expiry = expiry;
        this.clock = clock;
        this.slots = new Semaphore(maxSessions);
    }

    /**
     * Issues a new session for an authenticated user.
     *
     * @throws CapacityExceededException if the live-session limit is reached
     *                                   even after dropping expired sessions
     */
    public Session create(long userId, String username) {
        if (!slots.tryAcquire()) {
            sweepExpired();
            if (!slots.tryAcquire()) {
                throw new CapacityExceededException("Too many active sessions, try again later");
            }
        }
        Instant now = clock.instant();
        while (true) {
            Session session = new Session(newToken(), userId, username, now, now.plus(expiry));
            if (sessions.putIfAbsent(session.token(), session) == null) {
                log.debug("Created session for user {}", username);
                return session;
            }
        }
    }

    /**
     * Returns the session for an exact, unexpired token match. Anything else,
     * including a null or blank token, is unauthenticated.
     */
    public Optional<Session> validate(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        Session session = sessions.get(token);
        if (session == null) {
            return Optional.empty();
        }
        if (session.isExpired(clock.instant())) {
            removeIfSame(session);
            return Optional.empty();
        }
        return Optional.of(session);
    }

    /** Removes a session. Unknown tokens are ignored. */
    public void destroy(String token) {
        if (token == null) {
            return;
        }
        if (sessions.remove(token) != null) {
            slots.release();
            log.debug("Destroyed session");
        }
    }

    /**
     * Drops every session past its expiry.
     *
     * @return number of sessions removed by this call
     */
    public int sweepExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (Session session : sessions.values()) {
            if (session.isExpired(now) && removeIfSame(session)) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Swept {} expired session(s), {} live", removed, sessions.size());
        }
        return removed;
    }

    public int size() {
        return sessions.size();
    }

    public int maxSessions() {
        return maxSessions;
    }

    private boolean removeIfSame(Session session) {
        if (sessions.remove(session.token(), session)) {
            slots.release();
            return true;
        }
        return false;
    }

    private String newToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        return encoder.encodeToString(bytes);
    }
}
