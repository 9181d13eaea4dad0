package com.weatherdesk.backend.service;

import java.time.Instant;

/** Server-side proof that a user authenticated, referenced by an opaque token. */
public record Session(String token, long userId, String username, Instant createdAt, Instant expiresAt) {

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
