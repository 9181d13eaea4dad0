package com.weatherdesk.backend.service;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Periodically clears expired sessions so they do not hold capacity. */
@Component
@RequiredArgsConstructor
public class SessionSweeper {

    private final SessionStore sessionStore;

    @Scheduled(fixedDelayString = "${backend.session.sweep-interval:60000}",
            initialDelayString = "${backend.session.sweep-interval:60000}")
    public void sweep() {
        sessionStore.sweepExpired();
    }
}
