package com.weatherdesk.backend.service;

import com.weatherdesk.backend.exception.CapacityExceededException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SessionStoreTest {

    private MutableClock clock;
    private SessionStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        store = new SessionStore(3, Duration.ofMinutes(30), clock);
    }

    @Test
    void createdSessionValidatesByExactToken() {
        Session s = store.create(7, "alice");

        Optional<Session> found = store.validate(s.token());
        assertTrue(found.isPresent());
        assertEquals(7, found.get().userId());
        assertEquals("alice", found.get().username());
        assertEquals(s.createdAt().plus(Duration.ofMinutes(30)), s.expiresAt());

        assertTrue(store.validate(s.token().substring(1)).isEmpty());
        assertTrue(store.validate(s.token() + "x").isEmpty());
        assertTrue(store.validate("").isEmpty());
        assertTrue(store.validate(null).isEmpty());
    }

    @Test
    void tokensAreUnique() {
        SessionStore big = new SessionStore(500, Duration.ofMinutes(5), clock);
        Set<String> tokens = new HashSet<>();
        for (int i = 0; i < 500; i++) {
            tokens.add(big.create(i, "u" + i).token());
        }
        assertEquals(500, tokens.size());
        assertEquals(500, big.size());
    }

    @Test
    void expiredTokenIsUnauthenticatedAndSweepLeavesLiveOnes() {
        Session old = store.create(1, "old");
        clock.advance(Duration.ofMinutes(20));
        Session fresh = store.create(2, "fresh");
        clock.advance(Duration.ofMinutes(15));

        assertTrue(store.validate(old.token()).isEmpty());
        assertEquals(0, store.sweepExpired());

        Session another = store.create(3, "another");
        clock.advance(Duration.ofMinutes(16));
        // fresh is now past 31 minutes, another is at 16
        assertEquals(1, store.sweepExpired());
        assertTrue(store.validate(fresh.token()).isEmpty());
        assertTrue(store.validate(another.token()).isPresent());
        assertEquals(1, store.size());
    }

    @Test
    void sweepRemovesExpiredWithoutTouchingUnrelatedToken() {
        Session expiring = store.create(1, "a");
        clock.advance(Duration.ofMinutes(29));
        Session live = store.create(2, "b");
        clock.advance(Duration.ofMinutes(2));

        assertEquals(1, store.sweepExpired());
        assertTrue(store.validate(expiring.token()).isEmpty());
        assertEquals("b", store.validate(live.token()).orElseThrow().username());
    }

    @Test
    void destroyIsIdempotent() {
        Session s = store.create(1, "a");
        store.destroy(s.token());
        store.destroy(s.token());
        store.destroy("never-issued");
        store.destroy(null);
        assertTrue(store.validate(s.token()).isEmpty());
        assertEquals(0, store.size());
    }

    @Test
    void capacityIsEnforcedAndFreedByDestroy() {
        Session first = store.create(1, "a");
        store.create(2, "b");
        store.create(3, "c");

        assertThrows(CapacityExceededException.class, () -> store.create(4, "d"));

        store.destroy(first.token());
        assertNotNull(store.create(4, "d"));
        assertEquals(3, store.size());
    }

    @Test
    void expiredSessionsAreSweptBeforeRejectingCreate() {
        store.create(1, "a");
        store.create(2, "b");
        store.create(3, "c");
        clock.advance(Duration.ofHours(1));

        Session s = store.create(4, "d");
        assertTrue(store.validate(s.token()).isPresent());
        assertEquals(1, store.size());
    }

    @Test
    void concurrentCreatesNeverExceedCapacity() throws Exception {
        SessionStore bounded = new SessionStore(50, Duration.ofMinutes(5), clock);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger created = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();
        for (int i = 0; i < 200; i++) {
            final int id = i;
            pool.submit(() -> {
                start.await();
                try {
                    bounded.create(id, "u" + id);
                    created.incrementAndGet();
                } catch (CapacityExceededException e) {
                    rejected.incrementAndGet();
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(50, created.get());
        assertEquals(150, rejected.get());
        assertEquals(50, bounded.size());
    }
}
