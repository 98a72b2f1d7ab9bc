/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.entity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ExclusiveClaimTest {

    private static final Instant T0 = Instant.parse("2026-05-04T09:00:00Z");

    private EditLock begin(Duration lease) {
        var lock = new EditLock();
        lock.begin("version:1", "token-1", "alice", lease, T0);
        return lock;
    }

    @Test
    @DisplayName("Should be live until exactly the expiry instant")
    void shouldBeLiveUntilExpiry() {
        var lock = begin(Duration.ofMinutes(30));

        assertTrue(lock.isLiveAt(T0));
        assertTrue(lock.isLiveAt(T0.plus(Duration.ofMinutes(30)).minusMillis(1)));
        assertFalse(lock.isLiveAt(T0.plus(Duration.ofMinutes(30))));
        assertTrue(lock.isExpiredAt(T0.plus(Duration.ofMinutes(30))));
    }

    @Test
    @DisplayName("Should slide expiry forward on extend")
    void shouldExtendFromNow() {
        var lock = begin(Duration.ofMinutes(10));
        var later = T0.plus(Duration.ofMinutes(4));

        var expiresAt = lock.extend(later);

        assertEquals(later.plus(Duration.ofMinutes(10)), expiresAt);
        assertEquals(later, lock.getLastHeartbeatAt());
    }

    @Test
    @DisplayName("Should never move expiry backwards")
    void shouldNotShortenExpiry() {
        var lock = begin(Duration.ofMinutes(10));
        var original = lock.getExpiresAt();

        lock.extend(T0.minus(Duration.ofMinutes(1)));

        assertEquals(original, lock.getExpiresAt());
    }

    @Test
    @DisplayName("Should free the key when ended")
    void shouldFreeKeyOnEnd() {
        var lock = begin(Duration.ofMinutes(10));
        var at = T0.plusSeconds(5);

        lock.end(ClaimEndReason.RELEASED, "alice", at);

        assertNull(lock.getLiveKey());
        assertTrue(lock.isReleased());
        assertFalse(lock.isLiveAt(at));
        assertEquals(ClaimEndReason.RELEASED, lock.getEndReason());
        assertEquals("alice", lock.getEndedBy());
    }

    @Test
    @DisplayName("Should expose session fields through the claim")
    void shouldMapSessionFields() {
        var session = new UserSession();
        session.begin("user:alice", "sess-1", "alice", Duration.ofMinutes(60), T0);

        assertEquals("sess-1", session.getSessionId());
        assertEquals("alice", session.getUserId());
        assertEquals(T0, session.getCreatedAt());
        assertEquals(T0, session.getLastSeenAt());
    }
}
