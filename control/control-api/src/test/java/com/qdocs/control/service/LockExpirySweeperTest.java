/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.service;

import com.qdocs.control.ControlIntegrationTest;
import com.qdocs.control.TestIdentityProvider;
import com.qdocs.control.entity.AuditAction;
import com.qdocs.control.entity.AuditTargetType;
import com.qdocs.control.model.FailureReason;
import com.qdocs.control.service.SessionService.InvalidReason;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class LockExpirySweeperTest extends ControlIntegrationTest {

    @Autowired
    private LockExpirySweeper sweeper;

    @Autowired
    private EditLockService lockService;

    @Autowired
    private SessionService sessionService;

    @Autowired
    private AuditTrailService auditTrailService;

    /**
     * Sweeps until nothing expired is left; other tests may have left expired claims behind.
     */
    private LockExpirySweeper.SweepReport sweepAll() {
        int locks = 0;
        int sessions = 0;
        for (int pass = 0; pass < 100; pass++) {
            var report = sweeper.sweepOnce();
            if (report.total() == 0) {
                break;
            }
            locks += report.locksReclaimed();
            sessions += report.sessionsExpired();
        }
        return new LockExpirySweeper.SweepReport(locks, sessions);
    }

    @Test
    @DisplayName("Should reclaim an expired lock so another user can acquire it")
    void shouldReclaimExpiredLock() {
        var alice = author();
        var version = newDraft(alice);
        var grant = lockService.acquire(version.getId(), alice, Duration.ofMinutes(1), CLIENT, null).getValue();
        clock.advance(Duration.ofMinutes(2));

        var report = sweepAll();

        assertTrue(report.locksReclaimed() >= 1);
        var last = auditTrailService.versionHistory(version.getId()).stream().reduce((a, b) -> b).orElseThrow();
        assertEquals(AuditAction.LOCK_EXPIRED, last.getAction());
        assertEquals("system", last.getActorId());
        assertEquals(FailureReason.LOCK_EXPIRED, lockService.heartbeat(grant.token(), alice).reason());
        assertTrue(lockService.acquire(version.getId(), author(), null, CLIENT, null).isSuccess());
    }

    @Test
    @DisplayName("Should leave live locks alone")
    void shouldLeaveLiveLocks() {
        var alice = author();
        var version = newDraft(alice);
        lockService.acquire(version.getId(), alice, Duration.ofMinutes(30), CLIENT, null);
        sweepAll();

        clock.advance(Duration.ofMinutes(10));
        sweepAll();

        assertTrue(lockService.inspect(version.getId()).getValue().held());
    }

    @Test
    @DisplayName("Should skip a lock whose heartbeat landed before the reclaim")
    void shouldSkipRenewedLock() {
        var alice = author();
        var version = newDraft(alice);
        var grant = lockService.acquire(version.getId(), alice, Duration.ofMinutes(5), CLIENT, null).getValue();
        clock.advance(Duration.ofMinutes(6));
        var expiredIds = lockService.findExpiredLockIds(1000);
        assertFalse(expiredIds.isEmpty());

        // A late reclaim of an id that is no longer expired must be a no-op.
        var versionLock = lockService.acquire(version.getId(), alice, Duration.ofMinutes(5), CLIENT, null).getValue();
        assertNotEquals(grant.token(), versionLock.token());
        for (var id : expiredIds) {
            lockService.reclaimExpired(id);
        }

        assertTrue(lockService.inspect(version.getId()).getValue().held());
        assertTrue(lockService.heartbeat(versionLock.token(), alice).isSuccess());
    }

    @Test
    @DisplayName("Should close expired sessions")
    void shouldCloseExpiredSessions() {
        var userId = unique("author");
        var session = sessionService.login(userId, TestIdentityProvider.SECRET, false, CLIENT).getValue();
        clock.advance(Duration.ofMinutes(61));

        var report = sweepAll();

        assertTrue(report.sessionsExpired() >= 1);
        assertEquals(InvalidReason.EXPIRED, sessionService.validate(session.getSessionId()).reason());
        var last = auditTrailService.history(AuditTargetType.SESSION, userId).stream().reduce((a, b) -> b).orElseThrow();
        assertEquals(AuditAction.SESSION_EXPIRED, last.getAction());
    }
}
