/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.service;

import com.qdocs.control.ControlIntegrationTest;
import com.qdocs.control.entity.AuditAction;
import com.qdocs.control.entity.VersionStatus;
import com.qdocs.control.model.Actor;
import com.qdocs.control.model.Capability;
import com.qdocs.control.model.FailureReason;
import com.qdocs.control.model.InputLimits;
import com.qdocs.control.model.WorkflowAction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class EditLockServiceTest extends ControlIntegrationTest {

    @Autowired
    private EditLockService lockService;

    @Autowired
    private VersionWorkflowService workflowService;

    @Autowired
    private AuditTrailService auditTrailService;

    @Test
    @DisplayName("Should acquire an available lock")
    void shouldAcquireAvailableLock() {
        var alice = author();
        var version = newDraft(alice);

        var result = lockService.acquire(version.getId(), alice, null, CLIENT, "tab-1");

        assertTrue(result.isSuccess());
        var grant = result.getValue();
        assertNotNull(grant.token());
        assertEquals(alice.id(), grant.holderId());
        assertFalse(grant.renewed());
        assertEquals(grant.acquiredAt().plus(Duration.ofMinutes(30)), grant.expiresAt());
    }

    @Test
    @DisplayName("Should refuse a lock held by another user and name the holder")
    void shouldRefuseLockHeldByOther() {
        var alice = author();
        var bob = author();
        var version = newDraft(alice);
        var grant = lockService.acquire(version.getId(), alice, null, CLIENT, null).getValue();

        var result = lockService.acquire(version.getId(), bob, null, CLIENT, null);

        assertEquals(FailureReason.LOCK_HELD, result.reason());
        assertEquals(alice.id(), result.getError().holderId().orElseThrow());
        assertEquals(grant.acquiredAt(), result.getError().heldSince().orElseThrow());
    }

    @Test
    @DisplayName("Should renew instead of duplicating when the holder acquires again")
    void shouldRenewForSameHolder() {
        var alice = author();
        var version = newDraft(alice);
        var first = lockService.acquire(version.getId(), alice, Duration.ofMinutes(10), CLIENT, null).getValue();
        clock.advance(Duration.ofMinutes(5));

        var second = lockService.acquire(version.getId(), alice, Duration.ofMinutes(10), CLIENT, null).getValue();

        assertTrue(second.renewed());
        assertEquals(first.token(), second.token());
        assertTrue(second.expiresAt().isAfter(first.expiresAt()));
    }

    @Test
    @DisplayName("Should clamp the requested duration to the configured bounds")
    void shouldClampDuration() {
        var alice = author();
        var version = newDraft(alice);

        var grant = lockService.acquire(version.getId(), alice, Duration.ofDays(3), CLIENT, null).getValue();

        assertEquals(Duration.ofHours(8), Duration.between(grant.acquiredAt(), grant.expiresAt()));
    }

    @Test
    @DisplayName("Should refuse locks on versions that are not Draft")
    void shouldRefuseLockOnNonDraft() {
        var alice = author();
        var version = newDraft(alice);
        workflowService.transition(version.getId(), WorkflowAction.SUBMIT_FOR_REVIEW, alice, null, null, CLIENT);

        var result = lockService.acquire(version.getId(), alice, null, CLIENT, null);

        assertEquals(FailureReason.VERSION_NOT_EDITABLE, result.reason());
        assertEquals(VersionStatus.UNDER_REVIEW, result.getError().currentStatus().orElseThrow());
    }

    @Test
    @DisplayName("Should refuse locks to users without the author capability")
    void shouldRefuseLockWithoutCapability() {
        var version = newDraft(author());

        var result = lockService.acquire(version.getId(), reviewer(), null, CLIENT, null);

        assertEquals(FailureReason.CAPABILITY_MISSING, result.reason());
    }

    @Test
    @DisplayName("Should report an unknown version as not found")
    void shouldReportUnknownVersion() {
        assertEquals(FailureReason.NOT_FOUND, lockService.acquire(Long.MAX_VALUE, author(), null, CLIENT, null).reason());
        assertEquals(FailureReason.NOT_FOUND, lockService.inspect(Long.MAX_VALUE).reason());
    }

    @Test
    @DisplayName("Should grant exactly one of many concurrent acquires")
    void shouldGrantExactlyOneConcurrentAcquire() throws InterruptedException {
        var version = newDraft(author());
        int numThreads = 8;
        var successCount = new AtomicInteger();
        var lockHeldCount = new AtomicInteger();
        List<Throwable> errors = Collections.synchronizedList(new ArrayList<>());
        var start = new CountDownLatch(1);
        var done = new CountDownLatch(numThreads);

        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        try {
            for (int i = 0; i < numThreads; i++) {
                var contender = Actor.of(unique("author"), Capability.AUTHOR);
                executor.submit(() -> {
                    try {
                        start.await();
                        var result = lockService.acquire(version.getId(), contender, null, CLIENT, null);
                        if (result.isSuccess()) {
                            successCount.incrementAndGet();
                        } else if (result.reason() == FailureReason.LOCK_HELD) {
                            lockHeldCount.incrementAndGet();
                        }
                    } catch (Throwable t) {
                        errors.add(t);
                    } finally {
                        done.countDown();
                    }
                });
            }
            start.countDown();
            assertTrue(done.await(30, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }

        assertTrue(errors.isEmpty(), () -> "Unexpected errors: " + errors);
        assertEquals(1, successCount.get());
        assertEquals(numThreads - 1, lockHeldCount.get());
        assertTrue(lockService.inspect(version.getId()).getValue().held());
    }

    @Test
    @DisplayName("Should extend a live lock on heartbeat")
    void shouldExtendOnHeartbeat() {
        var alice = author();
        var version = newDraft(alice);
        var grant = lockService.acquire(version.getId(), alice, Duration.ofMinutes(10), CLIENT, null).getValue();
        var heartbeatAt = clock.advance(Duration.ofMinutes(9));

        var result = lockService.heartbeat(grant.token(), alice);

        assertTrue(result.isSuccess());
        assertEquals(heartbeatAt.plus(Duration.ofMinutes(10)), result.getValue());
        assertEquals(result.getValue(), lockService.inspect(version.getId()).getValue().expiresAt());
    }

    @Test
    @DisplayName("Should never revive an expired lock on heartbeat")
    void shouldNotReviveExpiredLock() {
        var alice = author();
        var version = newDraft(alice);
        var grant = lockService.acquire(version.getId(), alice, Duration.ofMinutes(1), CLIENT, null).getValue();
        clock.advance(Duration.ofMinutes(1));

        var result = lockService.heartbeat(grant.token(), alice);

        assertEquals(FailureReason.LOCK_EXPIRED, result.reason());
        assertFalse(lockService.inspect(version.getId()).getValue().held());
    }

    @Test
    @DisplayName("Should report unknown and released tokens on heartbeat")
    void shouldRejectHeartbeatForUnknownOrReleasedToken() {
        var alice = author();
        var version = newDraft(alice);
        var grant = lockService.acquire(version.getId(), alice, null, CLIENT, null).getValue();
        lockService.release(grant.token(), alice, CLIENT);

        assertEquals(FailureReason.LOCK_NOT_FOUND, lockService.heartbeat("no-such-token", alice).reason());
        assertEquals(FailureReason.LOCK_NOT_FOUND, lockService.heartbeat(grant.token(), alice).reason());
    }

    @Test
    @DisplayName("Should keep extending on heartbeat after the holder re-acquires with a shorter duration")
    void shouldNotShortenLeaseOnRenewal() {
        var alice = author();
        var version = newDraft(alice);
        var first = lockService.acquire(version.getId(), alice, Duration.ofHours(8), CLIENT, null).getValue();

        var renewed = lockService.acquire(version.getId(), alice, Duration.ofMinutes(5), CLIENT, null).getValue();
        assertFalse(renewed.expiresAt().isBefore(first.expiresAt()));

        var heartbeatAt = clock.advance(Duration.ofMinutes(1));
        var result = lockService.heartbeat(first.token(), alice);

        assertTrue(result.isSuccess());
        assertTrue(result.getValue().isAfter(renewed.expiresAt()));
        assertEquals(heartbeatAt.plus(Duration.ofHours(8)), result.getValue());
    }

    @Test
    @DisplayName("Should refuse a heartbeat from anyone but the holder")
    void shouldRefuseHeartbeatFromOtherUser() {
        var alice = author();
        var bob = author();
        var version = newDraft(alice);
        var grant = lockService.acquire(version.getId(), alice, Duration.ofMinutes(10), CLIENT, null).getValue();
        clock.advance(Duration.ofMinutes(1));

        var result = lockService.heartbeat(grant.token(), bob);

        assertEquals(FailureReason.NOT_LOCK_OWNER, result.reason());
        assertEquals(alice.id(), result.getError().holderId().orElseThrow());
        assertEquals(grant.expiresAt(), lockService.inspect(version.getId()).getValue().expiresAt());
    }

    @Test
    @DisplayName("Should let another user acquire after the expiry passes")
    void shouldAllowAcquireAfterExpiry() {
        var alice = author();
        var bob = author();
        var version = newDraft(alice);
        lockService.acquire(version.getId(), alice, Duration.ofMinutes(1), CLIENT, null);
        clock.advance(Duration.ofMinutes(2));

        var result = lockService.acquire(version.getId(), bob, null, CLIENT, null);

        assertTrue(result.isSuccess());
        var actions = auditTrailService.versionHistory(version.getId()).stream()
                .map(entry -> entry.getAction())
                .toList();
        assertEquals(List.of(AuditAction.VERSION_CREATED, AuditAction.LOCK_ACQUIRED,
                AuditAction.LOCK_EXPIRED, AuditAction.LOCK_ACQUIRED), actions);
    }

    @Test
    @DisplayName("Should release idempotently and only for the holder")
    void shouldReleaseIdempotently() {
        var alice = author();
        var bob = author();
        var version = newDraft(alice);
        var grant = lockService.acquire(version.getId(), alice, null, CLIENT, null).getValue();

        assertEquals(FailureReason.NOT_LOCK_OWNER, lockService.release(grant.token(), bob, CLIENT).reason());
        assertTrue(lockService.release(grant.token(), alice, CLIENT).isSuccess());
        assertTrue(lockService.release(grant.token(), alice, CLIENT).isSuccess());
        assertTrue(lockService.release("never-issued", alice, CLIENT).isSuccess());

        assertFalse(lockService.inspect(version.getId()).getValue().held());
        assertTrue(lockService.acquire(version.getId(), bob, null, CLIENT, null).isSuccess());
    }

    @Test
    @DisplayName("Should let only admins force-release and require a reason")
    void shouldForceReleaseAsAdmin() {
        var alice = author();
        var version = newDraft(alice);
        lockService.acquire(version.getId(), alice, null, CLIENT, null);
        var admin = admin();

        assertEquals(FailureReason.CAPABILITY_MISSING,
                lockService.forceRelease(version.getId(), author(), "stuck", CLIENT).reason());
        assertEquals(FailureReason.INVALID_ARGUMENT,
                lockService.forceRelease(version.getId(), admin, " ", CLIENT).reason());
        assertEquals(FailureReason.INVALID_ARGUMENT,
                lockService.forceRelease(version.getId(), admin, "r".repeat(InputLimits.COMMENT + 1), CLIENT).reason());
        assertTrue(lockService.inspect(version.getId()).getValue().held());

        var result = lockService.forceRelease(version.getId(), admin, "holder on leave", CLIENT);

        assertEquals(alice.id(), result.getValue());
        assertFalse(lockService.inspect(version.getId()).getValue().held());
        var last = auditTrailService.versionHistory(version.getId()).stream().reduce((a, b) -> b).orElseThrow();
        assertEquals(AuditAction.LOCK_FORCE_RELEASED, last.getAction());
        assertEquals(admin.id(), last.getActorId());
        assertEquals("holder on leave", last.getComment());
        assertTrue(last.getDetails().contains(alice.id()));

        assertEquals(FailureReason.LOCK_NOT_FOUND,
                lockService.forceRelease(version.getId(), admin, "again", CLIENT).reason());
    }

    @Test
    @DisplayName("Should not extend anything on inspect")
    void shouldInspectWithoutSideEffects() {
        var alice = author();
        var version = newDraft(alice);
        var grant = lockService.acquire(version.getId(), alice, null, CLIENT, null).getValue();
        clock.advance(Duration.ofMinutes(3));

        var info = lockService.inspect(version.getId()).getValue();

        assertTrue(info.held());
        assertEquals(alice.id(), info.holderId());
        assertEquals(grant.expiresAt(), info.expiresAt());
    }
}
