/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.model;

import com.qdocs.control.entity.VersionStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the ControlResult type and the error taxonomy.
 */
class ControlResultTest {

    @Test
    @DisplayName("Should create success result")
    void shouldCreateSuccessResult() {
        var result = ControlResult.success("value");

        assertTrue(result.isSuccess());
        assertEquals("value", result.getValue());
        assertNull(result.reason());
        assertThrows(IllegalStateException.class, result::getError);
    }

    @Test
    @DisplayName("Should create failure result with reason and message")
    void shouldCreateFailureWithReasonAndMessage() {
        var result = ControlResult.<String>failure(FailureReason.NOT_FOUND, "Version not found: 7");

        assertFalse(result.isSuccess());
        assertEquals(FailureReason.NOT_FOUND, result.reason());
        assertEquals("Version not found: 7", result.getError().message());
        assertThrows(IllegalStateException.class, result::getValue);
    }

    @Test
    @DisplayName("Should carry holder and held-since on a lock conflict")
    void shouldCarryHolderOnLockHeld() {
        var since = Instant.parse("2026-03-01T10:15:30Z");
        var error = ControlError.lockHeld("alice", since);

        assertEquals(FailureReason.LOCK_HELD, error.reason());
        assertEquals("alice", error.holderId().orElseThrow());
        assertEquals(since, error.heldSince().orElseThrow());
        assertTrue(error.message().contains("alice"));
    }

    @Test
    @DisplayName("Should carry the stored hash on stale content")
    void shouldCarryHashOnStaleContent() {
        var error = ControlError.staleContent("abc123");

        assertEquals("abc123", error.currentHash().orElseThrow());
        assertEquals(FailureCategory.STALE, error.reason().category());
    }

    @Test
    @DisplayName("Should name the state and the action on an invalid transition")
    void shouldNameStateOnInvalidTransition() {
        var error = ControlError.invalidTransition(VersionStatus.PUBLISHED, WorkflowAction.APPROVE);

        assertEquals(VersionStatus.PUBLISHED, error.currentStatus().orElseThrow());
        assertEquals("Cannot APPROVE a version in state PUBLISHED", error.message());
    }

    @Test
    @DisplayName("Should classify failure reasons into categories")
    void shouldClassifyReasons() {
        assertEquals(FailureCategory.CONFLICT, FailureReason.LOCK_HELD.category());
        assertEquals(FailureCategory.CONFLICT, FailureReason.SESSION_CONFLICT.category());
        assertEquals(FailureCategory.STALE, FailureReason.STALE_CONTENT.category());
        assertEquals(FailureCategory.STALE, FailureReason.LOCK_EXPIRED.category());
        assertEquals(FailureCategory.INVALID_TRANSITION, FailureReason.VERSION_NOT_EDITABLE.category());
        assertEquals(FailureCategory.CALLER_ERROR, FailureReason.NOT_LOCK_OWNER.category());
        assertEquals(FailureCategory.UNAUTHORIZED, FailureReason.SIGNATURE_REJECTED.category());        assertEquals(FailureCategory.CONFLICT, FailureReason.DUPLICATE_DOCUMENT.category());
        assertEquals(FailureCategory.CALLER_ERROR, FailureReason.NOT_FOUND.category());
    }
}
