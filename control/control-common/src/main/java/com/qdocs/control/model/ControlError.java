/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.model;

import com.qdocs.control.entity.VersionStatus;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Describes why a control operation failed, with whatever context the caller
 * needs to decide what to do next (who holds the lock, the current content hash,
 * the state the version is actually in).
 */
public record ControlError(
        FailureReason reason,
        String message,
        Optional<String> holderId,
        Optional<Instant> heldSince,
        Optional<String> currentHash,
        Optional<VersionStatus> currentStatus
) {
    public ControlError {
        Objects.requireNonNull(reason, "reason must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(holderId, "holderId optional must not be null");
        Objects.requireNonNull(heldSince, "heldSince optional must not be null");
        Objects.requireNonNull(currentHash, "currentHash optional must not be null");
        Objects.requireNonNull(currentStatus, "currentStatus optional must not be null");
    }

    /**
     * Creates an error with just reason and message.
     */
    public ControlError(FailureReason reason, String message) {
        this(reason, message, Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty());
    }

    /**
     * Creates an error for a version locked by another user.
     */
    public static ControlError lockHeld(String holderId, Instant acquiredAt) {
        return new ControlError(
                FailureReason.LOCK_HELD,
                "Version is locked by: " + holderId,
                Optional.of(holderId),
                Optional.of(acquiredAt),
                Optional.empty(),
                Optional.empty()
        );
    }

    /**
     * Creates an error for a login blocked by an existing live session.
     */
    public static ControlError sessionConflict(String userId, Instant existingCreatedAt) {
        return new ControlError(
                FailureReason.SESSION_CONFLICT,
                "User already has an active session: " + userId,
                Optional.of(userId),
                Optional.of(existingCreatedAt),
                Optional.empty(),
                Optional.empty()
        );
    }

    public static ControlError versionNotEditable(long versionId, VersionStatus status) {
        return new ControlError(
                FailureReason.VERSION_NOT_EDITABLE,
                String.format("Version %d is %s and cannot be edited", versionId, status),
                Optional.empty(),
                Optional.empty(),
                Optional.empty(),
                Optional.of(status)
        );
    }

    /**
     * Creates an error naming the current state and the rejected action.
     */
    public static ControlError invalidTransition(VersionStatus status, WorkflowAction action) {
        return new ControlError(
                FailureReason.INVALID_TRANSITION,
                String.format("Cannot %s a version in state %s", action, status),
                Optional.empty(),
                Optional.empty(),
                Optional.empty(),
                Optional.of(status)
        );
    }

    public static ControlError staleContent(String currentHash) {
        return new ControlError(
                FailureReason.STALE_CONTENT,
                "Content was changed since it was loaded. Current hash: " + currentHash,
                Optional.empty(),
                Optional.empty(),
                Optional.of(currentHash),
                Optional.empty()
        );
    }

    public static ControlError lockNotFound(String description) {
        return new ControlError(FailureReason.LOCK_NOT_FOUND, "Lock not found: " + description);
    }

    public static ControlError lockExpired(Instant expiredAt) {
        return new ControlError(FailureReason.LOCK_EXPIRED, "Lock expired at " + expiredAt + "; re-acquire to continue");
    }

    public static ControlError notLockOwner(String holderId) {
        return new ControlError(
                FailureReason.NOT_LOCK_OWNER,
                "Lock is held by a different user: " + holderId,
                Optional.of(holderId),
                Optional.empty(),
                Optional.empty(),
                Optional.empty()
        );
    }

    public static ControlError notFound(String kind, Object id) {
        return new ControlError(FailureReason.NOT_FOUND, kind + " not found: " + id);
    }

    public static ControlError capabilityMissing(String actorId, Object operation) {
        return new ControlError(
                FailureReason.CAPABILITY_MISSING,
                String.format("User %s is not permitted to %s", actorId, operation)
        );
    }

    public static ControlError commentRequired(WorkflowAction action) {
        return new ControlError(FailureReason.COMMENT_REQUIRED, "A comment is required to " + action);
    }

    public static ControlError signatureRejected(String actorId) {
        return new ControlError(FailureReason.SIGNATURE_REJECTED, "Electronic signature could not be verified for " + actorId);
    }

    public static ControlError invalidCredentials() {
        return new ControlError(FailureReason.INVALID_CREDENTIALS, "Incorrect username or password");
    }

    public static ControlError versionInProgress(int versionNumber, VersionStatus status) {
        return new ControlError(
                FailureReason.VERSION_IN_PROGRESS,
                String.format("Version %d is still %s; finish or withdraw it first", versionNumber, status),
                Optional.empty(),
                Optional.empty(),
                Optional.empty(),
                Optional.of(status)
        );
    }

    public static ControlError duplicateDocument(String documentNumber) {
        return new ControlError(FailureReason.DUPLICATE_DOCUMENT, "Document number already exists: " + documentNumber);
    }

    public static ControlError invalidArgument(String message) {
        return new ControlError(FailureReason.INVALID_ARGUMENT, message);
    }

    public static ControlError tooLong(String field, int maxLength) {
        return invalidArgument(String.format("%s exceeds %d characters", field, maxLength));
    }
}
