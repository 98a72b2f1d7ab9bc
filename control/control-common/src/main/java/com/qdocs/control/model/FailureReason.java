/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.model;

/**
 * Typed reason attached to every failed control operation.
 */
public enum FailureReason {
    /**
     * Another user holds a live edit lock on the version.
     */
    LOCK_HELD(FailureCategory.CONFLICT),

    /**
     * The user already has a live session and did not ask to override it.
     */
    SESSION_CONFLICT(FailureCategory.CONFLICT),

    /**
     * The document already has a version moving through the workflow.
     */
    VERSION_IN_PROGRESS(FailureCategory.CONFLICT),

    /**
     * A document with the same number already exists.
     */
    DUPLICATE_DOCUMENT(FailureCategory.CONFLICT),

    /**
     * The supplied base content hash no longer matches the stored content.
     */
    STALE_CONTENT(FailureCategory.STALE),

    /**
     * The lock's expiry has passed; the caller must re-acquire.
     */
    LOCK_EXPIRED(FailureCategory.STALE),

    /**
     * The action is not listed for the version's current state.
     */
    INVALID_TRANSITION(FailureCategory.INVALID_TRANSITION),

    /**
     * The version's status does not allow editing.
     */
    VERSION_NOT_EDITABLE(FailureCategory.INVALID_TRANSITION),

    /**
     * Document or version does not exist.
     */
    NOT_FOUND(FailureCategory.CALLER_ERROR),

    /**
     * Unknown lock token, or no live lock where one was expected.
     */
    LOCK_NOT_FOUND(FailureCategory.CALLER_ERROR),

    /**
     * The caller does not hold the lock it is acting on.
     */
    NOT_LOCK_OWNER(FailureCategory.CALLER_ERROR),

    /**
     * The action requires a comment and none was given.
     */
    COMMENT_REQUIRED(FailureCategory.CALLER_ERROR),

    /**
     * A required argument is missing or malformed.
     */
    INVALID_ARGUMENT(FailureCategory.CALLER_ERROR),

    /**
     * The actor lacks the capability the operation needs.
     */
    CAPABILITY_MISSING(FailureCategory.UNAUTHORIZED),

    /**
     * Login credentials were rejected.
     */
    INVALID_CREDENTIALS(FailureCategory.UNAUTHORIZED),

    /**
     * The e-signature re-authentication did not verify.
     */
    SIGNATURE_REJECTED(FailureCategory.UNAUTHORIZED);

    private final FailureCategory category;

    FailureReason(FailureCategory category) {
        this.category = category;
    }

    public FailureCategory category() {
        return category;
    }
}
