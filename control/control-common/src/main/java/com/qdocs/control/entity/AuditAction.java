/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.entity;

/**
 * Every state-changing event recorded in the audit ledger.
 */
public enum AuditAction {
    /** First entry of the hash chain */
    CHAIN_GENESIS,

    DOCUMENT_CREATED,
    VERSION_CREATED,
    VERSION_CONTENT_SAVED,

    VERSION_SUBMITTED,
    REVIEW_APPROVED,
    REVIEW_REJECTED,
    VERSION_APPROVED,
    APPROVAL_REJECTED,
    VERSION_PUBLISHED,
    VERSION_ARCHIVED,
    VERSION_WITHDRAWN,

    LOCK_ACQUIRED,
    LOCK_RELEASED,
    LOCK_EXPIRED,
    LOCK_FORCE_RELEASED,

    LOGIN,
    LOGIN_FAILED,
    SESSION_TAKEOVER,
    SESSION_EXPIRED,
    SESSION_REVOKED,
    LOGOUT
}
