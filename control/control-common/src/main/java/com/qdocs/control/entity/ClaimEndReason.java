/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.entity;

/**
 * Why an exclusive claim (edit lock or session) stopped being live.
 */
public enum ClaimEndReason {
    /** Released by its holder */
    RELEASED,
    /** Released as part of a workflow transition by its holder */
    AUTO_RELEASED,
    /** Removed by an administrator */
    FORCE_RELEASED,
    /** Reclaimed after its expiry passed */
    EXPIRED,
    /** Session ended by logout */
    LOGGED_OUT,
    /** Session replaced by a forced login */
    SUPERSEDED,
    /** Session revoked by an administrator */
    REVOKED
}
