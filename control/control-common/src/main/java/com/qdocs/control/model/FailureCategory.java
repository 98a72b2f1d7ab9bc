/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.model;

/**
 * Coarse grouping of {@link FailureReason}s.
 */
public enum FailureCategory {
    CONFLICT,
    STALE,
    INVALID_TRANSITION,
    CALLER_ERROR,
    UNAUTHORIZED
}
