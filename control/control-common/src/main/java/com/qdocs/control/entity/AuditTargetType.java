/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.entity;

/**
 * Kind of entity an audit entry is about.
 */
public enum AuditTargetType {
    DOCUMENT,
    DOCUMENT_VERSION,
    SESSION,
    AUDIT_CHAIN
}
