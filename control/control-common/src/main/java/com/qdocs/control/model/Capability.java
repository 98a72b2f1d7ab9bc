/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.model;

/**
 * Capabilities checked by the workflow and lock operations.
 */
public enum Capability {
    /** Creates documents, edits drafts and submits them for review */
    AUTHOR,
    /** Approves or rejects a version under review */
    REVIEWER,
    /** Signs off a reviewed version and publishes it */
    APPROVER,
    /** Administrative overrides; satisfies every capability check */
    ADMIN
}
