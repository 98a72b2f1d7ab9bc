/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.entity;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of a document version.
 */
public enum VersionStatus {
    /** Being written; the only editable state */
    DRAFT,
    /** Submitted and waiting on a reviewer */
    UNDER_REVIEW,
    /** Review passed, waiting on an approver's signature */
    PENDING_APPROVAL,
    /** Signed off, not yet released */
    APPROVED,
    /** The document's current authoritative revision */
    PUBLISHED,
    /** Withdrawn before release; terminal */
    REJECTED,
    /** Superseded or retired; terminal */
    ARCHIVED;

    private static final Set<VersionStatus> ACTIVE_EDITING = EnumSet.of(DRAFT, UNDER_REVIEW, PENDING_APPROVAL);

    public boolean isEditable() {
        return this == DRAFT;
    }

    /**
     * A document may have at most one version in one of these states.
     */
    public static Set<VersionStatus> activeEditing() {
        return EnumSet.copyOf(ACTIVE_EDITING);
    }
}
