/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.model;

import com.qdocs.control.entity.AuditAction;
import com.qdocs.control.entity.VersionStatus;

import java.util.EnumSet;
import java.util.Set;

/**
 * The closed transition table of the version workflow. Each action names the single
 * state it applies to, the state it produces, who may perform it and whether a comment
 * is mandatory. Anything not listed here is an invalid transition.
 */
public enum WorkflowAction {

    SUBMIT_FOR_REVIEW(VersionStatus.DRAFT, VersionStatus.UNDER_REVIEW,
            EnumSet.of(Capability.AUTHOR), false, AuditAction.VERSION_SUBMITTED),

    APPROVE_REVIEW(VersionStatus.UNDER_REVIEW, VersionStatus.PENDING_APPROVAL,
            EnumSet.of(Capability.REVIEWER), false, AuditAction.REVIEW_APPROVED),

    REJECT_REVIEW(VersionStatus.UNDER_REVIEW, VersionStatus.DRAFT,
            EnumSet.of(Capability.REVIEWER), true, AuditAction.REVIEW_REJECTED),

    APPROVE(VersionStatus.PENDING_APPROVAL, VersionStatus.APPROVED,
            EnumSet.of(Capability.APPROVER), false, AuditAction.VERSION_APPROVED),

    REJECT_APPROVAL(VersionStatus.PENDING_APPROVAL, VersionStatus.DRAFT,
            EnumSet.of(Capability.APPROVER), true, AuditAction.APPROVAL_REJECTED),

    PUBLISH(VersionStatus.APPROVED, VersionStatus.PUBLISHED,
            EnumSet.of(Capability.APPROVER), false, AuditAction.VERSION_PUBLISHED),

    ARCHIVE(VersionStatus.PUBLISHED, VersionStatus.ARCHIVED,
            EnumSet.of(Capability.ADMIN), false, AuditAction.VERSION_ARCHIVED),

    /** Abandons a draft so a fresh version can be started. */
    WITHDRAW(VersionStatus.DRAFT, VersionStatus.REJECTED,
            EnumSet.of(Capability.AUTHOR), true, AuditAction.VERSION_WITHDRAWN);

    private final VersionStatus from;
    private final VersionStatus to;
    private final Set<Capability> permitted;
    private final boolean commentRequired;
    private final AuditAction auditAction;

    WorkflowAction(VersionStatus from, VersionStatus to, Set<Capability> permitted,
                   boolean commentRequired, AuditAction auditAction) {
        this.from = from;
        this.to = to;
        this.permitted = permitted;
        this.commentRequired = commentRequired;
        this.auditAction = auditAction;
    }

    public VersionStatus from() {
        return from;
    }

    public VersionStatus to() {
        return to;
    }

    public boolean isCommentRequired() {
        return commentRequired;
    }

    public AuditAction auditAction() {
        return auditAction;
    }

    public boolean appliesTo(VersionStatus status) {
        return from == status;
    }

    /**
     * ADMIN may perform every action.
     */
    public boolean permits(Actor actor) {
        return actor.isAdmin() || permitted.stream().anyMatch(actor.capabilities()::contains);
    }
}
