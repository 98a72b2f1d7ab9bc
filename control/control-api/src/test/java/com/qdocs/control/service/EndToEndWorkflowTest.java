/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.service;

import com.qdocs.control.ControlIntegrationTest;
import com.qdocs.control.TestIdentityProvider;
import com.qdocs.control.entity.AuditAction;
import com.qdocs.control.entity.AuditTargetType;
import com.qdocs.control.entity.VersionStatus;
import com.qdocs.control.model.AuditQuery;
import com.qdocs.control.model.FailureReason;
import com.qdocs.control.model.WorkflowAction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lock, submit, review, approve and publish one version, then read its trail back.
 */
class EndToEndWorkflowTest extends ControlIntegrationTest {

    @Autowired
    private EditLockService lockService;

    @Autowired
    private VersionWorkflowService workflowService;

    @Autowired
    private AuditTrailService auditTrailService;

    @Test
    @DisplayName("Should produce exactly six ordered audit entries for the version")
    void shouldRecordSixEntries() {
        var userA = author();
        var userB = author();
        var reviewer = reviewer();
        var approver = approver();
        var v1 = newDraft(userA);
        long cursor = auditTrailService.lastSequence();

        var t1 = lockService.acquire(v1.getId(), userA, null, CLIENT, null);
        assertTrue(t1.isSuccess());

        var refused = lockService.acquire(v1.getId(), userB, null, CLIENT, null);
        assertEquals(FailureReason.LOCK_HELD, refused.reason());
        assertEquals(userA.id(), refused.getError().holderId().orElseThrow());

        var submit = workflowService.transition(v1.getId(), WorkflowAction.SUBMIT_FOR_REVIEW, userA, null, null, CLIENT);
        assertEquals(VersionStatus.UNDER_REVIEW, submit.getValue().to());
        assertTrue(submit.getValue().lockReleased());

        assertEquals(FailureReason.VERSION_NOT_EDITABLE,
                lockService.acquire(v1.getId(), userB, null, CLIENT, null).reason());

        assertTrue(workflowService.transition(v1.getId(), WorkflowAction.APPROVE_REVIEW, reviewer, null, null, CLIENT)
                .isSuccess());
        assertTrue(workflowService.transition(v1.getId(), WorkflowAction.APPROVE, approver, null,
                TestIdentityProvider.SECRET, CLIENT).isSuccess());
        var publish = workflowService.transition(v1.getId(), WorkflowAction.PUBLISH, approver, null, null, CLIENT);
        assertEquals(VersionStatus.PUBLISHED, publish.getValue().to());
        assertTrue(publish.getValue().archivedVersionIds().isEmpty());

        var entries = auditTrailService.query(AuditQuery.builder()
                .afterSequence(cursor)
                .targetType(AuditTargetType.DOCUMENT_VERSION)
                .targetId(String.valueOf(v1.getId()))
                .build()).entries();
        var actions = entries.stream().map(entry -> entry.getAction()).toList();

        assertEquals(List.of(
                AuditAction.LOCK_ACQUIRED,
                AuditAction.VERSION_SUBMITTED,
                AuditAction.LOCK_RELEASED,
                AuditAction.REVIEW_APPROVED,
                AuditAction.VERSION_APPROVED,
                AuditAction.VERSION_PUBLISHED), actions);
        assertEquals(userA.id(), entries.get(2).getActorId());
        assertTrue(entries.get(2).getDetails().contains("AUTO_RELEASED"));
        assertEquals(approver.id(), entries.get(5).getActorId());
        assertTrue(auditTrailService.verify().isValid());
    }
}
