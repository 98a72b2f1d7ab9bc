/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.entity;

import com.qdocs.control.model.InputLimits;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/**
 * Write-once record of a state-changing event. There are no setters and Hibernate
 * treats the entity as immutable, so a loaded entry is never flushed back.
 *
 * <p>Entries are ordered by {@code sequenceNumber}, which the ledger assigns gaplessly
 * while holding the chain head. {@code occurredAt} never decreases along that order.
 */
@Entity
@Immutable
@Table(name = "audit_log_entries", uniqueConstraints = {
        @UniqueConstraint(name = "uk_audit_log_entries_sequence", columnNames = {"sequence_number"})
}, indexes = {
        @Index(name = "idx_audit_log_entries_target", columnList = "target_type, target_id, sequence_number"),
        @Index(name = "idx_audit_log_entries_actor", columnList = "actor_id, sequence_number")
})
@Getter
@Builder
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AuditLogEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "sequence_number", nullable = false, updatable = false)
    private long sequenceNumber;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;

    @Column(name = "actor_id", nullable = false, updatable = false, length = InputLimits.USER_ID)
    private String actorId;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", nullable = false, updatable = false, length = 40)
    private AuditAction action;

    @Enumerated(EnumType.STRING)
    @Column(name = "target_type", nullable = false, updatable = false, length = 32)
    private AuditTargetType targetType;

    @Column(name = "target_id", updatable = false, length = InputLimits.USER_ID)
    private String targetId;

    @Column(name = "from_state", updatable = false, length = 32)
    private String fromState;

    @Column(name = "to_state", updatable = false, length = 32)
    private String toState;

    @Column(name = "comment_text", updatable = false, length = InputLimits.COMMENT)
    private String comment;

    /** Canonical JSON, keys sorted */
    @Column(name = "details", updatable = false, columnDefinition = "text")
    private String details;

    @Column(name = "client_address", updatable = false, length = 64)
    private String clientAddress;

    @Column(name = "user_agent", updatable = false, length = 500)
    private String userAgent;

    @Column(name = "previous_hash", nullable = false, updatable = false, length = 128)
    private String previousHash;

    @Column(name = "hash", nullable = false, updatable = false, length = 128)
    private String hash;
}
