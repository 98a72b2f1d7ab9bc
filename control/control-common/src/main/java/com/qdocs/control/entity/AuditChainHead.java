/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Single-row pointer to the tail of the audit hash chain. Appenders lock this row,
 * which serializes sequence assignment and hash linkage.
 */
@Entity
@Table(name = "audit_chain_head")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditChainHead {

    public static final int SINGLETON_ID = 1;

    @Id
    @Column(name = "id")
    private Integer id;

    @Column(name = "last_sequence", nullable = false)
    private long lastSequence;

    @Column(name = "last_hash", nullable = false, length = 128)
    private String lastHash;

    @Column(name = "last_occurred_at")
    private Instant lastOccurredAt;
}
