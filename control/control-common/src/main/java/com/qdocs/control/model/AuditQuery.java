/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.model;

import com.qdocs.control.entity.AuditAction;
import com.qdocs.control.entity.AuditTargetType;
import lombok.Builder;

import java.time.Instant;

/**
 * Filters for an audit log query. Null fields match everything. {@code afterSequence}
 * is the cursor: results start strictly after it.
 */
@Builder
public record AuditQuery(
        String actorId,
        AuditAction action,
        AuditTargetType targetType,
        String targetId,
        Instant from,
        Instant to,
        Long afterSequence,
        Integer limit
) {
    public long cursor() {
        return afterSequence == null ? 0L : afterSequence;
    }
}
