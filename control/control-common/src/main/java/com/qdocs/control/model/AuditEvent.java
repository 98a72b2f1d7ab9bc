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

import java.util.Map;

/**
 * An event to be appended to the audit ledger. Sequence, timestamp and hashes are
 * assigned by the ledger.
 */
@Builder
public record AuditEvent(
        String actorId,
        AuditAction action,
        AuditTargetType targetType,
        String targetId,
        String fromState,
        String toState,
        String comment,
        Map<String, ?> details,
        ClientInfo client
) {
}
