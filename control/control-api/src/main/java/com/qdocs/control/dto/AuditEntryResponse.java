/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.dto;

import com.qdocs.control.entity.AuditAction;
import com.qdocs.control.entity.AuditLogEntry;
import com.qdocs.control.entity.AuditTargetType;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class AuditEntryResponse {
    private long sequenceNumber;
    private Instant occurredAt;
    private String actorId;
    private AuditAction action;
    private AuditTargetType targetType;
    private String targetId;
    private String fromState;
    private String toState;
    private String comment;
    private String details;
    private String clientAddress;
    private String previousHash;
    private String hash;

    public static AuditEntryResponse from(AuditLogEntry entry) {
        return AuditEntryResponse.builder()
                .sequenceNumber(entry.getSequenceNumber())
                .occurredAt(entry.getOccurredAt())
                .actorId(entry.getActorId())
                .action(entry.getAction())
                .targetType(entry.getTargetType())
                .targetId(entry.getTargetId())
                .fromState(entry.getFromState())
                .toState(entry.getToState())
                .comment(entry.getComment())
                .details(entry.getDetails())
                .clientAddress(entry.getClientAddress())
                .previousHash(entry.getPreviousHash())
                .hash(entry.getHash())
                .build();
    }
}
