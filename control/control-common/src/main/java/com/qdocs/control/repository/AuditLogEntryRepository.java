/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.repository;

import com.qdocs.control.entity.AuditAction;
import com.qdocs.control.entity.AuditLogEntry;
import com.qdocs.control.entity.AuditTargetType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Append-only access to the audit ledger. Extends the bare {@link org.springframework.data.repository.Repository}
 * marker so no update or delete method is ever exposed.
 */
@Repository
public interface AuditLogEntryRepository extends org.springframework.data.repository.Repository<AuditLogEntry, Long> {

    AuditLogEntry save(AuditLogEntry entry);

    long count();

    /**
     * Filtered page in ledger order, resuming after the given sequence number.
     * Null filters match everything.
     */
    @Query("""
            select e from AuditLogEntry e
            where e.sequenceNumber > :afterSequence
              and (:actorId is null or e.actorId = :actorId)
              and (:action is null or e.action = :action)
              and (:targetType is null or e.targetType = :targetType)
              and (:targetId is null or e.targetId = :targetId)
              and (:fromTime is null or e.occurredAt >= :fromTime)
              and (:toTime is null or e.occurredAt <= :toTime)
            order by e.sequenceNumber asc
            """)
    List<AuditLogEntry> search(@Param("afterSequence") long afterSequence,
                               @Param("actorId") String actorId,
                               @Param("action") AuditAction action,
                               @Param("targetType") AuditTargetType targetType,
                               @Param("targetId") String targetId,
                               @Param("fromTime") Instant fromTime,
                               @Param("toTime") Instant toTime,
                               Pageable page);

    /**
     * Every entry about one target, in ledger order.
     */
    List<AuditLogEntry> findByTargetTypeAndTargetIdOrderBySequenceNumberAsc(AuditTargetType targetType, String targetId);
}
