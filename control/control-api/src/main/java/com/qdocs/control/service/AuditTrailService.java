/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.service;

import com.qdocs.control.entity.AuditLogEntry;
import com.qdocs.control.entity.AuditTargetType;
import com.qdocs.control.model.AuditPage;
import com.qdocs.control.model.AuditQuery;
import com.qdocs.control.model.AuditVerificationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read side of the audit ledger. Every call is idempotent and retried on transient store failures.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditTrailService {

    private final AuditLedger auditLedger;
    private final ControlTransactions transactions;

    public AuditPage query(AuditQuery query) {
        log.debug("Audit query: {}", query);
        return transactions.read(() -> auditLedger.query(query));
    }

    public List<AuditLogEntry> history(AuditTargetType targetType, String targetId) {
        return transactions.read(() -> auditLedger.history(targetType, targetId));
    }

    public List<AuditLogEntry> versionHistory(long versionId) {
        return history(AuditTargetType.DOCUMENT_VERSION, String.valueOf(versionId));
    }

    public AuditVerificationResult verify() {
        var result = transactions.read(auditLedger::verifyChain);
        log.info("Audit chain verification: {} ({} entries)", result.status(), result.entriesChecked());
        return result;
    }

    public long lastSequence() {
        return transactions.read(auditLedger::lastSequence);
    }
}
