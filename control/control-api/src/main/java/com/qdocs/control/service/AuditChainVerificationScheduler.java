/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic full verification of the audit hash chain.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "qdocs.audit.verification-enabled", havingValue = "true", matchIfMissing = true)
public class AuditChainVerificationScheduler {

    private final AuditTrailService auditTrailService;

    @Scheduled(cron = "${qdocs.audit.verification-cron:0 0 2 * * *}")
    public void verifyChain() {
        try {
            var result = auditTrailService.verify();
            if (result.isValid()) {
                log.debug("Scheduled audit chain verification passed ({} entries)", result.entriesChecked());
            }
            result.brokenLink().ifPresent(link -> log.warn(
                    "Audit chain integrity violation at #{}: {}", link.sequenceNumber(), link.problem()));
        } catch (RuntimeException e) {
            log.error("Scheduled audit chain verification failed", e);
        }
    }
}
