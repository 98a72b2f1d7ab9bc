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
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Seeds the audit chain once the application is up, so the first real append
 * never has to race another to create the chain head.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuditChainInitializer {

    private final AuditLedger auditLedger;

    @EventListener(ApplicationReadyEvent.class)
    public void initializeChainIfNeeded() {
        if (auditLedger.initializeChain()) {
            log.info("Created audit chain genesis entry");
        } else {
            log.debug("Audit chain already initialized");
        }
    }
}
