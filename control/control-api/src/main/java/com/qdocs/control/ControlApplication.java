/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for the Q-Docs version control service.
 *
 * <p>This service owns the parts of document control where concurrent users can
 * collide. It provides:
 * <ul>
 *   <li>Edit locks: exclusive, expiring, token-proven rights to edit a draft version</li>
 *   <li>The version workflow: Draft through review and approval to Published and Archived</li>
 *   <li>Single-session enforcement per user, with an audited force-login override</li>
 *   <li>A background sweeper reclaiming abandoned locks and idle sessions</li>
 *   <li>A hash-chained, append-only audit ledger of every state change</li>
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class ControlApplication {

    public static void main(String[] args) {
        SpringApplication.run(ControlApplication.class, args);
    }
}
