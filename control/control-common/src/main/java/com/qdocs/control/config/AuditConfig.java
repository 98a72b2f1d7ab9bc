/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the audit ledger and its hash chain.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "qdocs.audit")
public class AuditConfig {

    /** {@link java.security.MessageDigest} algorithm used for the chain */
    private String algorithm = "SHA-256";

    private boolean verificationEnabled = true;

    /** Daily at 02:00 by default */
    private String verificationCron = "0 0 2 * * *";

    private int defaultPageSize = 50;

    private int maxPageSize = 100;

    /**
     * Clamps a requested page size into {@code [1, maxPageSize]}; non-positive means default.
     */
    public int normalizePageSize(Integer requested) {
        if (requested == null || requested <= 0) {
            return defaultPageSize;
        }
        return Math.min(requested, maxPageSize);
    }
}
