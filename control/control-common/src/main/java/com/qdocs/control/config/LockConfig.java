/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration for edit lock leases.
 */
@Configuration
@ConfigurationProperties(prefix = "qdocs.lock")
@Getter
@Setter
public class LockConfig {

    private Duration defaultDuration = Duration.ofMinutes(30);
    private Duration minDuration = Duration.ofMinutes(1);
    private Duration maxDuration = Duration.ofHours(8);

    /**
     * Validates and normalizes a requested lease. Missing or non-positive hints get the default.
     */
    public Duration normalizeDuration(Duration requested) {
        if (requested == null || requested.isZero() || requested.isNegative()) {
            return defaultDuration;
        }
        if (requested.compareTo(minDuration) < 0) {
            return minDuration;
        }
        return requested.compareTo(maxDuration) > 0 ? maxDuration : requested;
    }
}
