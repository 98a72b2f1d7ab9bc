/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class LockConfigTest {

    private final LockConfig config = new LockConfig();

    @Test
    @DisplayName("Should use the default for missing or non-positive hints")
    void shouldDefaultMissingHints() {
        assertEquals(Duration.ofMinutes(30), config.normalizeDuration(null));
        assertEquals(Duration.ofMinutes(30), config.normalizeDuration(Duration.ZERO));
        assertEquals(Duration.ofMinutes(30), config.normalizeDuration(Duration.ofMinutes(-5)));
    }

    @Test
    @DisplayName("Should clamp hints to the configured bounds")
    void shouldClampHints() {
        assertEquals(Duration.ofMinutes(1), config.normalizeDuration(Duration.ofSeconds(10)));
        assertEquals(Duration.ofHours(8), config.normalizeDuration(Duration.ofDays(2)));
        assertEquals(Duration.ofMinutes(45), config.normalizeDuration(Duration.ofMinutes(45)));
    }

    @Test
    @DisplayName("Should cap audit page sizes")
    void shouldCapAuditPageSize() {
        var audit = new AuditConfig();

        assertEquals(50, audit.normalizePageSize(null));
        assertEquals(100, audit.normalizePageSize(5000));
        assertEquals(20, audit.normalizePageSize(20));
    }
}
