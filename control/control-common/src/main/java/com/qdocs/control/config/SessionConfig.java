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
 * Configuration for login sessions.
 */
@Configuration
@ConfigurationProperties(prefix = "qdocs.session")
@Getter
@Setter
public class SessionConfig {

    /** Sliding idle timeout; every successful validation pushes expiry this far out */
    private Duration idleTimeout = Duration.ofMinutes(60);
}
