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
 * Configuration for the background reclaim of expired locks and sessions.
 */
@Configuration
@ConfigurationProperties(prefix = "qdocs.sweeper")
@Getter
@Setter
public class SweeperConfig {

    private boolean enabled = true;
    private Duration initialDelay = Duration.ofSeconds(30);
    private Duration interval = Duration.ofSeconds(30);
    private int batchSize = 100;
}
