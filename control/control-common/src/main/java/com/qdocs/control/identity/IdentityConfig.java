/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.identity;

import com.qdocs.control.model.Capability;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Users known to the configured identity provider.
 */
@Configuration
@ConfigurationProperties(prefix = "qdocs.identity")
@Getter
@Setter
public class IdentityConfig {

    private Map<String, User> users = new LinkedHashMap<>();

    @Getter
    @Setter
    public static class User {
        /** Lower-case hex SHA-256 of the user's secret */
        private String secretSha256;
        private Set<Capability> capabilities = EnumSet.noneOf(Capability.class);
    }
}
