/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.model;

/**
 * Client metadata recorded with locks, sessions and audit entries. Both fields may be null.
 */
public record ClientInfo(String address, String userAgent) {

    private static final int MAX_USER_AGENT = 500;

    public ClientInfo {
        if (userAgent != null && userAgent.length() > MAX_USER_AGENT) {
            userAgent = userAgent.substring(0, MAX_USER_AGENT);
        }
    }

    public static ClientInfo unknown() {
        return new ClientInfo(null, null);
    }
}
