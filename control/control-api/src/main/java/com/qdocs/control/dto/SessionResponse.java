/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.dto;

import com.qdocs.control.entity.UserSession;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class SessionResponse {
    private String sessionId;
    private String userId;
    private Instant createdAt;
    private Instant expiresAt;
    private Instant lastSeenAt;

    public static SessionResponse from(UserSession session) {
        return SessionResponse.builder()
                .sessionId(session.getSessionId())
                .userId(session.getUserId())
                .createdAt(session.getCreatedAt())
                .expiresAt(session.getExpiresAt())
                .lastSeenAt(session.getLastSeenAt())
                .build();
    }
}
