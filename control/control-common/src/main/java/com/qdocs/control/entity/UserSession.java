/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.entity;

import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One authenticated login. The claim token is the session id, the holder is the user,
 * and heartbeats are per-request validations sliding the idle expiry forward.
 */
@Entity
@Table(name = "user_sessions", indexes = {
        @Index(name = "idx_user_sessions_holder", columnList = "holder_id"),
        @Index(name = "idx_user_sessions_expiry", columnList = "released_at, expires_at")
})
@NoArgsConstructor
public class UserSession extends ExclusiveClaim {

    public String getSessionId() {
        return getToken();
    }

    public String getUserId() {
        return getHolderId();
    }

    public Instant getCreatedAt() {
        return getAcquiredAt();
    }

    public Instant getLastSeenAt() {
        return getLastHeartbeatAt();
    }

    @Override
    public String toString() {
        return "UserSession[id=" + getId() + ", user=" + getHolderId() + ", createdAt=" + getAcquiredAt()
                + ", endReason=" + getEndReason() + "]";
    }
}
