/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.entity;

import com.qdocs.control.model.InputLimits;
import jakarta.persistence.Column;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.MappedSuperclass;
import lombok.Getter;
import lombok.Setter;

import java.time.Duration;
import java.time.Instant;

/**
 * A time-bounded exclusive claim of one holder over one key, proven by an opaque token.
 *
 * <p>{@code liveKey} carries the claimed key while the claim is unreleased and is
 * cleared when the claim ends. The column is unique, and NULLs do not collide, so the
 * store itself refuses a second unreleased claim on the same key.
 *
 * <p>A claim is live iff it is unreleased and {@code now < expiresAt}. An unreleased
 * claim past its expiry is dead but still occupies its key until it is reclaimed.
 */
@MappedSuperclass
@Getter
@Setter
public abstract class ExclusiveClaim {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "token", nullable = false, unique = true, length = 64)
    private String token;

    @Column(name = "holder_id", nullable = false, length = InputLimits.USER_ID)
    private String holderId;

    @Column(name = "live_key", unique = true, length = 128)
    private String liveKey;

    @Column(name = "lease_ms", nullable = false)
    private long leaseMillis;

    @Column(name = "acquired_at", nullable = false)
    private Instant acquiredAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "last_heartbeat_at", nullable = false)
    private Instant lastHeartbeatAt;

    @Column(name = "released_at")
    private Instant releasedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "end_reason", length = 32)
    private ClaimEndReason endReason;

    @Column(name = "ended_by", length = 100)
    private String endedBy;

    @Column(name = "client_address", length = 64)
    private String clientAddress;

    @Column(name = "user_agent", length = 500)
    private String userAgent;

    public boolean isReleased() {
        return releasedAt != null;
    }

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public boolean isLiveAt(Instant now) {
        return !isReleased() && !isExpiredAt(now);
    }

    public boolean isHeldBy(String userId) {
        return holderId.equals(userId);
    }

    /**
     * Starts the claim: the token becomes the credential and the key becomes occupied.
     */
    public void begin(String liveKey, String token, String holderId, Duration lease, Instant now) {
        this.liveKey = liveKey;
        this.token = token;
        this.holderId = holderId;
        this.leaseMillis = lease.toMillis();
        this.acquiredAt = now;
        this.lastHeartbeatAt = now;
        this.expiresAt = now.plus(lease);
    }

    /**
     * Extends the expiry to {@code now + lease}. Never moves it backwards.
     */
    public Instant extend(Instant now) {
        var candidate = now.plusMillis(leaseMillis);
        if (candidate.isAfter(expiresAt)) {
            expiresAt = candidate;
        }
        lastHeartbeatAt = now;
        return expiresAt;
    }

    /**
     * Ends the claim and frees its key.
     */
    public void end(ClaimEndReason reason, String endedBy, Instant at) {
        this.releasedAt = at;
        this.endReason = reason;
        this.endedBy = endedBy;
        this.liveKey = null;
    }
}
