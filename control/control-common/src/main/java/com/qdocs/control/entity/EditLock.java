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
import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Exclusive editing right over one document version.
 */
@Entity
@Table(name = "edit_locks", indexes = {
        @Index(name = "idx_edit_locks_version", columnList = "version_id"),
        @Index(name = "idx_edit_locks_expiry", columnList = "released_at, expires_at")
})
@Getter
@Setter
@NoArgsConstructor
public class EditLock extends ExclusiveClaim {

    @Column(name = "version_id", nullable = false)
    private Long versionId;

    /** Client-side session label the editor reported, if any */
    @Column(name = "client_session_id", length = InputLimits.CLIENT_SESSION_ID)
    private String clientSessionId;

    @Override
    public String toString() {
        return "EditLock[id=" + getId() + ", versionId=" + versionId + ", holder=" + getHolderId()
                + ", expiresAt=" + getExpiresAt() + ", endReason=" + getEndReason() + "]";
    }
}
