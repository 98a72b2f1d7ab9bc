/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.model;

import java.util.Optional;

/**
 * Outcome of recomputing the audit hash chain.
 */
public record AuditVerificationResult(Status status, long entriesChecked, Optional<BrokenLink> brokenLink) {

    public enum Status {
        VALID,
        BROKEN,
        EMPTY
    }

    /**
     * First entry whose stored linkage or hash disagrees with the recomputed chain.
     */
    public record BrokenLink(long sequenceNumber, String problem, String expected, String actual) {
    }

    public static AuditVerificationResult valid(long entriesChecked) {
        return new AuditVerificationResult(Status.VALID, entriesChecked, Optional.empty());
    }

    public static AuditVerificationResult empty() {
        return new AuditVerificationResult(Status.EMPTY, 0, Optional.empty());
    }

    public static AuditVerificationResult broken(long entriesChecked, BrokenLink link) {
        return new AuditVerificationResult(Status.BROKEN, entriesChecked, Optional.of(link));
    }

    public boolean isValid() {
        return status == Status.VALID;
    }
}
