/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.qdocs.control.entity.VersionStatus;
import com.qdocs.control.model.ControlError;

import java.time.Instant;

/**
 * Error body for every non-2xx answer. Optional fields appear only for the failures that carry them.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(int status, String reason, String message, String holderId, Instant heldSince,
                            String currentHash, VersionStatus currentStatus) {

    public static ErrorResponse of(int status, String reason, String message) {
        return new ErrorResponse(status, reason, message, null, null, null, null);
    }

    public static ErrorResponse of(int status, ControlError error) {
        return new ErrorResponse(status, error.reason().name(), error.message(),
                error.holderId().orElse(null),
                error.heldSince().orElse(null),
                error.currentHash().orElse(null),
                error.currentStatus().orElse(null));
    }
}
