/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.controller;

import com.qdocs.control.service.SessionService.InvalidReason;
import lombok.Getter;

/**
 * The request carried no session id, or one that no longer authenticates.
 */
@Getter
public class UnauthenticatedException extends RuntimeException {

    private final InvalidReason reason;

    public UnauthenticatedException(InvalidReason reason) {
        super("Session is not valid: " + reason);
        this.reason = reason;
    }
}
