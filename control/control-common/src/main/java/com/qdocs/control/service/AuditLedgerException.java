/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.service;

/**
 * The audit ledger could not record an event. Fatal to the enclosing operation:
 * the state change rolls back with it.
 */
public class AuditLedgerException extends RuntimeException {

    public AuditLedgerException(String message) {
        super(message);
    }

    public AuditLedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
