/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.controller;

import com.qdocs.control.dto.ErrorResponse;
import com.qdocs.control.service.AuditLedgerException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@Slf4j
@RestControllerAdvice
public class ControlExceptionHandler {

    @ExceptionHandler(UnauthenticatedException.class)
    public ResponseEntity<ErrorResponse> handleUnauthenticated(UnauthenticatedException ex) {
        log.debug("Rejected request: {}", ex.getMessage());
        return error(HttpStatus.UNAUTHORIZED, "SESSION_" + ex.getReason(), ex.getMessage());
    }

    @ExceptionHandler(AuditLedgerException.class)
    public ResponseEntity<ErrorResponse> handleAuditLedger(AuditLedgerException ex) {
        log.error("Audit ledger failure; operation rolled back", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "AUDIT_FAILURE", "The change could not be recorded and was not applied");
    }

    @ExceptionHandler(ConcurrencyFailureException.class)
    public ResponseEntity<ErrorResponse> handleConcurrencyFailure(ConcurrencyFailureException ex) {
        log.warn("Store contention: {}", ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "BUSY", "The record is busy; retry shortly");
    }

    @ExceptionHandler({MissingRequestHeaderException.class, MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage());
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String reason, String message) {
        return ResponseEntity.status(status).body(ErrorResponse.of(status.value(), reason, message));
    }
}
