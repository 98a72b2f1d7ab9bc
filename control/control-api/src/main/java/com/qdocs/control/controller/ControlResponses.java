/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.controller;

import com.qdocs.control.dto.ErrorResponse;
import com.qdocs.control.model.ControlError;
import com.qdocs.control.model.ControlResult;
import com.qdocs.control.model.FailureReason;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.function.Function;

/**
 * Maps control results onto HTTP answers.
 */
public final class ControlResponses {

    private ControlResponses() {
    }

    public static <T> ResponseEntity<?> ok(ControlResult<T> result, Function<T, ?> body) {
        return respond(result, HttpStatus.OK, body);
    }

    public static <T> ResponseEntity<?> created(ControlResult<T> result, Function<T, ?> body) {
        return respond(result, HttpStatus.CREATED, body);
    }

    public static <T> ResponseEntity<?> noContent(ControlResult<T> result) {
        if (result.isSuccess()) {
            return ResponseEntity.noContent().build();
        }
        return failure(result.getError());
    }

    public static <T> ResponseEntity<?> respond(ControlResult<T> result, HttpStatus status, Function<T, ?> body) {
        if (result.isSuccess()) {
            return ResponseEntity.status(status).body(body.apply(result.getValue()));
        }
        return failure(result.getError());
    }

    public static ResponseEntity<ErrorResponse> failure(ControlError error) {
        var status = statusOf(error.reason());
        return ResponseEntity.status(status).body(ErrorResponse.of(status.value(), error));
    }

    public static HttpStatus statusOf(FailureReason reason) {
        return switch (reason) {
            case LOCK_HELD -> HttpStatus.LOCKED;
            case SESSION_CONFLICT, STALE_CONTENT, VERSION_IN_PROGRESS, DUPLICATE_DOCUMENT -> HttpStatus.CONFLICT;
            case LOCK_EXPIRED -> HttpStatus.GONE;
            case INVALID_TRANSITION, VERSION_NOT_EDITABLE, COMMENT_REQUIRED -> HttpStatus.UNPROCESSABLE_ENTITY;
            case NOT_LOCK_OWNER, CAPABILITY_MISSING -> HttpStatus.FORBIDDEN;
            case INVALID_CREDENTIALS, SIGNATURE_REJECTED -> HttpStatus.UNAUTHORIZED;
            case NOT_FOUND, LOCK_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID_ARGUMENT -> HttpStatus.BAD_REQUEST;
        };
    }
}
