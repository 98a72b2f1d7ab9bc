/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.model;

/**
 * Outcome of a control operation: either a success carrying a value
 * or a failure carrying a typed {@link ControlError}.
 */
public sealed interface ControlResult<T> {

    /**
     * Checks if this result represents a success.
     */
    boolean isSuccess();

    /**
     * Gets the value if successful, throws if not.
     */
    T getValue();

    /**
     * Gets the error if failed, throws if successful.
     */
    ControlError getError();

    /**
     * Shorthand for the failure reason, or null on success.
     */
    default FailureReason reason() {
        return isSuccess() ? null : getError().reason();
    }

    static <T> ControlResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> ControlResult<T> failure(ControlError error) {
        return new Failure<>(error);
    }

    static <T> ControlResult<T> failure(FailureReason reason, String message) {
        return new Failure<>(new ControlError(reason, message));
    }

    record Success<T>(T value) implements ControlResult<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T getValue() {
            return value;
        }

        @Override
        public ControlError getError() {
            throw new IllegalStateException("Cannot get error from success result");
        }
    }

    record Failure<T>(ControlError error) implements ControlResult<T> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T getValue() {
            throw new IllegalStateException("Cannot get value from failure result: " + error);
        }

        @Override
        public ControlError getError() {
            return error;
        }
    }
}
