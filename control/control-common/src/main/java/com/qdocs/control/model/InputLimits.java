/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.model;

/**
 * Maximum lengths of caller-supplied text. Column definitions use the same constants,
 * so input within these limits always fits the store.
 */
public final class InputLimits {

    public static final int USER_ID = 100;
    public static final int DOCUMENT_NUMBER = 64;
    public static final int TITLE = 255;
    public static final int DEPARTMENT = 100;
    public static final int CHANGE_SUMMARY = 1000;
    public static final int COMMENT = 2000;
    public static final int CLIENT_SESSION_ID = 100;

    private InputLimits() {
    }

    public static boolean exceeds(String value, int maxLength) {
        return value != null && value.length() > maxLength;
    }
}
