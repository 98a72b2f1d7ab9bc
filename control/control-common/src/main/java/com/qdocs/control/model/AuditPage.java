/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.model;

import com.qdocs.control.entity.AuditLogEntry;

import java.util.List;

/**
 * One page of audit entries. Pass {@code nextCursor} as the next query's
 * {@code afterSequence} to continue exactly where this page ended.
 */
public record AuditPage(List<AuditLogEntry> entries, long nextCursor, boolean hasMore) {
}
