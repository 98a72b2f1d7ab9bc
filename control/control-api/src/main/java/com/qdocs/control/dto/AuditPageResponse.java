/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.dto;

import com.qdocs.control.model.AuditPage;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class AuditPageResponse {
    private List<AuditEntryResponse> entries;
    /** Pass back as {@code after} to continue where this page ended */
    private long nextCursor;
    private boolean hasMore;

    public static AuditPageResponse from(AuditPage page) {
        return AuditPageResponse.builder()
                .entries(page.entries().stream().map(AuditEntryResponse::from).toList())
                .nextCursor(page.nextCursor())
                .hasMore(page.hasMore())
                .build();
    }
}
