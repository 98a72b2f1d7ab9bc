/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.dto;

import com.qdocs.control.entity.Document;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class DocumentResponse {
    private Long id;
    private String documentNumber;
    private String title;
    private String department;
    private String ownerId;
    private Long currentVersionId;
    private Instant createdAt;
    private Instant updatedAt;

    public static DocumentResponse from(Document document) {
        return DocumentResponse.builder()
                .id(document.getId())
                .documentNumber(document.getDocumentNumber())
                .title(document.getTitle())
                .department(document.getDepartment())
                .ownerId(document.getOwnerId())
                .currentVersionId(document.getCurrentVersionId())
                .createdAt(document.getCreatedAt())
                .updatedAt(document.getUpdatedAt())
                .build();
    }
}
