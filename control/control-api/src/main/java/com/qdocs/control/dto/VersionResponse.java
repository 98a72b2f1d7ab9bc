/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.qdocs.control.entity.DocumentVersion;
import com.qdocs.control.entity.VersionStatus;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * A version with its workflow stamps. Content is only included where requested.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VersionResponse {
    private Long id;
    private Long documentId;
    private int versionNumber;
    private VersionStatus status;
    private String contentHash;
    private String content;
    private String changeSummary;
    private String authorId;
    private Instant createdAt;
    private Instant updatedAt;
    private String submittedBy;
    private Instant submittedAt;
    private String reviewedBy;
    private Instant reviewedAt;
    private String approvedBy;
    private Instant approvedAt;
    private String signatureMeaning;
    private String rejectedBy;
    private String rejectionComment;
    private String publishedBy;
    private Instant publishedAt;
    private Instant archivedAt;

    public static VersionResponse summary(DocumentVersion version) {
        return builderFor(version).build();
    }

    public static VersionResponse withContent(DocumentVersion version) {
        return builderFor(version).content(version.getContent()).build();
    }

    private static VersionResponseBuilder builderFor(DocumentVersion version) {
        return VersionResponse.builder()
                .id(version.getId())
                .documentId(version.getDocumentId())
                .versionNumber(version.getVersionNumber())
                .status(version.getStatus())
                .contentHash(version.getContentHash())
                .changeSummary(version.getChangeSummary())
                .authorId(version.getAuthorId())
                .createdAt(version.getCreatedAt())
                .updatedAt(version.getUpdatedAt())
                .submittedBy(version.getSubmittedBy())
                .submittedAt(version.getSubmittedAt())
                .reviewedBy(version.getReviewedBy())
                .reviewedAt(version.getReviewedAt())
                .approvedBy(version.getApprovedBy())
                .approvedAt(version.getApprovedAt())
                .signatureMeaning(version.getSignatureMeaning())
                .rejectedBy(version.getRejectedBy())
                .rejectionComment(version.getRejectionComment())
                .publishedBy(version.getPublishedBy())
                .publishedAt(version.getPublishedAt())
                .archivedAt(version.getArchivedAt());
    }
}
