/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.entity;

import com.qdocs.control.model.InputLimits;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * One revision of a document. Status changes only through the workflow; content
 * changes only while the status is DRAFT and the caller holds the edit lock.
 */
@Entity
@Table(name = "document_versions", uniqueConstraints = {
        @UniqueConstraint(name = "uk_document_versions_document_number", columnNames = {"document_id", "version_number"})
}, indexes = {
        @Index(name = "idx_document_versions_document_status", columnList = "document_id, status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentVersion {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "document_id", nullable = false)
    private Long documentId;

    @Column(name = "version_number", nullable = false)
    private int versionNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private VersionStatus status;

    @ToString.Exclude
    @Column(name = "content", columnDefinition = "text")
    private String content;

    @Column(name = "content_hash", nullable = false, length = 64)
    private String contentHash;

    @Column(name = "change_summary", length = InputLimits.CHANGE_SUMMARY)
    private String changeSummary;

    @Column(name = "author_id", nullable = false, length = InputLimits.USER_ID)
    private String authorId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "submitted_by", length = 100)
    private String submittedBy;

    @Column(name = "submitted_at")
    private Instant submittedAt;

    @Column(name = "reviewed_by", length = 100)
    private String reviewedBy;

    @Column(name = "reviewed_at")
    private Instant reviewedAt;

    @Column(name = "review_comment", length = InputLimits.COMMENT)
    private String reviewComment;

    @Column(name = "approved_by", length = 100)
    private String approvedBy;

    @Column(name = "approved_at")
    private Instant approvedAt;

    /** When the approver's e-signature was verified */
    @Column(name = "signed_at")
    private Instant signedAt;

    @Column(name = "signature_meaning", length = 100)
    private String signatureMeaning;

    @Column(name = "rejected_by", length = 100)
    private String rejectedBy;

    @Column(name = "rejected_at")
    private Instant rejectedAt;

    @Column(name = "rejection_comment", length = InputLimits.COMMENT)
    private String rejectionComment;

    @Column(name = "published_by", length = 100)
    private String publishedBy;

    @Column(name = "published_at")
    private Instant publishedAt;

    @Column(name = "archived_by", length = 100)
    private String archivedBy;

    @Column(name = "archived_at")
    private Instant archivedAt;
}
