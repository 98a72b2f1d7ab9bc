/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.service;

import com.qdocs.control.entity.AuditAction;
import com.qdocs.control.entity.AuditTargetType;
import com.qdocs.control.entity.Document;
import com.qdocs.control.entity.DocumentVersion;
import com.qdocs.control.entity.VersionStatus;
import com.qdocs.control.model.Actor;
import com.qdocs.control.model.AuditEvent;
import com.qdocs.control.model.Capability;
import com.qdocs.control.model.ClientInfo;
import com.qdocs.control.model.ControlError;
import com.qdocs.control.model.ControlResult;
import com.qdocs.control.model.InputLimits;
import com.qdocs.control.repository.DocumentRepository;
import com.qdocs.control.repository.DocumentVersionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Creates documents and their versions. Version numbers per document are strictly
 * increasing and never reused, and a document has at most one version moving through
 * the workflow at a time.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentCatalogService {

    private final DocumentRepository documentRepository;
    private final DocumentVersionRepository versionRepository;
    private final AuditLedger auditLedger;
    private final ControlTransactions transactions;
    private final Clock clock;

    /**
     * Creates a document with version 1 in DRAFT.
     *
     * @return the first version
     */
    public ControlResult<DocumentVersion> createDocument(String documentNumber, String title, String department,
                                                         String initialContent, Actor actor, ClientInfo client) {
        if (!actor.can(Capability.AUTHOR)) {
            return ControlResult.failure(ControlError.capabilityMissing(actor.id(), "create documents"));
        }
        if (documentNumber == null || documentNumber.isBlank() || title == null || title.isBlank()) {
            return ControlResult.failure(ControlError.invalidArgument("Document number and title are required"));
        }
        var number = normalizeDocumentNumber(documentNumber);
        if (InputLimits.exceeds(number, InputLimits.DOCUMENT_NUMBER)) {
            return ControlResult.failure(ControlError.tooLong("Document number", InputLimits.DOCUMENT_NUMBER));
        }
        if (InputLimits.exceeds(title.trim(), InputLimits.TITLE)) {
            return ControlResult.failure(ControlError.tooLong("Title", InputLimits.TITLE));
        }
        if (InputLimits.exceeds(department, InputLimits.DEPARTMENT)) {
            return ControlResult.failure(ControlError.tooLong("Department", InputLimits.DEPARTMENT));
        }
        log.info("Creating document {} for {}", number, actor.id());

        return transactions.write(() -> {
            if (documentRepository.existsByDocumentNumber(number)) {
                return ControlResult.failure(ControlError.duplicateDocument(number));
            }
            var now = clock.instant();
            var document = documentRepository.save(Document.builder()
                    .documentNumber(number)
                    .title(title.trim())
                    .department(department)
                    .ownerId(actor.id())
                    .createdAt(now)
                    .updatedAt(now)
                    .build());

            auditLedger.append(AuditEvent.builder()
                    .actorId(actor.id())
                    .action(AuditAction.DOCUMENT_CREATED)
                    .targetType(AuditTargetType.DOCUMENT)
                    .targetId(String.valueOf(document.getId()))
                    .details(Map.of("documentNumber", number, "title", document.getTitle()))
                    .client(client)
                    .build());

            var version = newVersion(document.getId(), 1, initialContent, "Initial version", actor, client, null);
            log.info("Created document {} ({}) with version {}", number, document.getId(), version.getId());
            return ControlResult.success(version);
        }, () -> documentRepository.findByDocumentNumber(number)
                .map(existing -> ControlResult.<DocumentVersion>failure(ControlError.duplicateDocument(number))));
    }

    /**
     * Starts the next version of a document in DRAFT, seeded from the current Published
     * version (or the latest version when nothing is published).
     */
    public ControlResult<DocumentVersion> createVersion(long documentId, String changeSummary, Actor actor,
                                                        ClientInfo client) {
        if (!actor.can(Capability.AUTHOR)) {
            return ControlResult.failure(ControlError.capabilityMissing(actor.id(), "create versions"));
        }
        if (InputLimits.exceeds(changeSummary, InputLimits.CHANGE_SUMMARY)) {
            return ControlResult.failure(ControlError.tooLong("Change summary", InputLimits.CHANGE_SUMMARY));
        }
        return transactions.write(() -> {
            var document = documentRepository.lockById(documentId).orElse(null);
            if (document == null) {
                return ControlResult.failure(ControlError.notFound("Document", documentId));
            }
            var inProgress = versionRepository.findByDocumentIdAndStatusIn(documentId, VersionStatus.activeEditing());
            if (!inProgress.isEmpty()) {
                var active = inProgress.get(0);
                return ControlResult.failure(ControlError.versionInProgress(active.getVersionNumber(), active.getStatus()));
            }

            var base = baseVersionOf(document);
            int nextNumber = versionRepository.findMaxVersionNumber(documentId) + 1;
            var version = newVersion(documentId, nextNumber, base.map(DocumentVersion::getContent).orElse(null),
                    changeSummary, actor, client, base.map(DocumentVersion::getId).orElse(null));
            document.setUpdatedAt(version.getCreatedAt());
            log.info("Created version {} of document {} for {}", nextNumber, documentId, actor.id());
            return ControlResult.success(version);
        });
    }

    public ControlResult<DocumentVersion> getVersion(long versionId) {
        return transactions.read(() -> versionRepository.findById(versionId)
                .map(ControlResult::success)
                .orElseGet(() -> ControlResult.failure(ControlError.notFound("Version", versionId))));
    }

    public ControlResult<Document> getDocument(long documentId) {
        return transactions.read(() -> documentRepository.findById(documentId)
                .map(ControlResult::success)
                .orElseGet(() -> ControlResult.failure(ControlError.notFound("Document", documentId))));
    }

    /**
     * All versions of a document, oldest first.
     */
    public ControlResult<List<DocumentVersion>> listVersions(long documentId) {
        return transactions.read(() -> {
            if (!documentRepository.existsById(documentId)) {
                return ControlResult.failure(ControlError.notFound("Document", documentId));
            }
            return ControlResult.success(versionRepository.findByDocumentIdOrderByVersionNumberAsc(documentId));
        });
    }

    /**
     * Trims, joins whitespace runs with hyphens and upper-cases a document number.
     */
    static String normalizeDocumentNumber(String documentNumber) {
        return documentNumber.trim().replaceAll("\\s+", "-").toUpperCase(Locale.ROOT);
    }

    private Optional<DocumentVersion> baseVersionOf(Document document) {
        if (document.getCurrentVersionId() != null) {
            var current = versionRepository.findById(document.getCurrentVersionId());
            if (current.isPresent()) {
                return current;
            }
        }
        return versionRepository.findByDocumentIdOrderByVersionNumberAsc(document.getId()).stream()
                .max(Comparator.comparingInt(DocumentVersion::getVersionNumber));
    }

    private DocumentVersion newVersion(Long documentId, int versionNumber, String content, String changeSummary,
                                       Actor actor, ClientInfo client, Long basedOn) {
        var now = clock.instant();
        var version = versionRepository.save(DocumentVersion.builder()
                .documentId(documentId)
                .versionNumber(versionNumber)
                .status(VersionStatus.DRAFT)
                .content(content)
                .contentHash(ContentHash.of(content))
                .changeSummary(changeSummary)
                .authorId(actor.id())
                .createdAt(now)
                .updatedAt(now)
                .build());

        var details = new LinkedHashMap<String, Object>();
        details.put("documentId", documentId);
        details.put("versionNumber", versionNumber);
        if (basedOn != null) {
            details.put("basedOnVersionId", basedOn);
        }
        auditLedger.append(AuditEvent.builder()
                .actorId(actor.id())
                .action(AuditAction.VERSION_CREATED)
                .targetType(AuditTargetType.DOCUMENT_VERSION)
                .targetId(String.valueOf(version.getId()))
                .toState(VersionStatus.DRAFT.name())
                .comment(changeSummary)
                .details(details)
                .client(client)
                .build());
        return version;
    }
}
