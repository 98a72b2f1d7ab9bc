/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.service;

import com.qdocs.control.config.WorkflowConfig;
import com.qdocs.control.entity.AuditAction;
import com.qdocs.control.entity.AuditTargetType;
import com.qdocs.control.entity.Document;
import com.qdocs.control.entity.DocumentVersion;
import com.qdocs.control.entity.VersionStatus;
import com.qdocs.control.identity.IdentityProvider;
import com.qdocs.control.model.Actor;
import com.qdocs.control.model.AuditEvent;
import com.qdocs.control.model.ClientInfo;
import com.qdocs.control.model.ControlError;
import com.qdocs.control.model.ControlResult;
import com.qdocs.control.model.InputLimits;
import com.qdocs.control.model.WorkflowAction;
import com.qdocs.control.repository.DocumentRepository;
import com.qdocs.control.repository.DocumentVersionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Version state machine. Every transition is validated against {@link WorkflowAction}
 * in one place, so each caller sees the same checks in the same order: existence,
 * the transition table, capability, comment, then e-signature.
 *
 * <p>The version row is locked for the whole transition. PUBLISH and ARCHIVE lock the
 * document row first because they also touch the document's other versions.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VersionWorkflowService {

    private final DocumentRepository documentRepository;
    private final DocumentVersionRepository versionRepository;
    private final EditLockService editLockService;
    private final IdentityProvider identityProvider;
    private final AuditLedger auditLedger;
    private final ControlTransactions transactions;
    private final WorkflowConfig workflowConfig;
    private final Clock clock;

    /**
     * Applies a workflow action to a version.
     *
     * @param signature the actor's credential re-entered as an e-signature; only checked
     *                  for actions configured to require one
     * @return the applied transition, or the first failed check
     */
    public ControlResult<Transition> transition(long versionId, WorkflowAction action, Actor actor,
                                                String comment, String signature, ClientInfo client) {
        log.debug("Transition request: versionId={}, action={}, userId={}", versionId, action, actor.id());
        if (InputLimits.exceeds(comment, InputLimits.COMMENT)) {
            return ControlResult.failure(ControlError.tooLong("Comment", InputLimits.COMMENT));
        }

        return transactions.write(() -> {
            if (action == WorkflowAction.PUBLISH || action == WorkflowAction.ARCHIVE) {
                var documentId = versionRepository.findDocumentIdById(versionId).orElse(null);
                if (documentId == null) {
                    return ControlResult.failure(ControlError.notFound("Version", versionId));
                }
                documentRepository.lockById(documentId);
            }

            var version = versionRepository.lockById(versionId).orElse(null);
            if (version == null) {
                return ControlResult.failure(ControlError.notFound("Version", versionId));
            }
            var from = version.getStatus();
            if (!action.appliesTo(from)) {
                log.info("Rejected {} on version {} in state {}", action, versionId, from);
                return ControlResult.failure(ControlError.invalidTransition(from, action));
            }
            if (!action.permits(actor)) {
                return ControlResult.failure(ControlError.capabilityMissing(actor.id(), action));
            }
            if (action.isCommentRequired() && (comment == null || comment.isBlank())) {
                return ControlResult.failure(ControlError.commentRequired(action));
            }
            boolean signed = workflowConfig.requiresSignature(action);
            if (signed && !identityProvider.verifyCredential(actor.id(), signature)) {
                log.warn("E-signature rejected for {} on version {} by {}", action, versionId, actor.id());
                return ControlResult.failure(ControlError.signatureRejected(actor.id()));
            }

            // Leaving DRAFT ends the editing session on the version.
            var lock = action.from() == VersionStatus.DRAFT
                    ? editLockService.lockCurrent(versionId).orElse(null)
                    : null;
            var now = clock.instant();
            if (lock != null && lock.isLiveAt(now) && !lock.isHeldBy(actor.id())) {
                return ControlResult.failure(ControlError.lockHeld(lock.getHolderId(), lock.getAcquiredAt()));
            }

            apply(version, action, actor.id(), comment, signed, now);
            auditLedger.append(AuditEvent.builder()
                    .actorId(actor.id())
                    .action(action.auditAction())
                    .targetType(AuditTargetType.DOCUMENT_VERSION)
                    .targetId(String.valueOf(versionId))
                    .fromState(from.name())
                    .toState(action.to().name())
                    .comment(comment)
                    .details(transitionDetails(version, action, signed))
                    .client(client)
                    .build());

            boolean lockReleased = false;
            if (lock != null) {
                editLockService.endForTransition(lock, actor, client);
                lockReleased = true;
            }

            List<Long> archived = List.of();
            if (action == WorkflowAction.PUBLISH) {
                archived = publish(version, actor, client, now);
            } else if (action == WorkflowAction.ARCHIVE) {
                clearCurrentIfArchived(version, now);
            }

            log.info("Version {} moved {} -> {} by {} ({})", versionId, from, action.to(), actor.id(), action);
            return ControlResult.success(new Transition(versionId, from, action.to(), action, lockReleased, archived));
        });
    }

    /**
     * Saves new content into a Draft version. The caller must present its live lock token
     * and the hash of the content its edit was based on.
     *
     * @return the new content hash, or STALE_CONTENT carrying the stored hash
     */
    public ControlResult<String> saveContent(long versionId, String token, String baseHash, String newContent,
                                             Actor actor, ClientInfo client) {
        log.debug("Save content request: versionId={}, userId={}", versionId, actor.id());

        return transactions.write(() -> {
            var version = versionRepository.lockById(versionId).orElse(null);
            if (version == null) {
                return ControlResult.failure(ControlError.notFound("Version", versionId));
            }
            if (!version.getStatus().isEditable()) {
                return ControlResult.failure(ControlError.versionNotEditable(versionId, version.getStatus()));
            }
            var held = editLockService.requireHeldLock(version, token, actor.id());
            if (!held.isSuccess()) {
                return ControlResult.failure(held.getError());
            }
            var currentHash = version.getContentHash();
            if (baseHash == null || !baseHash.equalsIgnoreCase(currentHash)) {
                log.info("Stale save on version {} by {}", versionId, actor.id());
                return ControlResult.failure(ControlError.staleContent(currentHash));
            }

            var newHash = ContentHash.of(newContent);
            version.setContent(newContent);
            version.setContentHash(newHash);
            version.setUpdatedAt(clock.instant());

            var details = new LinkedHashMap<String, Object>();
            details.put("beforeHash", currentHash);
            details.put("afterHash", newHash);
            details.put("length", newContent == null ? 0 : newContent.length());
            auditLedger.append(AuditEvent.builder()
                    .actorId(actor.id())
                    .action(AuditAction.VERSION_CONTENT_SAVED)
                    .targetType(AuditTargetType.DOCUMENT_VERSION)
                    .targetId(String.valueOf(versionId))
                    .details(details)
                    .client(client)
                    .build());
            return ControlResult.success(newHash);
        });
    }

    private void apply(DocumentVersion version, WorkflowAction action, String actorId, String comment,
                       boolean signed, Instant now) {
        version.setStatus(action.to());
        version.setUpdatedAt(now);
        switch (action) {
            case SUBMIT_FOR_REVIEW -> {
                version.setSubmittedBy(actorId);
                version.setSubmittedAt(now);
            }
            case APPROVE_REVIEW -> {
                version.setReviewedBy(actorId);
                version.setReviewedAt(now);
                version.setReviewComment(comment);
            }
            case REJECT_REVIEW, REJECT_APPROVAL, WITHDRAW -> {
                version.setRejectedBy(actorId);
                version.setRejectedAt(now);
                version.setRejectionComment(comment);
            }
            case APPROVE -> {
                version.setApprovedBy(actorId);
                version.setApprovedAt(now);
                if (signed) {
                    version.setSignedAt(now);
                    version.setSignatureMeaning(workflowConfig.getApprovalSignatureMeaning());
                }
            }
            case PUBLISH -> {
                version.setPublishedBy(actorId);
                version.setPublishedAt(now);
            }
            case ARCHIVE -> {
                version.setArchivedBy(actorId);
                version.setArchivedAt(now);
            }
        }
    }

    /**
     * Makes the version current and archives every other Published version of the document.
     */
    private List<Long> publish(DocumentVersion version, Actor actor, ClientInfo client, Instant now) {
        var archived = new ArrayList<Long>();
        for (var previous : versionRepository.findByDocumentIdAndStatus(version.getDocumentId(), VersionStatus.PUBLISHED)) {
            if (previous.getId().equals(version.getId())) {
                continue;
            }
            var locked = versionRepository.lockById(previous.getId()).orElse(previous);
            locked.setStatus(VersionStatus.ARCHIVED);
            locked.setArchivedBy(actor.id());
            locked.setArchivedAt(now);
            locked.setUpdatedAt(now);
            auditLedger.append(AuditEvent.builder()
                    .actorId(actor.id())
                    .action(AuditAction.VERSION_ARCHIVED)
                    .targetType(AuditTargetType.DOCUMENT_VERSION)
                    .targetId(String.valueOf(locked.getId()))
                    .fromState(VersionStatus.PUBLISHED.name())
                    .toState(VersionStatus.ARCHIVED.name())
                    .comment("Superseded by version " + version.getVersionNumber())
                    .details(Map.of("documentId", version.getDocumentId(), "supersededBy", version.getId()))
                    .client(client)
                    .build());
            archived.add(locked.getId());
            log.info("Version {} archived, superseded by version {}", locked.getId(), version.getId());
        }

        documentRepository.findById(version.getDocumentId()).ifPresent(document -> {
            document.setCurrentVersionId(version.getId());
            document.setUpdatedAt(now);
        });
        return archived;
    }

    private void clearCurrentIfArchived(DocumentVersion version, Instant now) {
        documentRepository.findById(version.getDocumentId())
                .filter(document -> version.getId().equals(document.getCurrentVersionId()))
                .ifPresent(document -> clearCurrent(document, now));
    }

    private static void clearCurrent(Document document, Instant now) {
        document.setCurrentVersionId(null);
        document.setUpdatedAt(now);
    }

    private static Map<String, Object> transitionDetails(DocumentVersion version, WorkflowAction action, boolean signed) {
        var details = new LinkedHashMap<String, Object>();
        details.put("documentId", version.getDocumentId());
        details.put("versionNumber", version.getVersionNumber());
        details.put("transition", action.name());
        if (signed) {
            details.put("eSignature", true);
        }
        return details;
    }

    /**
     * An applied transition and its side effects.
     */
    public record Transition(long versionId, VersionStatus from, VersionStatus to, WorkflowAction action,
                             boolean lockReleased, List<Long> archivedVersionIds) {
    }
}
