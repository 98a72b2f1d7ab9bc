/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.controller;

import com.qdocs.control.dto.AcquireLockRequest;
import com.qdocs.control.dto.AuditEntryResponse;
import com.qdocs.control.dto.ReasonRequest;
import com.qdocs.control.dto.SaveContentRequest;
import com.qdocs.control.dto.TransitionRequest;
import com.qdocs.control.dto.VersionResponse;
import com.qdocs.control.service.AuditTrailService;
import com.qdocs.control.service.DocumentCatalogService;
import com.qdocs.control.service.EditLockService;
import com.qdocs.control.service.VersionWorkflowService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Editing and workflow operations on one document version.
 */
@RestController
@RequestMapping("/api/versions/{versionId}")
@RequiredArgsConstructor
public class VersionController {

    private final DocumentCatalogService catalogService;
    private final EditLockService editLockService;
    private final VersionWorkflowService workflowService;
    private final AuditTrailService auditTrailService;
    private final ActorResolver actorResolver;

    @GetMapping
    public ResponseEntity<?> getVersion(@PathVariable long versionId, HttpServletRequest http) {
        actorResolver.require(http);
        return ControlResponses.ok(catalogService.getVersion(versionId), VersionResponse::withContent);
    }

    @PostMapping("/lock")
    public ResponseEntity<?> acquireLock(@PathVariable long versionId,
                                         @RequestBody(required = false) AcquireLockRequest request,
                                         HttpServletRequest http) {
        var actor = actorResolver.require(http);
        Duration duration = request != null && request.getDurationMinutes() != null
                ? Duration.ofMinutes(request.getDurationMinutes())
                : null;
        String clientSessionId = request != null ? request.getClientSessionId() : null;
        var result = editLockService.acquire(versionId, actor, duration, actorResolver.clientOf(http), clientSessionId);
        return ControlResponses.ok(result, grant -> grant);
    }

    @GetMapping("/lock")
    public ResponseEntity<?> inspectLock(@PathVariable long versionId, HttpServletRequest http) {
        actorResolver.require(http);
        return ControlResponses.ok(editLockService.inspect(versionId), info -> info);
    }

    @DeleteMapping("/lock")
    public ResponseEntity<?> forceReleaseLock(@PathVariable long versionId, @RequestBody ReasonRequest request,
                                              HttpServletRequest http) {
        var admin = actorResolver.require(http);
        var result = editLockService.forceRelease(versionId, admin, request.getReason(), actorResolver.clientOf(http));
        return ControlResponses.ok(result, holder -> Map.of("displacedHolder", holder));
    }

    @PutMapping("/content")
    public ResponseEntity<?> saveContent(@PathVariable long versionId, @RequestBody SaveContentRequest request,
                                         HttpServletRequest http) {
        var actor = actorResolver.require(http);
        var result = workflowService.saveContent(versionId, request.getLockToken(), request.getBaseHash(),
                request.getContent(), actor, actorResolver.clientOf(http));
        return ControlResponses.ok(result, hash -> Map.of("contentHash", hash));
    }

    @PostMapping("/transitions")
    public ResponseEntity<?> transition(@PathVariable long versionId, @RequestBody TransitionRequest request,
                                        HttpServletRequest http) {
        if (request.getAction() == null) {
            throw new IllegalArgumentException("action is required");
        }
        var actor = actorResolver.require(http);
        var result = workflowService.transition(versionId, request.getAction(), actor, request.getComment(),
                request.getSignature(), actorResolver.clientOf(http));
        return ControlResponses.ok(result, transition -> transition);
    }

    @GetMapping("/history")
    public ResponseEntity<List<AuditEntryResponse>> history(@PathVariable long versionId, HttpServletRequest http) {
        actorResolver.require(http);
        var entries = auditTrailService.versionHistory(versionId).stream()
                .map(AuditEntryResponse::from)
                .toList();
        return ResponseEntity.ok(entries);
    }
}
