/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.controller;

import com.qdocs.control.dto.CreateDocumentRequest;
import com.qdocs.control.dto.CreateVersionRequest;
import com.qdocs.control.dto.DocumentResponse;
import com.qdocs.control.dto.VersionResponse;
import com.qdocs.control.service.DocumentCatalogService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/documents")
@RequiredArgsConstructor
public class DocumentController {

    private final DocumentCatalogService catalogService;
    private final ActorResolver actorResolver;

    /**
     * Creates a document and answers with its first (Draft) version.
     */
    @PostMapping
    public ResponseEntity<?> createDocument(@RequestBody CreateDocumentRequest request, HttpServletRequest http) {
        var actor = actorResolver.require(http);
        var result = catalogService.createDocument(request.getDocumentNumber(), request.getTitle(),
                request.getDepartment(), request.getContent(), actor, actorResolver.clientOf(http));
        return ControlResponses.created(result, VersionResponse::summary);
    }

    @GetMapping("/{documentId}")
    public ResponseEntity<?> getDocument(@PathVariable long documentId, HttpServletRequest http) {
        actorResolver.require(http);
        return ControlResponses.ok(catalogService.getDocument(documentId), DocumentResponse::from);
    }

    @GetMapping("/{documentId}/versions")
    public ResponseEntity<?> listVersions(@PathVariable long documentId, HttpServletRequest http) {
        actorResolver.require(http);
        return ControlResponses.ok(catalogService.listVersions(documentId),
                versions -> versions.stream().map(VersionResponse::summary).toList());
    }

    @PostMapping("/{documentId}/versions")
    public ResponseEntity<?> createVersion(@PathVariable long documentId,
                                           @RequestBody(required = false) CreateVersionRequest request,
                                           HttpServletRequest http) {
        var actor = actorResolver.require(http);
        var summary = request != null ? request.getChangeSummary() : null;
        var result = catalogService.createVersion(documentId, summary, actor, actorResolver.clientOf(http));
        return ControlResponses.created(result, VersionResponse::summary);
    }
}
