/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.controller;

import com.qdocs.control.dto.AuditEntryResponse;
import com.qdocs.control.dto.AuditPageResponse;
import com.qdocs.control.entity.AuditAction;
import com.qdocs.control.entity.AuditTargetType;
import com.qdocs.control.model.AuditQuery;
import com.qdocs.control.model.AuditVerificationResult;
import com.qdocs.control.service.AuditTrailService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/audit")
@RequiredArgsConstructor
public class AuditController {

    private final AuditTrailService auditTrailService;
    private final ActorResolver actorResolver;

    @GetMapping
    public ResponseEntity<AuditPageResponse> query(
            @RequestParam(required = false) String actorId,
            @RequestParam(required = false) AuditAction action,
            @RequestParam(required = false) AuditTargetType targetType,
            @RequestParam(required = false) String targetId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(value = "after", required = false) Long afterSequence,
            @RequestParam(required = false) Integer limit,
            HttpServletRequest http) {
        actorResolver.require(http);
        var query = AuditQuery.builder()
                .actorId(actorId)
                .action(action)
                .targetType(targetType)
                .targetId(targetId)
                .from(from)
                .to(to)
                .afterSequence(afterSequence)
                .limit(limit)
                .build();
        return ResponseEntity.ok(AuditPageResponse.from(auditTrailService.query(query)));
    }

    @GetMapping("/targets/{targetType}/{targetId}")
    public ResponseEntity<List<AuditEntryResponse>> history(@PathVariable AuditTargetType targetType,
                                                            @PathVariable String targetId,
                                                            HttpServletRequest http) {
        actorResolver.require(http);
        return ResponseEntity.ok(auditTrailService.history(targetType, targetId).stream()
                .map(AuditEntryResponse::from)
                .toList());
    }

    @GetMapping("/verification")
    public ResponseEntity<AuditVerificationResult> verify(HttpServletRequest http) {
        actorResolver.require(http);
        return ResponseEntity.ok(auditTrailService.verify());
    }
}
