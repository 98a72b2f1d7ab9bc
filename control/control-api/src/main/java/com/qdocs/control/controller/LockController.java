/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.controller;

import com.qdocs.control.service.EditLockService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Operations addressed by lock token.
 */
@RestController
@RequestMapping("/api/locks/{token}")
@RequiredArgsConstructor
public class LockController {

    private final EditLockService editLockService;
    private final ActorResolver actorResolver;

    @PostMapping("/heartbeat")
    public ResponseEntity<?> heartbeat(@PathVariable String token, HttpServletRequest http) {
        var actor = actorResolver.require(http);
        return ControlResponses.ok(editLockService.heartbeat(token, actor), expiresAt -> Map.of("expiresAt", expiresAt));
    }

    @DeleteMapping
    public ResponseEntity<?> release(@PathVariable String token, HttpServletRequest http) {
        var actor = actorResolver.require(http);
        return ControlResponses.noContent(editLockService.release(token, actor, actorResolver.clientOf(http)));
    }
}
