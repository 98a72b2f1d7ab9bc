/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.controller;

import com.qdocs.control.dto.LoginRequest;
import com.qdocs.control.dto.ReasonRequest;
import com.qdocs.control.dto.SessionResponse;
import com.qdocs.control.service.SessionService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
public class SessionController {

    private final SessionService sessionService;
    private final ActorResolver actorResolver;

    @PostMapping
    public ResponseEntity<?> login(@RequestBody LoginRequest request, HttpServletRequest http) {
        var result = sessionService.login(request.getUserId(), request.getCredential(), request.isForce(),
                actorResolver.clientOf(http));
        return ControlResponses.created(result, SessionResponse::from);
    }

    @GetMapping("/current")
    public ResponseEntity<SessionService.SessionValidation> current(
            @RequestHeader(value = ActorResolver.SESSION_HEADER, required = false) String sessionId) {
        var validation = sessionService.validate(sessionId);
        return ResponseEntity.status(validation.valid() ? HttpStatus.OK : HttpStatus.UNAUTHORIZED).body(validation);
    }

    @DeleteMapping("/current")
    public ResponseEntity<?> logout(
            @RequestHeader(value = ActorResolver.SESSION_HEADER, required = false) String sessionId,
            HttpServletRequest http) {
        return ControlResponses.noContent(sessionService.logout(sessionId, actorResolver.clientOf(http)));
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<?> revoke(@PathVariable String sessionId, @RequestBody ReasonRequest request,
                                    HttpServletRequest http) {
        var admin = actorResolver.require(http);
        var result = sessionService.revoke(sessionId, admin, request.getReason(), actorResolver.clientOf(http));
        return ControlResponses.ok(result, userId -> Map.of("revokedUserId", userId));
    }
}
