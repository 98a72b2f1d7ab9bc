/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.controller;

import com.qdocs.control.identity.IdentityProvider;
import com.qdocs.control.model.Actor;
import com.qdocs.control.model.ClientInfo;
import com.qdocs.control.service.SessionService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

/**
 * Turns the {@value #SESSION_HEADER} header into the calling {@link Actor}.
 */
@Component
@RequiredArgsConstructor
public class ActorResolver {

    public static final String SESSION_HEADER = "X-Session-Id";

    private final SessionService sessionService;
    private final IdentityProvider identityProvider;

    /**
     * @throws UnauthenticatedException if the session is missing or no longer valid
     */
    public Actor require(HttpServletRequest request) {
        var validation = sessionService.validate(request.getHeader(SESSION_HEADER));
        if (!validation.valid()) {
            throw new UnauthenticatedException(validation.reason());
        }
        return identityProvider.actorFor(validation.userId());
    }

    public ClientInfo clientOf(HttpServletRequest request) {
        return new ClientInfo(request.getRemoteAddr(), request.getHeader(HttpHeaders.USER_AGENT));
    }
}
