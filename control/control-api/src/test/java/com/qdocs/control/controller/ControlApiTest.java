/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jayway.jsonpath.JsonPath;
import com.qdocs.control.ControlIntegrationTest;
import com.qdocs.control.TestIdentityProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ControlApiTest extends ControlIntegrationTest {

    private static final String SESSION = ActorResolver.SESSION_HEADER;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private String json(Object body) throws Exception {
        return objectMapper.writeValueAsString(body);
    }

    private String login(String userId) throws Exception {
        var response = mockMvc.perform(post("/api/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("userId", userId, "credential", TestIdentityProvider.SECRET))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.userId").value(userId))
                .andReturn().getResponse().getContentAsString();
        return JsonPath.read(response, "$.sessionId");
    }

    private long createDocument(String session) throws Exception {
        var response = mockMvc.perform(post("/api/documents")
                        .header(SESSION, session)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("documentNumber", unique("sop"), "title", "Line clearance",
                                "department", "QA", "content", "v1 text"))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.versionNumber").value(1))
                .andExpect(jsonPath("$.status").value("DRAFT"))
                .andReturn().getResponse().getContentAsString();
        return ((Number) JsonPath.read(response, "$.id")).longValue();
    }

    @Test
    @DisplayName("Should require a valid session")
    void shouldRequireSession() throws Exception {
        mockMvc.perform(get("/api/audit"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.reason").value("SESSION_UNKNOWN"));

        mockMvc.perform(get("/api/sessions/current").header(SESSION, "not-a-session"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.valid").value(false));
    }

    @Test
    @DisplayName("Should answer 401 for wrong credentials and 409 for a second login")
    void shouldMapLoginFailures() throws Exception {
        var userId = unique("author");
        mockMvc.perform(post("/api/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("userId", userId, "credential", "nope"))))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.reason").value("INVALID_CREDENTIALS"));

        login(userId);
        mockMvc.perform(post("/api/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("userId", userId, "credential", TestIdentityProvider.SECRET))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.reason").value("SESSION_CONFLICT"))
                .andExpect(jsonPath("$.heldSince").exists());
    }

    @Test
    @DisplayName("Should map lock, save and transition outcomes onto HTTP statuses")
    void shouldMapEditingOutcomes() throws Exception {
        var alice = unique("author");
        var bob = unique("author");
        var aliceSession = login(alice);
        var bobSession = login(bob);
        long versionId = createDocument(aliceSession);

        var lockResponse = mockMvc.perform(post("/api/versions/{id}/lock", versionId)
                        .header(SESSION, aliceSession)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("durationMinutes", 15))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.holderId").value(alice))
                .andReturn().getResponse().getContentAsString();
        String token = JsonPath.read(lockResponse, "$.token");

        mockMvc.perform(post("/api/versions/{id}/lock", versionId).header(SESSION, bobSession))
                .andExpect(status().isLocked())
                .andExpect(jsonPath("$.reason").value("LOCK_HELD"))
                .andExpect(jsonPath("$.holderId").value(alice));

        mockMvc.perform(get("/api/versions/{id}/lock", versionId).header(SESSION, bobSession))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.held").value(true))
                .andExpect(jsonPath("$.holderId").value(alice));

        var versionJson = mockMvc.perform(get("/api/versions/{id}", versionId).header(SESSION, aliceSession))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content").value("v1 text"))
                .andReturn().getResponse().getContentAsString();
        String baseHash = JsonPath.read(versionJson, "$.contentHash");

        mockMvc.perform(put("/api/versions/{id}/content", versionId)
                        .header(SESSION, aliceSession)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("lockToken", token, "baseHash", baseHash, "content", "v1 edited"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.contentHash").exists());

        mockMvc.perform(put("/api/versions/{id}/content", versionId)
                        .header(SESSION, aliceSession)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("lockToken", token, "baseHash", baseHash, "content", "lost update"))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.reason").value("STALE_CONTENT"))
                .andExpect(jsonPath("$.currentHash").exists());

        mockMvc.perform(put("/api/versions/{id}/content", versionId)
                        .header(SESSION, bobSession)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("lockToken", token, "baseHash", baseHash, "content", "x"))))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.reason").value("NOT_LOCK_OWNER"));

        mockMvc.perform(post("/api/versions/{id}/transitions", versionId)
                        .header(SESSION, aliceSession)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("action", "PUBLISH"))))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.reason").value("INVALID_TRANSITION"))
                .andExpect(jsonPath("$.currentStatus").value("DRAFT"));

        mockMvc.perform(post("/api/locks/{token}/heartbeat", token).header(SESSION, bobSession))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.reason").value("NOT_LOCK_OWNER"));

        mockMvc.perform(post("/api/locks/{token}/heartbeat", token).header(SESSION, aliceSession))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.expiresAt").exists());

        mockMvc.perform(delete("/api/locks/{token}", token).header(SESSION, aliceSession))
                .andExpect(status().isNoContent());

        mockMvc.perform(post("/api/locks/{token}/heartbeat", token).header(SESSION, aliceSession))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.reason").value("LOCK_NOT_FOUND"));

        mockMvc.perform(post("/api/versions/{id}/transitions", versionId)
                        .header(SESSION, aliceSession)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("action", "SUBMIT_FOR_REVIEW"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.to").value("UNDER_REVIEW"));

        mockMvc.perform(get("/api/versions/{id}/history", versionId).header(SESSION, bobSession))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(5)))
                .andExpect(jsonPath("$[0].action").value("VERSION_CREATED"))
                .andExpect(jsonPath("$[4].action").value("VERSION_SUBMITTED"));
    }

    @Test
    @DisplayName("Should expose audit queries and chain verification")
    void shouldQueryAudit() throws Exception {
        var userId = unique("author");
        var session = login(userId);
        createDocument(session);

        mockMvc.perform(get("/api/audit").header(SESSION, session)
                        .param("actorId", userId)
                        .param("limit", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.entries", hasSize(1)))
                .andExpect(jsonPath("$.entries[0].action").value("LOGIN"))
                .andExpect(jsonPath("$.hasMore").value(true));

        mockMvc.perform(get("/api/audit/verification").header(SESSION, session))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("VALID"));
    }

    @Test
    @DisplayName("Should let admins revoke sessions and reject everyone else")
    void shouldRevokeSessions() throws Exception {
        var targetSession = login(unique("author"));
        var adminSession = login(unique("admin"));

        mockMvc.perform(delete("/api/sessions/{id}", adminSession)
                        .header(SESSION, targetSession)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("reason", "testing"))))
                .andExpect(status().isForbidden());

        mockMvc.perform(delete("/api/sessions/{id}", targetSession)
                        .header(SESSION, adminSession)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("reason", "account locked"))))
                .andExpect(status().isOk());

        mockMvc.perform(get("/api/sessions/current").header(SESSION, targetSession))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.reason").value("REVOKED"));

        mockMvc.perform(delete("/api/sessions/current").header(SESSION, adminSession))
                .andExpect(status().isNoContent());
    }
}
