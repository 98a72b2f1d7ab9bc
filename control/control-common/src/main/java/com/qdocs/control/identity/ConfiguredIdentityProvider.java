/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.identity;

import com.qdocs.control.model.Capability;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.EnumSet;
import java.util.HexFormat;
import java.util.Set;

/**
 * Identity provider backed by {@code qdocs.identity.users}. Stands in for the
 * application's real user directory.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfiguredIdentityProvider implements IdentityProvider {

    private final IdentityConfig identityConfig;

    @Override
    public boolean verifyCredential(String userId, String credential) {
        if (userId == null || credential == null) {
            return false;
        }
        var user = identityConfig.getUsers().get(userId);
        if (user == null || user.getSecretSha256() == null) {
            log.debug("Credential check for unknown user {}", userId);
            return false;
        }
        byte[] expected = HexFormat.of().parseHex(user.getSecretSha256().toLowerCase());
        return MessageDigest.isEqual(expected, sha256(credential));
    }

    @Override
    public Set<Capability> capabilitiesOf(String userId) {
        var user = identityConfig.getUsers().get(userId);
        if (user == null || user.getCapabilities().isEmpty()) {
            return Set.of();
        }
        return EnumSet.copyOf(user.getCapabilities());
    }

    private static byte[] sha256(String value) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
