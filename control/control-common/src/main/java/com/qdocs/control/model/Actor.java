/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.model;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * The authenticated user behind a request, with the capabilities the identity provider granted.
 */
public record Actor(String id, Set<Capability> capabilities) {

    public Actor {
        Objects.requireNonNull(id, "id must not be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        capabilities = capabilities == null || capabilities.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(capabilities));
    }

    public static Actor of(String id, Capability... capabilities) {
        return new Actor(id, capabilities.length == 0 ? Set.of() : EnumSet.of(capabilities[0], capabilities));
    }

    /**
     * Checks membership; ADMIN satisfies any capability.
     */
    public boolean can(Capability capability) {
        return capabilities.contains(Capability.ADMIN) || capabilities.contains(capability);
    }

    public boolean isAdmin() {
        return capabilities.contains(Capability.ADMIN);
    }
}
