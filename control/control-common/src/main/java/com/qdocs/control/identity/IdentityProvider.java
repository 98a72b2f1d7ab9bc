/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.identity;

import com.qdocs.control.model.Actor;
import com.qdocs.control.model.Capability;

import java.util.Set;

/**
 * Identity and authorization collaborator. The control core only asks two questions:
 * does this credential belong to this user, and what may this user do.
 */
public interface IdentityProvider {

    /**
     * Checks a login credential or e-signature re-entry for a user.
     */
    boolean verifyCredential(String userId, String credential);

    /**
     * Capabilities granted to a user; empty for unknown users.
     */
    Set<Capability> capabilitiesOf(String userId);

    default Actor actorFor(String userId) {
        return new Actor(userId, capabilitiesOf(userId));
    }
}
