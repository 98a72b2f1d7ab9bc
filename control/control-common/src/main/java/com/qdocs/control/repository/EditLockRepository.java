/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.repository;

import com.qdocs.control.entity.EditLock;
import org.springframework.stereotype.Repository;

@Repository
public interface EditLockRepository extends ExclusiveClaimRepository<EditLock> {
}
