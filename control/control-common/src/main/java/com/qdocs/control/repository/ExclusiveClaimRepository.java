/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.repository;

import com.qdocs.control.entity.ExclusiveClaim;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.NoRepositoryBean;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Storage operations shared by every kind of exclusive claim.
 */
@NoRepositoryBean
public interface ExclusiveClaimRepository<C extends ExclusiveClaim> extends JpaRepository<C, Long> {

    /**
     * The unreleased claim occupying a key, live or expired.
     */
    Optional<C> findByLiveKey(String liveKey);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select c from #{#entityName} c where c.liveKey = :liveKey")
    Optional<C> lockByLiveKey(@Param("liveKey") String liveKey);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select c from #{#entityName} c where c.token = :token")
    Optional<C> lockByToken(@Param("token") String token);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select c from #{#entityName} c where c.id = :id")
    Optional<C> lockById(@Param("id") Long id);

    /**
     * Ids of unreleased claims whose expiry has passed, earliest expiry first.
     */
    @Query("select c.id from #{#entityName} c where c.releasedAt is null and c.expiresAt <= :now order by c.expiresAt, c.id")
    List<Long> findExpiredIds(@Param("now") Instant now, Pageable page);
}
