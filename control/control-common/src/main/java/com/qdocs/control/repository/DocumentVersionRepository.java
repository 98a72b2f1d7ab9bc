/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.repository;

import com.qdocs.control.entity.DocumentVersion;
import com.qdocs.control.entity.VersionStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface DocumentVersionRepository extends JpaRepository<DocumentVersion, Long> {

    /**
     * Loads the version holding a row lock until the transaction ends.
     * Every lock, content and status mutation on a version goes through here first.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select v from DocumentVersion v where v.id = :id")
    Optional<DocumentVersion> lockById(@Param("id") Long id);

    /**
     * Owning document of a version, without loading the version into the persistence context.
     */
    @Query("select v.documentId from DocumentVersion v where v.id = :id")
    Optional<Long> findDocumentIdById(@Param("id") Long id);

    /**
     * All versions of a document, oldest first.
     */
    List<DocumentVersion> findByDocumentIdOrderByVersionNumberAsc(Long documentId);

    /**
     * Versions of a document currently in one of the given states.
     */
    List<DocumentVersion> findByDocumentIdAndStatusIn(Long documentId, Collection<VersionStatus> statuses);

    List<DocumentVersion> findByDocumentIdAndStatus(Long documentId, VersionStatus status);

    /**
     * Highest version number used so far, or 0 for a document with no versions.
     */
    @Query("select coalesce(max(v.versionNumber), 0) from DocumentVersion v where v.documentId = :documentId")
    int findMaxVersionNumber(@Param("documentId") Long documentId);
}
