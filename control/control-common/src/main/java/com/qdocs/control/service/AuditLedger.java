/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.service;

import com.qdocs.control.config.AuditConfig;
import com.qdocs.control.entity.AuditAction;
import com.qdocs.control.entity.AuditChainHead;
import com.qdocs.control.entity.AuditLogEntry;
import com.qdocs.control.entity.AuditTargetType;
import com.qdocs.control.model.AuditEvent;
import com.qdocs.control.model.AuditPage;
import com.qdocs.control.model.AuditQuery;
import com.qdocs.control.model.AuditVerificationResult;
import com.qdocs.control.model.AuditVerificationResult.BrokenLink;
import com.qdocs.control.model.ClientInfo;
import com.qdocs.control.repository.AuditChainHeadRepository;
import com.qdocs.control.repository.AuditLogEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;

/**
 * Append-only, hash-chained record of every state change.
 *
 * <p>Appends join the caller's transaction, so an entry commits together with the
 * change it describes or not at all. The chain head row is locked for the append,
 * which makes sequence numbers gapless and timestamps non-decreasing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditLedger {

    public static final String SYSTEM_ACTOR = "system";

    private static final int VERIFY_BATCH = 500;

    private final AuditLogEntryRepository entryRepository;
    private final AuditChainHeadRepository headRepository;
    private final AuditChainHasher hasher;
    private final AuditConfig auditConfig;
    private final Clock clock;

    /**
     * Appends one entry. Must run inside an existing transaction.
     *
     * @throws AuditLedgerException if the entry cannot be written; the caller's transaction must roll back
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public AuditLogEntry append(AuditEvent event) {
        var head = headRepository.lockById(AuditChainHead.SINGLETON_ID)
                .orElseGet(this::createHead);

        var occurredAt = nextTimestamp(head);
        var client = event.client() != null ? event.client() : ClientInfo.unknown();

        var unsigned = AuditLogEntry.builder()
                .sequenceNumber(head.getLastSequence() + 1)
                .occurredAt(occurredAt)
                .actorId(event.actorId() != null ? event.actorId() : SYSTEM_ACTOR)
                .action(event.action())
                .targetType(event.targetType())
                .targetId(event.targetId())
                .fromState(event.fromState())
                .toState(event.toState())
                .comment(event.comment())
                .details(hasher.canonicalDetails(event.details()))
                .clientAddress(client.address())
                .userAgent(client.userAgent())
                .previousHash(head.getLastHash());
        var entry = unsigned.hash(hasher.computeHash(unsigned.build())).build();

        try {
            entry = entryRepository.save(entry);
        } catch (DataAccessException e) {
            throw new AuditLedgerException("Failed to append audit entry " + entry.getSequenceNumber()
                    + " (" + entry.getAction() + ")", e);
        }

        head.setLastSequence(entry.getSequenceNumber());
        head.setLastHash(entry.getHash());
        head.setLastOccurredAt(occurredAt);

        log.debug("Audit #{} {} {}:{} by {}", entry.getSequenceNumber(), entry.getAction(),
                entry.getTargetType(), entry.getTargetId(), entry.getActorId());
        return entry;
    }

    /**
     * Creates the chain head and its genesis entry if the ledger is still empty.
     */
    @Transactional
    public boolean initializeChain() {
        if (headRepository.existsById(AuditChainHead.SINGLETON_ID)) {
            return false;
        }
        headRepository.lockById(AuditChainHead.SINGLETON_ID).orElseGet(this::createHead);
        return true;
    }

    @Transactional(readOnly = true)
    public AuditPage query(AuditQuery query) {
        int limit = auditConfig.normalizePageSize(query.limit());
        var rows = entryRepository.search(
                query.cursor(),
                query.actorId(),
                query.action(),
                query.targetType(),
                query.targetId(),
                query.from(),
                query.to(),
                PageRequest.of(0, limit + 1));

        boolean hasMore = rows.size() > limit;
        var entries = hasMore ? List.copyOf(rows.subList(0, limit)) : List.copyOf(rows);
        long nextCursor = entries.isEmpty() ? query.cursor() : entries.get(entries.size() - 1).getSequenceNumber();
        return new AuditPage(entries, nextCursor, hasMore);
    }

    /**
     * Every entry about one target in ledger order; for a version this is its full history.
     */
    @Transactional(readOnly = true)
    public List<AuditLogEntry> history(AuditTargetType targetType, String targetId) {
        return entryRepository.findByTargetTypeAndTargetIdOrderBySequenceNumberAsc(targetType, targetId);
    }

    @Transactional(readOnly = true)
    public long lastSequence() {
        return headRepository.findById(AuditChainHead.SINGLETON_ID)
                .map(AuditChainHead::getLastSequence)
                .orElse(0L);
    }

    /**
     * Recomputes the whole chain from genesis and compares it with what is stored.
     */
    @Transactional(readOnly = true)
    public AuditVerificationResult verifyChain() {
        var head = headRepository.findById(AuditChainHead.SINGLETON_ID);
        if (head.isEmpty()) {
            return AuditVerificationResult.empty();
        }

        String expectedPrevious = hasher.computeGenesisHash();
        long expectedSequence = 1;
        long checked = 0;

        while (true) {
            var batch = entryRepository.search(expectedSequence - 1, null, null, null, null, null, null,
                    PageRequest.of(0, VERIFY_BATCH));
            if (batch.isEmpty()) {
                break;
            }
            for (var entry : batch) {
                if (entry.getSequenceNumber() != expectedSequence) {
                    return broken(checked, entry.getSequenceNumber(), "sequence gap",
                            String.valueOf(expectedSequence), String.valueOf(entry.getSequenceNumber()));
                }
                if (!expectedPrevious.equals(entry.getPreviousHash())) {
                    return broken(checked, entry.getSequenceNumber(), "previous hash mismatch",
                            expectedPrevious, entry.getPreviousHash());
                }
                var recomputed = hasher.computeHash(entry);
                if (!recomputed.equals(entry.getHash())) {
                    return broken(checked, entry.getSequenceNumber(), "hash mismatch", recomputed, entry.getHash());
                }
                expectedPrevious = entry.getHash();
                expectedSequence++;
                checked++;
            }
        }

        var tail = head.get();
        if (tail.getLastSequence() != checked || !tail.getLastHash().equals(expectedPrevious)) {
            return broken(checked, tail.getLastSequence(), "chain head does not match last entry",
                    expectedPrevious, tail.getLastHash());
        }
        return checked == 0 ? AuditVerificationResult.empty() : AuditVerificationResult.valid(checked);
    }

    private AuditVerificationResult broken(long checked, long sequence, String problem, String expected, String actual) {
        log.warn("Audit chain broken at #{}: {} (expected {}, found {})", sequence, problem, expected, actual);
        return AuditVerificationResult.broken(checked, new BrokenLink(sequence, problem, expected, actual));
    }

    private AuditChainHead createHead() {
        var genesis = hasher.computeGenesisHash();
        var head = headRepository.saveAndFlush(AuditChainHead.builder()
                .id(AuditChainHead.SINGLETON_ID)
                .lastSequence(0)
                .lastHash(genesis)
                .build());
        log.info("Audit chain initialized with genesis hash {}", genesis);

        var locked = headRepository.lockById(AuditChainHead.SINGLETON_ID).orElse(head);
        appendGenesis(locked);
        return locked;
    }

    private void appendGenesis(AuditChainHead head) {
        var now = nextTimestamp(head);
        var unsigned = AuditLogEntry.builder()
                .sequenceNumber(1)
                .occurredAt(now)
                .actorId(SYSTEM_ACTOR)
                .action(AuditAction.CHAIN_GENESIS)
                .targetType(AuditTargetType.AUDIT_CHAIN)
                .details(hasher.canonicalDetails(Map.of("algorithm", auditConfig.getAlgorithm())))
                .previousHash(head.getLastHash());
        var entry = entryRepository.save(unsigned.hash(hasher.computeHash(unsigned.build())).build());
        head.setLastSequence(1);
        head.setLastHash(entry.getHash());
        head.setLastOccurredAt(now);
    }

    /**
     * Server time at millisecond precision, never earlier than the previous entry.
     */
    private Instant nextTimestamp(AuditChainHead head) {
        var now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        return head.getLastOccurredAt() != null && head.getLastOccurredAt().isAfter(now) ? head.getLastOccurredAt() : now;
    }
}
