/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.service;

import com.qdocs.control.entity.ClaimEndReason;
import com.qdocs.control.entity.ExclusiveClaim;
import com.qdocs.control.repository.ExclusiveClaimRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Generic "key to exclusive holder with token and expiry" store. Edit locks are claims
 * keyed by version id; sessions are claims keyed by user id.
 *
 * <p>All methods must run inside a transaction. Mutating methods take a row lock on
 * the claim they touch. The unique live key rejects a second unreleased claim on a key
 * even when there was no row to lock, and that surfaces to the caller as a
 * {@link org.springframework.dao.DataIntegrityViolationException}.
 *
 * @param <K> key type
 * @param <C> claim entity type
 */
@Slf4j
public class ExclusiveClaims<K, C extends ExclusiveClaim> {

    /**
     * What to do when a live claim already occupies the key.
     */
    public enum ContentionPolicy {
        /** Refuse any second claim, even by the same holder */
        REJECT,
        /** Same holder renews the existing claim; others are refused */
        RENEW_SAME_HOLDER,
        /** End the existing claim as superseded and grant a new one */
        TAKE_OVER
    }

    public enum Outcome {
        GRANTED,
        RENEWED,
        CONTENDED
    }

    /**
     * Result of an acquire. {@code claim} is the new or renewed claim, or the blocking
     * one when contended. {@code displaced} is a previous claim this call ended (expired
     * or taken over), if any.
     */
    public record Acquisition<C>(Outcome outcome, C claim, Optional<C> displaced) {
        public boolean isGranted() {
            return outcome != Outcome.CONTENDED;
        }
    }

    private final String keyPrefix;
    private final ExclusiveClaimRepository<C> repository;
    private final Supplier<C> factory;
    private final ClaimTokenGenerator tokenGenerator;
    private final Clock clock;

    public ExclusiveClaims(String keyPrefix, ExclusiveClaimRepository<C> repository, Supplier<C> factory,
                           ClaimTokenGenerator tokenGenerator, Clock clock) {
        this.keyPrefix = keyPrefix;
        this.repository = repository;
        this.factory = factory;
        this.tokenGenerator = tokenGenerator;
        this.clock = clock;
    }

    public String liveKey(K key) {
        return keyPrefix + ":" + key;
    }

    /**
     * Locks and returns the unreleased claim on a key, whether or not it has expired.
     */
    public Optional<C> lockCurrent(K key) {
        return repository.lockByLiveKey(liveKey(key));
    }

    /**
     * Read-only view of the unreleased claim on a key.
     */
    public Optional<C> peekCurrent(K key) {
        return repository.findByLiveKey(liveKey(key));
    }

    public Optional<C> lockByToken(String token) {
        return repository.lockByToken(token);
    }

    /**
     * Claims a key for a holder. An expired claim on the key is ended as EXPIRED and
     * reported as displaced. A live claim is handled according to the policy.
     *
     * @param initializer fills in entity-specific fields of a newly granted claim
     */
    public Acquisition<C> acquire(K key, String holderId, Duration lease, ContentionPolicy policy,
                                  Consumer<C> initializer) {
        var now = clock.instant();
        C displaced = null;

        var current = lockCurrent(key);
        if (current.isPresent()) {
            var existing = current.get();
            if (existing.isExpiredAt(now)) {
                existing.end(ClaimEndReason.EXPIRED, AuditLedger.SYSTEM_ACTOR, now);
            } else if (policy == ContentionPolicy.RENEW_SAME_HOLDER && existing.isHeldBy(holderId)) {
                // A renewal never shortens the lease.
                existing.setLeaseMillis(Math.max(existing.getLeaseMillis(), lease.toMillis()));
                existing.extend(now);
                log.debug("Claim {} renewed by {} until {}", liveKey(key), holderId, existing.getExpiresAt());
                return new Acquisition<>(Outcome.RENEWED, existing, Optional.empty());
            } else if (policy == ContentionPolicy.TAKE_OVER) {
                existing.end(ClaimEndReason.SUPERSEDED, holderId, now);
            } else {
                return new Acquisition<>(Outcome.CONTENDED, existing, Optional.empty());
            }
            // The key must be freed in the database before the replacement row is inserted.
            displaced = repository.saveAndFlush(existing);
        }

        C claim = factory.get();
        claim.begin(liveKey(key), tokenGenerator.nextToken(), holderId, lease, now);
        initializer.accept(claim);
        claim = repository.saveAndFlush(claim);
        log.debug("Claim {} granted to {} until {}", liveKey(key), holderId, claim.getExpiresAt());
        return new Acquisition<>(Outcome.GRANTED, claim, Optional.ofNullable(displaced));
    }

    /**
     * Extends a claim from now by its lease; the expiry never moves backwards.
     */
    public C renew(C claim) {
        claim.extend(clock.instant());
        return repository.save(claim);
    }

    public C end(C claim, ClaimEndReason reason, String endedBy) {
        claim.end(reason, endedBy, clock.instant());
        return repository.saveAndFlush(claim);
    }

    /**
     * Ids of unreleased claims past their expiry, oldest expiry first.
     */
    public List<Long> findExpiredIds(int limit) {
        return repository.findExpiredIds(clock.instant(), PageRequest.of(0, limit));
    }

    /**
     * Locks one claim and ends it as EXPIRED if it is still unreleased and past its
     * expiry at this moment. A heartbeat or release that committed first wins.
     */
    public Optional<C> reclaimIfExpired(Long id) {
        var claim = repository.lockById(id);
        if (claim.isEmpty()) {
            return Optional.empty();
        }
        var existing = claim.get();
        var now = clock.instant();
        if (existing.isReleased() || !existing.isExpiredAt(now)) {
            return Optional.empty();
        }
        existing.end(ClaimEndReason.EXPIRED, AuditLedger.SYSTEM_ACTOR, now);
        return Optional.of(repository.saveAndFlush(existing));
    }
}
