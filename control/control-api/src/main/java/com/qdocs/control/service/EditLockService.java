/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.service;

import com.qdocs.control.config.LockConfig;
import com.qdocs.control.entity.AuditAction;
import com.qdocs.control.entity.AuditTargetType;
import com.qdocs.control.entity.ClaimEndReason;
import com.qdocs.control.entity.DocumentVersion;
import com.qdocs.control.entity.EditLock;
import com.qdocs.control.model.Actor;
import com.qdocs.control.model.AuditEvent;
import com.qdocs.control.model.Capability;
import com.qdocs.control.model.ClientInfo;
import com.qdocs.control.model.ControlError;
import com.qdocs.control.model.ControlResult;
import com.qdocs.control.model.InputLimits;
import com.qdocs.control.repository.DocumentVersionRepository;
import com.qdocs.control.repository.EditLockRepository;
import com.qdocs.control.service.ExclusiveClaims.ContentionPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lock manager: serializes editing access to a document version.
 *
 * <p>The lock token, not the version id, is the credential for heartbeat and release.
 * Every mutation first row-locks the version (acquire, force release) or the lock
 * itself (heartbeat, release), so concurrent calls on one version run one at a time.
 */
@Slf4j
@Service
public class EditLockService {

    static final String KEY_PREFIX = "version";

    private final DocumentVersionRepository versionRepository;
    private final ExclusiveClaims<Long, EditLock> locks;
    private final AuditLedger auditLedger;
    private final ControlTransactions transactions;
    private final LockConfig lockConfig;
    private final Clock clock;

    public EditLockService(DocumentVersionRepository versionRepository,
                           EditLockRepository lockRepository,
                           ClaimTokenGenerator tokenGenerator,
                           AuditLedger auditLedger,
                           ControlTransactions transactions,
                           LockConfig lockConfig,
                           Clock clock) {
        this.versionRepository = versionRepository;
        this.locks = new ExclusiveClaims<>(KEY_PREFIX, lockRepository, EditLock::new, tokenGenerator, clock);
        this.auditLedger = auditLedger;
        this.transactions = transactions;
        this.lockConfig = lockConfig;
        this.clock = clock;
    }

    /**
     * Acquires the edit lock on a Draft version, or renews it if the caller already holds it.
     *
     * @param versionId    the version to edit
     * @param actor        the requesting user
     * @param durationHint requested lease; clamped to the configured bounds, null for the default
     * @param client       client metadata recorded with the lock
     * @param clientSessionId optional client-side session label
     * @return the grant, or LOCK_HELD naming the current holder
     */
    public ControlResult<LockGrant> acquire(long versionId, Actor actor, Duration durationHint,
                                            ClientInfo client, String clientSessionId) {
        log.debug("Acquire lock request: versionId={}, userId={}, duration={}", versionId, actor.id(), durationHint);
        if (InputLimits.exceeds(clientSessionId, InputLimits.CLIENT_SESSION_ID)) {
            return ControlResult.failure(ControlError.tooLong("Client session id", InputLimits.CLIENT_SESSION_ID));
        }
        var lease = lockConfig.normalizeDuration(durationHint);

        return transactions.write(() -> {
            var version = versionRepository.lockById(versionId).orElse(null);
            if (version == null) {
                return ControlResult.failure(ControlError.notFound("Version", versionId));
            }
            if (!version.getStatus().isEditable()) {
                return ControlResult.failure(ControlError.versionNotEditable(versionId, version.getStatus()));
            }
            if (!actor.can(Capability.AUTHOR)) {
                return ControlResult.failure(ControlError.capabilityMissing(actor.id(), "edit versions"));
            }

            var acquisition = locks.acquire(versionId, actor.id(), lease, ContentionPolicy.RENEW_SAME_HOLDER, lock -> {
                lock.setVersionId(versionId);
                lock.setClientAddress(client.address());
                lock.setUserAgent(client.userAgent());
                lock.setClientSessionId(clientSessionId);
            });

            var lock = acquisition.claim();
            switch (acquisition.outcome()) {
                case CONTENDED -> {
                    log.info("Lock on version {} refused for {}: held by {}", versionId, actor.id(), lock.getHolderId());
                    return ControlResult.failure(ControlError.lockHeld(lock.getHolderId(), lock.getAcquiredAt()));
                }
                case RENEWED -> {
                    return ControlResult.success(LockGrant.of(lock, true));
                }
                default -> {
                    acquisition.displaced().ifPresent(expired -> recordExpiry(expired, client));
                    auditLedger.append(lockEvent(AuditAction.LOCK_ACQUIRED, actor.id(), lock, client)
                            .details(lockDetails(lock, Map.of("leaseSeconds", lease.toSeconds())))
                            .build());
                    log.info("Lock acquired on version {} by {} until {}", versionId, actor.id(), lock.getExpiresAt());
                    return ControlResult.success(LockGrant.of(lock, false));
                }
            }
        });
    }

    /**
     * Extends a live lock from now by its lease. An expired lock is never revived.
     * Only the holder may heartbeat its lock.
     *
     * @return the new expiry, LOCK_NOT_FOUND, NOT_LOCK_OWNER or LOCK_EXPIRED
     */
    public ControlResult<Instant> heartbeat(String token, Actor actor) {
        return transactions.write(() -> {
            var lock = locks.lockByToken(token).orElse(null);
            if (lock == null) {
                return ControlResult.failure(ControlError.lockNotFound("unknown token"));
            }
            var now = clock.instant();
            if (lock.isReleased()) {
                return lock.getEndReason() == ClaimEndReason.EXPIRED
                        ? ControlResult.failure(ControlError.lockExpired(lock.getExpiresAt()))
                        : ControlResult.failure(ControlError.lockNotFound("lock was released"));
            }
            if (!lock.isHeldBy(actor.id())) {
                log.warn("Heartbeat on version {} by {} refused: held by {}",
                        lock.getVersionId(), actor.id(), lock.getHolderId());
                return ControlResult.failure(ControlError.notLockOwner(lock.getHolderId()));
            }
            if (lock.isExpiredAt(now)) {
                return ControlResult.failure(ControlError.lockExpired(lock.getExpiresAt()));
            }
            var expiresAt = locks.renew(lock).getExpiresAt();
            log.debug("Heartbeat on version {} by {}; expires {}", lock.getVersionId(), lock.getHolderId(), expiresAt);
            return ControlResult.success(expiresAt);
        });
    }

    /**
     * Releases a lock. Unknown and already released tokens succeed without effect.
     */
    public ControlResult<Void> release(String token, Actor actor, ClientInfo client) {
        return transactions.write(() -> {
            var lock = locks.lockByToken(token).orElse(null);
            if (lock == null || lock.isReleased()) {
                log.debug("Release of unknown or released lock by {} ignored", actor.id());
                return ControlResult.success(null);
            }
            if (!lock.isHeldBy(actor.id())) {
                return ControlResult.failure(ControlError.notLockOwner(lock.getHolderId()));
            }
            locks.end(lock, ClaimEndReason.RELEASED, actor.id());
            auditLedger.append(lockEvent(AuditAction.LOCK_RELEASED, actor.id(), lock, client)
                    .details(lockDetails(lock, Map.of("reason", ClaimEndReason.RELEASED.name())))
                    .build());
            log.info("Lock released on version {} by {}", lock.getVersionId(), actor.id());
            return ControlResult.success(null);
        });
    }

    /**
     * Read-only lock status for a version. Never extends anything.
     */
    public ControlResult<LockInfo> inspect(long versionId) {
        return transactions.read(() -> {
            if (!versionRepository.existsById(versionId)) {
                return ControlResult.failure(ControlError.notFound("Version", versionId));
            }
            var now = clock.instant();
            return ControlResult.success(locks.peekCurrent(versionId)
                    .filter(lock -> lock.isLiveAt(now))
                    .map(LockInfo::held)
                    .orElse(LockInfo.FREE));
        });
    }

    /**
     * Administrative removal of the live lock on a version. The displaced holder is always logged.
     */
    public ControlResult<String> forceRelease(long versionId, Actor admin, String reason, ClientInfo client) {
        if (!admin.isAdmin()) {
            return ControlResult.failure(ControlError.capabilityMissing(admin.id(), "force-release locks"));
        }
        if (reason == null || reason.isBlank()) {
            return ControlResult.failure(ControlError.invalidArgument("A reason is required to force-release a lock"));
        }
        if (InputLimits.exceeds(reason, InputLimits.COMMENT)) {
            return ControlResult.failure(ControlError.tooLong("Reason", InputLimits.COMMENT));
        }
        return transactions.write(() -> {
            if (versionRepository.lockById(versionId).isEmpty()) {
                return ControlResult.failure(ControlError.notFound("Version", versionId));
            }
            var now = clock.instant();
            var lock = locks.lockCurrent(versionId).filter(current -> current.isLiveAt(now)).orElse(null);
            if (lock == null) {
                return ControlResult.failure(ControlError.lockNotFound("no live lock on version " + versionId));
            }
            locks.end(lock, ClaimEndReason.FORCE_RELEASED, admin.id());
            auditLedger.append(lockEvent(AuditAction.LOCK_FORCE_RELEASED, admin.id(), lock, client)
                    .comment(reason)
                    .details(lockDetails(lock, Map.of("displacedHolder", lock.getHolderId())))
                    .build());
            log.warn("Lock on version {} held by {} force-released by {}: {}",
                    versionId, lock.getHolderId(), admin.id(), reason);
            return ControlResult.success(lock.getHolderId());
        });
    }

    /**
     * Ids of locks past expiry that the sweeper has not reclaimed yet.
     */
    public List<Long> findExpiredLockIds(int limit) {
        return transactions.read(() -> locks.findExpiredIds(limit));
    }

    /**
     * Reclaims one expired lock in its own transaction, if it is still expired and unreleased.
     */
    public boolean reclaimExpired(Long lockId) {
        return transactions.inTransaction(() -> locks.reclaimIfExpired(lockId)
                .map(lock -> {
                    recordExpiry(lock, ClientInfo.unknown());
                    log.info("Reclaimed expired lock on version {} held by {}", lock.getVersionId(), lock.getHolderId());
                    return true;
                })
                .orElse(false));
    }

    // Operations below join the caller's transaction; the caller holds the version row lock.

    /**
     * The unreleased lock on a version, row-locked.
     */
    Optional<EditLock> lockCurrent(long versionId) {
        return locks.lockCurrent(versionId);
    }

    /**
     * Checks that a token is a live lock on the version held by the user.
     */
    ControlResult<EditLock> requireHeldLock(DocumentVersion version, String token, String userId) {
        var lock = token == null ? null : locks.lockByToken(token).orElse(null);
        if (lock == null || !lock.getVersionId().equals(version.getId())) {
            return ControlResult.failure(ControlError.lockNotFound("no lock for this token on version " + version.getId()));
        }
        if (lock.isReleased() && lock.getEndReason() != ClaimEndReason.EXPIRED) {
            return ControlResult.failure(ControlError.lockNotFound("lock was released"));
        }
        if (lock.isReleased() || lock.isExpiredAt(clock.instant())) {
            return ControlResult.failure(ControlError.lockExpired(lock.getExpiresAt()));
        }
        if (!lock.isHeldBy(userId)) {
            return ControlResult.failure(ControlError.notLockOwner(lock.getHolderId()));
        }
        return ControlResult.success(lock);
    }

    /**
     * Ends the lock on a version as part of a workflow transition: the submitter's own live
     * lock is auto-released and a dead one is reclaimed. Each is logged.
     */
    void endForTransition(EditLock lock, Actor actor, ClientInfo client) {
        if (lock.isExpiredAt(clock.instant())) {
            locks.end(lock, ClaimEndReason.EXPIRED, AuditLedger.SYSTEM_ACTOR);
            recordExpiry(lock, client);
            return;
        }
        locks.end(lock, ClaimEndReason.AUTO_RELEASED, actor.id());
        auditLedger.append(lockEvent(AuditAction.LOCK_RELEASED, actor.id(), lock, client)
                .details(lockDetails(lock, Map.of("reason", ClaimEndReason.AUTO_RELEASED.name())))
                .build());
        log.info("Lock on version {} auto-released for {}", lock.getVersionId(), actor.id());
    }

    private void recordExpiry(EditLock lock, ClientInfo client) {
        auditLedger.append(lockEvent(AuditAction.LOCK_EXPIRED, AuditLedger.SYSTEM_ACTOR, lock, client)
                .details(lockDetails(lock, Map.of(
                        "holder", lock.getHolderId(),
                        "expiredAt", lock.getExpiresAt().toString())))
                .build());
    }

    private static AuditEvent.AuditEventBuilder lockEvent(AuditAction action, String actorId, EditLock lock,
                                                          ClientInfo client) {
        return AuditEvent.builder()
                .actorId(actorId)
                .action(action)
                .targetType(AuditTargetType.DOCUMENT_VERSION)
                .targetId(String.valueOf(lock.getVersionId()))
                .client(client);
    }

    private static Map<String, Object> lockDetails(EditLock lock, Map<String, ?> extra) {
        var details = new LinkedHashMap<String, Object>();
        details.put("lockId", lock.getId());
        details.put("expiresAt", lock.getExpiresAt().toString());
        details.putAll(extra);
        return details;
    }

    /**
     * A granted or renewed lock. The token is the only credential for heartbeat and release.
     */
    public record LockGrant(String token, long versionId, String holderId, Instant acquiredAt,
                            Instant expiresAt, boolean renewed) {
        static LockGrant of(EditLock lock, boolean renewed) {
            return new LockGrant(lock.getToken(), lock.getVersionId(), lock.getHolderId(),
                    lock.getAcquiredAt(), lock.getExpiresAt(), renewed);
        }
    }

    /**
     * Public view of a version's lock state. Holder fields are null when free.
     */
    public record LockInfo(boolean held, String holderId, Instant acquiredAt, Instant expiresAt) {
        static final LockInfo FREE = new LockInfo(false, null, null, null);

        static LockInfo held(EditLock lock) {
            return new LockInfo(true, lock.getHolderId(), lock.getAcquiredAt(), lock.getExpiresAt());
        }
    }
}
