/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.qdocs.control.service;

import com.qdocs.control.config.SessionConfig;
import com.qdocs.control.entity.AuditAction;
import com.qdocs.control.entity.AuditTargetType;
import com.qdocs.control.entity.ClaimEndReason;
import com.qdocs.control.entity.UserSession;
import com.qdocs.control.identity.IdentityProvider;
import com.qdocs.control.model.Actor;
import com.qdocs.control.model.AuditEvent;
import com.qdocs.control.model.ClientInfo;
import com.qdocs.control.model.ControlError;
import com.qdocs.control.model.ControlResult;
import com.qdocs.control.model.InputLimits;
import com.qdocs.control.model.FailureReason;
import com.qdocs.control.repository.UserSessionRepository;
import com.qdocs.control.service.ExclusiveClaims.ContentionPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Session guard: at most one live login session per user.
 *
 * <p>Sessions are exclusive claims keyed by user id. The session id is the claim token
 * and is never written to the audit ledger; session events name the user instead.
 */
@Slf4j
@Service
public class SessionService {

    static final String KEY_PREFIX = "user";

    private final ExclusiveClaims<String, UserSession> sessions;
    private final IdentityProvider identityProvider;
    private final AuditLedger auditLedger;
    private final ControlTransactions transactions;
    private final SessionConfig sessionConfig;
    private final Clock clock;

    public SessionService(UserSessionRepository sessionRepository,
                          ClaimTokenGenerator tokenGenerator,
                          IdentityProvider identityProvider,
                          AuditLedger auditLedger,
                          ControlTransactions transactions,
                          SessionConfig sessionConfig,
                          Clock clock) {
        this.sessions = new ExclusiveClaims<>(KEY_PREFIX, sessionRepository, UserSession::new, tokenGenerator, clock);
        this.identityProvider = identityProvider;
        this.auditLedger = auditLedger;
        this.transactions = transactions;
        this.sessionConfig = sessionConfig;
        this.clock = clock;
    }

    /**
     * Opens a session for a user.
     *
     * @param force end any live session of the same user and take over
     * @return the new session, INVALID_CREDENTIALS, or SESSION_CONFLICT with the existing session's creation time
     */
    public ControlResult<UserSession> login(String userId, String credential, boolean force, ClientInfo client) {
        log.debug("Login request: userId={}, force={}", userId, force);
        if (userId == null || userId.isBlank()) {
            return ControlResult.failure(ControlError.invalidCredentials());
        }
        if (InputLimits.exceeds(userId, InputLimits.USER_ID)) {
            return ControlResult.failure(ControlError.tooLong("User id", InputLimits.USER_ID));
        }

        if (!identityProvider.verifyCredential(userId, credential)) {
            // The failed attempt is recorded even though the login itself is refused.
            transactions.inTransaction(() -> auditLedger.append(sessionEvent(AuditAction.LOGIN_FAILED, userId, client)
                    .build()));
            log.warn("Login failed for {} from {}", userId, client.address());
            return ControlResult.failure(ControlError.invalidCredentials());
        }

        var policy = force ? ContentionPolicy.TAKE_OVER : ContentionPolicy.REJECT;
        return transactions.write(() -> {
            var acquisition = sessions.acquire(userId, userId, sessionConfig.getIdleTimeout(), policy, session -> {
                session.setClientAddress(client.address());
                session.setUserAgent(client.userAgent());
            });

            var session = acquisition.claim();
            if (!acquisition.isGranted()) {
                log.info("Login for {} refused: session from {} still active", userId, session.getAcquiredAt());
                return ControlResult.failure(ControlError.sessionConflict(userId, session.getAcquiredAt()));
            }

            acquisition.displaced().ifPresent(previous -> recordDisplaced(previous, client));
            auditLedger.append(sessionEvent(AuditAction.LOGIN, userId, client)
                    .details(sessionDetails(session, Map.of("force", force)))
                    .build());
            log.info("User {} logged in; session expires {}", userId, session.getExpiresAt());
            return ControlResult.success(session);
        }, () -> sessions.peekCurrent(userId)
                .map(existing -> ControlResult.<UserSession>failure(ControlError.sessionConflict(userId, existing.getAcquiredAt()))));
    }

    /**
     * Checks a session id. A valid session slides its expiry forward.
     */
    public SessionValidation validate(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return SessionValidation.invalid(InvalidReason.UNKNOWN);
        }
        return transactions.idempotentWrite(() -> {
            var session = sessions.lockByToken(sessionId).orElse(null);
            if (session == null) {
                return SessionValidation.invalid(InvalidReason.UNKNOWN);
            }
            if (session.isReleased()) {
                return SessionValidation.invalid(InvalidReason.of(session.getEndReason()));
            }
            if (session.isExpiredAt(clock.instant())) {
                return SessionValidation.invalid(InvalidReason.EXPIRED);
            }
            sessions.renew(session);
            log.debug("Session of {} validated; expires {}", session.getUserId(), session.getExpiresAt());
            return SessionValidation.valid(session.getUserId(), session.getExpiresAt());
        });
    }

    /**
     * Ends a session. Unknown and already ended sessions succeed without effect.
     */
    public ControlResult<Void> logout(String sessionId, ClientInfo client) {
        return transactions.write(() -> {
            var session = sessionId == null ? null : sessions.lockByToken(sessionId).orElse(null);
            if (session == null || session.isReleased()) {
                log.debug("Logout of unknown or ended session ignored");
                return ControlResult.success(null);
            }
            if (session.isExpiredAt(clock.instant())) {
                sessions.end(session, ClaimEndReason.EXPIRED, AuditLedger.SYSTEM_ACTOR);
                recordExpiry(session, client);
                return ControlResult.success(null);
            }
            sessions.end(session, ClaimEndReason.LOGGED_OUT, session.getUserId());
            auditLedger.append(sessionEvent(AuditAction.LOGOUT, session.getUserId(), client)
                    .details(sessionDetails(session, Map.of()))
                    .build());
            log.info("User {} logged out", session.getUserId());
            return ControlResult.success(null);
        });
    }

    /**
     * Administrative termination of a live session.
     *
     * @return the user whose session was revoked
     */
    public ControlResult<String> revoke(String sessionId, Actor admin, String reason, ClientInfo client) {
        if (!admin.isAdmin()) {
            return ControlResult.failure(ControlError.capabilityMissing(admin.id(), "revoke sessions"));
        }
        if (reason == null || reason.isBlank()) {
            return ControlResult.failure(ControlError.invalidArgument("A reason is required to revoke a session"));
        }
        if (InputLimits.exceeds(reason, InputLimits.COMMENT)) {
            return ControlResult.failure(ControlError.tooLong("Reason", InputLimits.COMMENT));
        }
        return transactions.write(() -> {
            var now = clock.instant();
            var session = sessionId == null ? null : sessions.lockByToken(sessionId)
                    .filter(current -> current.isLiveAt(now))
                    .orElse(null);
            if (session == null) {
                return ControlResult.failure(FailureReason.NOT_FOUND, "No active session for the given id");
            }
            sessions.end(session, ClaimEndReason.REVOKED, admin.id());
            auditLedger.append(sessionEvent(AuditAction.SESSION_REVOKED, admin.id(), session.getUserId(), client)
                    .comment(reason)
                    .details(sessionDetails(session, Map.of()))
                    .build());
            log.warn("Session of {} revoked by {}: {}", session.getUserId(), admin.id(), reason);
            return ControlResult.success(session.getUserId());
        });
    }

    /**
     * Ids of sessions past their idle expiry that the sweeper has not closed yet.
     */
    public List<Long> findExpiredSessionIds(int limit) {
        return transactions.read(() -> sessions.findExpiredIds(limit));
    }

    /**
     * Closes one expired session in its own transaction, if it is still expired and open.
     */
    public boolean reclaimExpired(Long sessionRecordId) {
        return transactions.inTransaction(() -> sessions.reclaimIfExpired(sessionRecordId)
                .map(session -> {
                    recordExpiry(session, ClientInfo.unknown());
                    log.info("Closed expired session of {}", session.getUserId());
                    return true;
                })
                .orElse(false));
    }

    private void recordDisplaced(UserSession previous, ClientInfo client) {
        if (previous.getEndReason() == ClaimEndReason.SUPERSEDED) {
            auditLedger.append(sessionEvent(AuditAction.SESSION_TAKEOVER, previous.getUserId(), client)
                    .details(sessionDetails(previous, Map.of("previousCreatedAt", previous.getCreatedAt().toString())))
                    .build());
            log.warn("User {} took over the session created {}", previous.getUserId(), previous.getCreatedAt());
        } else {
            recordExpiry(previous, client);
        }
    }

    private void recordExpiry(UserSession session, ClientInfo client) {
        auditLedger.append(sessionEvent(AuditAction.SESSION_EXPIRED, AuditLedger.SYSTEM_ACTOR, session.getUserId(), client)
                .details(sessionDetails(session, Map.of()))
                .build());
    }

    private static AuditEvent.AuditEventBuilder sessionEvent(AuditAction action, String userId, ClientInfo client) {
        return sessionEvent(action, userId, userId, client);
    }

    private static AuditEvent.AuditEventBuilder sessionEvent(AuditAction action, String actorId, String userId,
                                                             ClientInfo client) {
        return AuditEvent.builder()
                .actorId(actorId)
                .action(action)
                .targetType(AuditTargetType.SESSION)
                .targetId(userId)
                .client(client);
    }

    private static Map<String, Object> sessionDetails(UserSession session, Map<String, ?> extra) {
        var details = new LinkedHashMap<String, Object>();
        details.put("sessionRecordId", session.getId());
        details.put("expiresAt", session.getExpiresAt().toString());
        if (session.getEndReason() != null) {
            details.put("endReason", session.getEndReason().name());
        }
        details.putAll(extra);
        return details;
    }

    /**
     * Why a session id no longer authenticates.
     */
    public enum InvalidReason {
        UNKNOWN,
        EXPIRED,
        SUPERSEDED,
        REVOKED,
        LOGGED_OUT;

        static InvalidReason of(ClaimEndReason endReason) {
            if (endReason == null) {
                return UNKNOWN;
            }
            return switch (endReason) {
                case EXPIRED -> EXPIRED;
                case SUPERSEDED -> SUPERSEDED;
                case REVOKED -> REVOKED;
                case LOGGED_OUT -> LOGGED_OUT;
                default -> UNKNOWN;
            };
        }
    }

    /**
     * Outcome of a session check. {@code reason} is null when valid; user and expiry are null when invalid.
     */
    public record SessionValidation(boolean valid, InvalidReason reason, String userId, Instant expiresAt) {

        static SessionValidation valid(String userId, Instant expiresAt) {
            return new SessionValidation(true, null, userId, expiresAt);
        }

        static SessionValidation invalid(InvalidReason reason) {
            return new SessionValidation(false, reason, null, null);
        }
    }
}
