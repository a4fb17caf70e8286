package io.burnlock.handshake;

import io.burnlock.config.EngineSettings;
import io.burnlock.error.LifecycleException;
import io.burnlock.model.HandshakeSession;
import io.burnlock.model.HandshakeState;
import io.burnlock.observability.AuditLogger;
import io.burnlock.storage.PersistenceGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * X3DH handshake correlation. Sessions move PENDING → ACTIVE | FAILED | EXPIRED, and an ACTIVE
 * session may later expire. Only opaque ids and timestamps are stored; no key material passes
 * through here.
 *
 * <p>Every transition is a compare-and-set on the stored state, so two racing callers cannot
 * both win the same transition.
 */
public final class HandshakeTracker {
    private static final Logger LOG = LoggerFactory.getLogger(HandshakeTracker.class);
    private static final int MAX_REASON_LENGTH = 512;

    private final PersistenceGateway gateway;
    private final AuditLogger audit;
    private final Clock clock;
    private final EngineSettings settings;

    public HandshakeTracker(PersistenceGateway gateway, AuditLogger audit, Clock clock, EngineSettings settings) {
        this.gateway = gateway;
        this.audit = audit;
        this.clock = clock;
        this.settings = settings;
    }

    public HandshakeSession initiate(String sessionId, String initiatorUserId, String responderUserId) {
        requireText(sessionId, "sessionId");
        requireText(initiatorUserId, "initiatorUserId");
        requireText(responderUserId, "responderUserId");
        if (initiatorUserId.equals(responderUserId)) {
            throw LifecycleException.precondition("Cannot open a handshake with yourself");
        }
        long nowMs = clock.millis();
        HandshakeSession session = new HandshakeSession(
                sessionId,
                initiatorUserId,
                responderUserId,
                HandshakeState.PENDING,
                nowMs,
                nowMs,
                nowMs + settings.handshakePendingTtlMs(),
                0,
                null,
                null
        );
        PersistenceGateway.SessionInsertOutcome outcome = gateway.insertSession(session);
        switch (outcome) {
            case CREATED -> {
                auditTransition(session, "handshake.initiate", null, HandshakeState.PENDING, null);
                return session;
            }
            case LIVE_PAIR_EXISTS -> throw LifecycleException.conflict(
                    "A pending or active handshake already exists from " + initiatorUserId + " to " + responderUserId);
            case SESSION_ID_TAKEN -> throw LifecycleException.conflict("Session id already in use: " + sessionId);
            default -> throw new IllegalStateException("Unhandled insert outcome: " + outcome);
        }
    }

    public HandshakeSession complete(String sessionId) {
        HandshakeSession current = require(sessionId);
        long nowMs = clock.millis();
        requirePendingAndLive(current, nowMs, "complete");
        Long expiresAtMs = settings.handshakeActiveTtlMs() > 0L
                ? nowMs + settings.handshakeActiveTtlMs()
                : null;
        if (!gateway.tryTransition(sessionId, HandshakeState.PENDING, HandshakeState.ACTIVE, nowMs, null, expiresAtMs)) {
            throw transitionLost(sessionId, "complete");
        }
        HandshakeSession updated = require(sessionId);
        auditTransition(updated, "handshake.complete", HandshakeState.PENDING, HandshakeState.ACTIVE, null);
        return updated;
    }

    public HandshakeSession fail(String sessionId, String reason) {
        HandshakeSession current = require(sessionId);
        long nowMs = clock.millis();
        if (current.state() != HandshakeState.PENDING) {
            throw LifecycleException.conflict(
                    "Cannot fail handshake " + sessionId + " in state " + current.state());
        }
        String normalizedReason = normalizeReason(reason);
        if (!gateway.tryTransition(sessionId, HandshakeState.PENDING, HandshakeState.FAILED, nowMs,
                normalizedReason, current.expiresAtMs())) {
            throw transitionLost(sessionId, "fail");
        }
        HandshakeSession updated = require(sessionId);
        auditTransition(updated, "handshake.fail", HandshakeState.PENDING, HandshakeState.FAILED, normalizedReason);
        return updated;
    }

    /**
     * Records a client-side re-attempt of the same handshake. The state is left untouched.
     */
    public HandshakeSession retry(String sessionId) {
        HandshakeSession current = require(sessionId);
        long nowMs = clock.millis();
        requirePendingAndLive(current, nowMs, "retry");
        if (!gateway.recordRetry(sessionId, nowMs)) {
            throw transitionLost(sessionId, "retry");
        }
        HandshakeSession updated = require(sessionId);
        LOG.debug("Handshake {} retry #{}", sessionId, updated.retryCount());
        return updated;
    }

    /**
     * Expires a PENDING session, or an ACTIVE one whose {@code expiresAt} has passed.
     */
    public HandshakeSession expire(String sessionId) {
        HandshakeSession current = require(sessionId);
        long nowMs = clock.millis();
        if (!gateway.tryExpire(sessionId, nowMs)) {
            HandshakeSession latest = require(sessionId);
            if (latest.state() == HandshakeState.ACTIVE) {
                throw LifecycleException.conflict("Handshake " + sessionId + " is ACTIVE and not yet past expiresAt");
            }
            throw LifecycleException.conflict("Cannot expire handshake " + sessionId + " in state " + latest.state());
        }
        HandshakeSession updated = require(sessionId);
        auditTransition(updated, "handshake.expire", current.state(), HandshakeState.EXPIRED, null);
        return updated;
    }

    /**
     * Expires every PENDING or ACTIVE session whose {@code expiresAt} is in the past.
     *
     * @return ids that moved to EXPIRED on this pass
     */
    public List<String> sweepExpired() {
        long nowMs = clock.millis();
        List<String> expired = gateway.expireDueSessions(nowMs);
        if (!expired.isEmpty()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("expired_count", expired.size());
            details.put("session_ids", expired);
            audit.log(AuditLogger.AuditEvent.of(
                    "handshake.sweep",
                    "handshake-tracker",
                    "x3dh_sessions",
                    "expired",
                    details
            ));
            LOG.info("Handshake sweep expired {} session(s)", expired.size());
        }
        return expired;
    }

    public Optional<HandshakeSession> find(String sessionId) {
        requireText(sessionId, "sessionId");
        return gateway.findSession(sessionId);
    }

    public Optional<HandshakeSession> findLive(String initiatorUserId, String responderUserId) {
        requireText(initiatorUserId, "initiatorUserId");
        requireText(responderUserId, "responderUserId");
        return gateway.findLiveSession(initiatorUserId, responderUserId);
    }

    private void requirePendingAndLive(HandshakeSession current, long nowMs, String operation) {
        if (current.state() != HandshakeState.PENDING) {
            throw LifecycleException.conflict(
                    "Cannot " + operation + " handshake " + current.sessionId() + " in state " + current.state());
        }
        if (current.expiresAtMs() != null && current.expiresAtMs() <= nowMs) {
            // Past its TTL but not swept yet: settle it now rather than let it through.
            if (gateway.tryExpire(current.sessionId(), nowMs)) {
                auditTransition(require(current.sessionId()), "handshake.expire", HandshakeState.PENDING,
                        HandshakeState.EXPIRED, null);
            }
            throw LifecycleException.conflict("Handshake " + current.sessionId() + " has expired");
        }
    }

    private HandshakeSession require(String sessionId) {
        requireText(sessionId, "sessionId");
        return gateway.findSession(sessionId)
                .orElseThrow(() -> LifecycleException.notFound("Handshake session not found: " + sessionId));
    }

    private LifecycleException transitionLost(String sessionId, String operation) {
        String state = gateway.findSession(sessionId).map(s -> s.state().name()).orElse("missing");
        return LifecycleException.conflict(
                "Concurrent update prevented " + operation + " of handshake " + sessionId + " (now " + state + ")");
    }

    private void auditTransition(HandshakeSession session, String action, HandshakeState from, HandshakeState to,
                                 String reason) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("initiator_user_id", session.initiatorUserId());
        details.put("responder_user_id", session.responderUserId());
        details.put("from", from == null ? "" : from.name());
        details.put("to", to.name());
        if (reason != null) {
            details.put("reason", reason);
        }
        audit.log(AuditLogger.AuditEvent.of(
                action,
                "handshake-tracker",
                "x3dh_session/" + session.sessionId(),
                "ok",
                details
        ));
        LOG.debug("Handshake {} {} -> {}", session.sessionId(), from, to);
    }

    private static String normalizeReason(String reason) {
        if (reason == null || reason.isBlank()) {
            return "unspecified";
        }
        String trimmed = reason.trim();
        return trimmed.length() <= MAX_REASON_LENGTH ? trimmed : trimmed.substring(0, MAX_REASON_LENGTH);
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw LifecycleException.precondition(field + " must not be blank");
        }
    }
}
