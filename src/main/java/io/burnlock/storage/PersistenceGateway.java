package io.burnlock.storage;

import io.burnlock.model.HandshakeSession;
import io.burnlock.model.HandshakeState;
import io.burnlock.model.MessageView;
import io.burnlock.model.NewMessage;
import io.burnlock.model.PendingBurn;

import java.util.List;
import java.util.Optional;

/**
 * The only path from the engine to durable storage. Storage failures surface as
 * {@link io.burnlock.error.LifecycleException} of kind {@code TRANSIENT_IO}.
 */
public interface PersistenceGateway {

    // messages

    void insertMessage(NewMessage message);

    Optional<MessageView> findMessage(String messageId);

    /**
     * Body of a live message; empty when the message does not exist or has been burned.
     */
    Optional<String> readBody(String messageId);

    AckOutcome acknowledge(String messageId, long acknowledgedAtMs);

    /**
     * Sets or clears ({@code null}) the burn deadline of a message that is not yet burned.
     *
     * @return false when the message is missing or already burned
     */
    boolean updateScheduledBurn(String messageId, Long scheduledBurnAtMs);

    /**
     * Every not-yet-burned message with a burn deadline, overdue ones included.
     */
    List<PendingBurn> getPendingBurns();

    /**
     * Deletes the body and stamps {@code burnedAt} in one transaction. A message that is
     * missing or already burned reports {@link BurnOutcome#NOT_FOUND}; {@code burnedAt} is
     * never overwritten.
     */
    BurnOutcome burnMessage(String messageId, long burnedAtMs);

    // x3dh sessions

    SessionInsertOutcome insertSession(HandshakeSession session);

    Optional<HandshakeSession> findSession(String sessionId);

    Optional<HandshakeSession> findLiveSession(String initiatorUserId, String responderUserId);

    /**
     * Compare-and-set on the session state. Writes {@code failureReason} and
     * {@code expiresAtMs} as given.
     */
    boolean tryTransition(String sessionId, HandshakeState from, HandshakeState to, long nowMs,
                          String failureReason, Long expiresAtMs);

    boolean tryExpire(String sessionId, long nowMs);

    /**
     * Bumps the retry counter of a PENDING session; never changes its state.
     */
    boolean recordRetry(String sessionId, long nowMs);

    /**
     * Moves every PENDING or ACTIVE session whose {@code expiresAt} has passed to EXPIRED.
     *
     * @return ids of the sessions that were expired
     */
    List<String> expireDueSessions(long nowMs);

    // collaborator metadata

    void setMetadata(String key, String value, long nowMs);

    Optional<String> getMetadata(String key);

    enum BurnOutcome { BURNED, NOT_FOUND }

    enum AckOutcome { ACKNOWLEDGED, ALREADY_ACKNOWLEDGED, NOT_FOUND }

    enum SessionInsertOutcome { CREATED, LIVE_PAIR_EXISTS, SESSION_ID_TAKEN }
}
