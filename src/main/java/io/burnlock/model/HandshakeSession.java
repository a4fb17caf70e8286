package io.burnlock.model;

/**
 * Progress metadata of one X3DH handshake. Carries participants, state and timing only;
 * keys, shared secrets and ratchet state stay on the clients.
 */
public record HandshakeSession(
        String sessionId,
        String initiatorUserId,
        String responderUserId,
        HandshakeState state,
        long createdAtMs,
        long updatedAtMs,
        Long expiresAtMs,
        int retryCount,
        Long lastRetryAtMs,
        String failureReason
) {
}
