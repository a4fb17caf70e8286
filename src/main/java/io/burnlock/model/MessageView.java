package io.burnlock.model;

/**
 * Metadata of a stored message. The body is deliberately absent; it is only handed out by
 * the gated read path.
 */
public record MessageView(
        String messageId,
        String conversationId,
        String senderId,
        long createdAtMs,
        Long unlockCondition,
        Long scheduledBurnAtMs,
        Long acknowledgedAtMs,
        Long burnedAtMs
) {
    public boolean burned() {
        return burnedAtMs != null;
    }

    public boolean acknowledged() {
        return acknowledgedAtMs != null;
    }
}
