package io.burnlock.model;

public record NewMessage(
        String messageId,
        String conversationId,
        String senderId,
        String body,
        long createdAtMs,
        Long unlockCondition,
        Long scheduledBurnAtMs
) {
}
