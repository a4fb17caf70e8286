package io.burnlock.model;

public record PendingBurn(String messageId, String conversationId, long scheduledBurnAtMs) {
}
