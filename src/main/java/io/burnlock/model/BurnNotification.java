package io.burnlock.model;

public record BurnNotification(String conversationId, String messageId, long burnedAtMs) {
}
