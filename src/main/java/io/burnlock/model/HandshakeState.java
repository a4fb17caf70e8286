package io.burnlock.model;

public enum HandshakeState {
    PENDING,
    ACTIVE,
    FAILED,
    EXPIRED;

    /**
     * States that occupy the one-live-session-per-pair slot.
     */
    public boolean live() {
        return this == PENDING || this == ACTIVE;
    }

    public static HandshakeState fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Handshake state must not be blank");
        }
        for (HandshakeState value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown handshake state: " + raw);
    }
}
