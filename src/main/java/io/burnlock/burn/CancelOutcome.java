package io.burnlock.burn;

public enum CancelOutcome {
    CANCELLED,
    NOT_SCHEDULED,
    /**
     * The timer had already started the burn; the message is destroyed regardless.
     */
    LOST_TO_BURN
}
