package io.burnlock.error;

/**
 * Closed set of rejection kinds surfaced by the engine. Transports decide how each kind is
 * rendered (status code, exit code); the engine never does.
 */
public enum ErrorKind {
    /** The addressed message or session does not exist (or was burned). Never retried silently. */
    NOT_FOUND,
    /** The request collides with current state: live handshake for the pair, repeated acknowledge. */
    CONFLICT,
    /** Input rejected before any state change: unlock condition not in the future, locked body. */
    PRECONDITION,
    /** Durable storage failed; the burn path retries these with backoff. */
    TRANSIENT_IO
}
