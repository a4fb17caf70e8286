package io.burnlock.timelock;

/**
 * Supplies the current height of the monotonic counter that time-locks are measured against.
 * Backed by a chain client living outside the engine.
 */
@FunctionalInterface
public interface ChainHeightSource {
    long currentHeight();
}
