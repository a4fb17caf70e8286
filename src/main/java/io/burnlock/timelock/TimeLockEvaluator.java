package io.burnlock.timelock;

import io.burnlock.error.LifecycleException;
import io.burnlock.model.LockVerdict;

/**
 * Decides whether a message body is readable at a given chain height.
 *
 * <p>The boundary is inclusive: a message with unlock condition {@code h} becomes readable at
 * height {@code h}. A message without an unlock condition is always readable.
 */
public final class TimeLockEvaluator {
    private final long maxFutureHeight;

    public TimeLockEvaluator(long maxFutureHeight) {
        if (maxFutureHeight < 1L) {
            throw new IllegalArgumentException("maxFutureHeight must be >= 1");
        }
        this.maxFutureHeight = maxFutureHeight;
    }

    public static LockVerdict evaluate(Long unlockCondition, long currentHeight) {
        if (unlockCondition == null) {
            return LockVerdict.UNLOCKED;
        }
        return currentHeight >= unlockCondition ? LockVerdict.UNLOCKED : LockVerdict.LOCKED;
    }

    /**
     * Rejects an unlock condition that would already be satisfied at creation time, or that
     * lies further ahead than the configured horizon.
     */
    public void validateNew(Long unlockCondition, long currentHeight) {
        if (unlockCondition == null) {
            return;
        }
        if (unlockCondition <= currentHeight) {
            throw LifecycleException.precondition(
                    "Unlock condition must be in the future: " + unlockCondition + " <= current height " + currentHeight);
        }
        if (unlockCondition - currentHeight > maxFutureHeight) {
            throw LifecycleException.precondition(
                    "Unlock condition too far ahead: " + unlockCondition + " > current height " + currentHeight
                            + " + " + maxFutureHeight);
        }
    }

    public long maxFutureHeight() {
        return maxFutureHeight;
    }
}
