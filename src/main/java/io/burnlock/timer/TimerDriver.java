package io.burnlock.timer;

import java.time.Clock;

/**
 * Fires callbacks after a delay measured against {@link #clock()}.
 */
public interface TimerDriver extends AutoCloseable {

    Clock clock();

    TimerHandle arm(long delayMs, Runnable task);

    TimerHandle schedulePeriodic(long initialDelayMs, long periodMs, Runnable task);

    /**
     * Disarms every pending timer without running it. Tasks already running are allowed to finish.
     */
    @Override
    void close();
}
