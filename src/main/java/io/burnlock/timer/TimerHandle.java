package io.burnlock.timer;

public interface TimerHandle {
    /**
     * Disarms the timer.
     *
     * @return true if the task was prevented from starting, false if it already started or ran
     */
    boolean cancel();
}
