package io.burnlock.burn;

import io.burnlock.timer.TimerHandle;

import java.util.concurrent.atomic.AtomicReference;

/**
 * One slot in the pending-burn index. The state field is the single arbiter between a
 * cancel and a firing timer: whoever moves it off {@link State#ARMED} first owns the entry.
 */
final class ScheduledBurn {
    enum State {
        ARMED,
        FIRING,
        CANCELLED,
        // retries exhausted; durable row still carries the deadline
        STALLED
    }

    private final String messageId;
    private final String conversationId;
    private final long scheduledBurnAtMs;
    private final AtomicReference<State> state;
    private volatile TimerHandle handle;
    private volatile int attempt;
    private volatile long nextFireAtMs;

    ScheduledBurn(String messageId, String conversationId, long scheduledBurnAtMs, State initial) {
        this.messageId = messageId;
        this.conversationId = conversationId;
        this.scheduledBurnAtMs = scheduledBurnAtMs;
        this.state = new AtomicReference<>(initial);
        this.nextFireAtMs = scheduledBurnAtMs;
    }

    String messageId() {
        return messageId;
    }

    String conversationId() {
        return conversationId;
    }

    long scheduledBurnAtMs() {
        return scheduledBurnAtMs;
    }

    State state() {
        return state.get();
    }

    boolean transition(State from, State to) {
        return state.compareAndSet(from, to);
    }

    /**
     * Moves an armed or stalled entry to CANCELLED and disarms its timer.
     *
     * @return false when a burn has already claimed the entry
     */
    boolean disarm() {
        if (state.compareAndSet(State.ARMED, State.CANCELLED) || state.compareAndSet(State.STALLED, State.CANCELLED)) {
            TimerHandle h = handle;
            if (h != null) {
                h.cancel();
            }
            return true;
        }
        return false;
    }

    void armed(TimerHandle handle, long fireAtMs) {
        this.handle = handle;
        this.nextFireAtMs = fireAtMs;
    }

    int attempt() {
        return attempt;
    }

    int recordFailure() {
        attempt = attempt + 1;
        return attempt;
    }

    long nextFireAtMs() {
        return nextFireAtMs;
    }
}
