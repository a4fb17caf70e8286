package io.burnlock.burn;

import io.burnlock.config.EngineSettings;
import io.burnlock.error.ErrorKind;
import io.burnlock.error.LifecycleException;
import io.burnlock.model.BurnNotification;
import io.burnlock.model.PendingBurn;
import io.burnlock.notify.NotificationSink;
import io.burnlock.observability.AuditLogger;
import io.burnlock.storage.PersistenceGateway;
import io.burnlock.timer.TimerDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Destroys messages at their {@code scheduledBurnAt}, exactly once, across restarts.
 *
 * <p>The pending index lives in memory only. The durable {@code scheduled_burn_at_ms} column
 * is the source of truth, and {@link #loadPending()} rebuilds the index from it on startup.
 * One scheduler per database is assumed; two instances would double-fire.
 *
 * <p>Cancel versus fire: the first of the two to claim an entry wins. Once a timer has
 * claimed an entry the burn proceeds and a concurrent {@link #cancel(String)} reports
 * {@link CancelOutcome#LOST_TO_BURN}.
 *
 * <p>Lifecycle: {@code new} → {@link #initialize(NotificationSink)} → {@link #loadPending()}
 * → {@link #shutdown()}. Scheduling outside that window is a programming error.
 */
public final class BurnScheduler {
    private static final Logger LOG = LoggerFactory.getLogger(BurnScheduler.class);

    private final PersistenceGateway gateway;
    private final TimerDriver timer;
    private final AuditLogger audit;
    private final EngineSettings settings;
    private final Map<String, ScheduledBurn> index = new ConcurrentHashMap<>();
    private final Object lock = new Object();
    private volatile NotificationSink sink;
    private volatile boolean running;
    private volatile boolean stopped;

    public BurnScheduler(PersistenceGateway gateway, TimerDriver timer, AuditLogger audit, EngineSettings settings) {
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.timer = Objects.requireNonNull(timer, "timer");
        this.audit = Objects.requireNonNull(audit, "audit");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public void initialize(NotificationSink notificationSink) {
        Objects.requireNonNull(notificationSink, "notificationSink");
        synchronized (lock) {
            if (stopped) {
                throw new IllegalStateException("BurnScheduler was shut down; create a new instance");
            }
            if (running) {
                throw new IllegalStateException("BurnScheduler already initialized");
            }
            this.sink = notificationSink;
            this.running = true;
        }
        LOG.info("Burn scheduler initialized (maxAttempts={}, baseBackoffMs={}, maxBackoffMs={})",
                settings.burnMaxAttempts(), settings.burnBaseBackoffMs(), settings.burnMaxBackoffMs());
    }

    /**
     * Arms every not-yet-burned message with a deadline. Overdue messages burn before this
     * method returns.
     *
     * @return number of messages handed to {@link #schedule(String, String, long)}
     */
    public int loadPending() {
        requireRunning();
        List<PendingBurn> pending = gateway.getPendingBurns();
        int failed = 0;
        for (PendingBurn p : pending) {
            try {
                schedule(p.messageId(), p.conversationId(), p.scheduledBurnAtMs());
            } catch (IllegalStateException e) {
                throw e;
            } catch (RuntimeException e) {
                failed++;
                LOG.error("Failed to rehydrate burn for message {}; continuing with remaining rows", p.messageId(), e);
            }
        }
        LOG.info("Rehydrated {} pending burn(s) from storage ({} failed)", pending.size() - failed, failed);
        return pending.size();
    }

    /**
     * Arms a burn for {@code scheduledBurnAtMs}, replacing any earlier entry for the same id.
     * A deadline at or before now burns on the calling thread.
     */
    public void schedule(String messageId, String conversationId, long scheduledBurnAtMs) {
        requireText(messageId, "messageId");
        requireText(conversationId, "conversationId");
        requireRunning();
        ScheduledBurn inline = null;
        synchronized (lock) {
            requireRunning();
            ScheduledBurn previous = index.get(messageId);
            if (previous != null && !previous.disarm()) {
                // The previous timer is mid-burn; the message is going away regardless.
                LOG.debug("Burn already in progress for message {}; schedule ignored", messageId);
                return;
            }
            long nowMs = timer.clock().millis();
            if (scheduledBurnAtMs <= nowMs) {
                inline = new ScheduledBurn(messageId, conversationId, scheduledBurnAtMs, ScheduledBurn.State.FIRING);
                index.put(messageId, inline);
            } else {
                ScheduledBurn entry = new ScheduledBurn(messageId, conversationId, scheduledBurnAtMs, ScheduledBurn.State.ARMED);
                index.put(messageId, entry);
                entry.armed(timer.arm(scheduledBurnAtMs - nowMs, () -> fire(entry)), scheduledBurnAtMs);
            }
        }
        if (inline != null) {
            runBurn(inline);
        }
    }

    /**
     * Disarms the pending burn for {@code messageId}. Only the in-memory entry is touched;
     * clearing the durable deadline is the caller's job.
     */
    public CancelOutcome cancel(String messageId) {
        requireText(messageId, "messageId");
        synchronized (lock) {
            ScheduledBurn entry = index.get(messageId);
            if (entry == null) {
                return CancelOutcome.NOT_SCHEDULED;
            }
            if (entry.disarm()) {
                index.remove(messageId, entry);
                LOG.debug("Burn cancelled for message {}", messageId);
                return CancelOutcome.CANCELLED;
            }
            return CancelOutcome.LOST_TO_BURN;
        }
    }

    public BurnStats stats() {
        long nowMs = timer.clock().millis();
        List<BurnStats.Entry> entries = new ArrayList<>();
        for (ScheduledBurn entry : index.values()) {
            entries.add(new BurnStats.Entry(
                    entry.messageId(),
                    entry.conversationId(),
                    entry.scheduledBurnAtMs(),
                    Math.max(0L, entry.nextFireAtMs() - nowMs),
                    entry.attempt(),
                    entry.state().name()
            ));
        }
        entries.sort(Comparator.comparingLong(BurnStats.Entry::scheduledBurnAt).thenComparing(BurnStats.Entry::messageId));
        return new BurnStats(entries.size(), List.copyOf(entries));
    }

    public boolean isScheduled(String messageId) {
        return messageId != null && index.containsKey(messageId);
    }

    /**
     * Disarms every timer without burning anything. Burns already in flight finish.
     */
    public void shutdown() {
        int disarmed = 0;
        synchronized (lock) {
            if (stopped) {
                return;
            }
            running = false;
            stopped = true;
            for (ScheduledBurn entry : index.values()) {
                if (entry.disarm()) {
                    disarmed++;
                }
            }
            index.clear();
        }
        LOG.info("Burn scheduler stopped; {} pending burn(s) disarmed for next startup", disarmed);
    }

    private void fire(ScheduledBurn entry) {
        if (!entry.transition(ScheduledBurn.State.ARMED, ScheduledBurn.State.FIRING)) {
            return;
        }
        try {
            runBurn(entry);
        } catch (RuntimeException e) {
            LOG.error("Unexpected failure in burn timer for message {}", entry.messageId(), e);
        }
    }

    // Caller must hold the entry in FIRING.
    private void runBurn(ScheduledBurn entry) {
        long burnedAtMs = timer.clock().millis();
        PersistenceGateway.BurnOutcome outcome;
        try {
            outcome = gateway.burnMessage(entry.messageId(), burnedAtMs);
        } catch (RuntimeException e) {
            onBurnFailure(entry, e);
            return;
        }
        index.remove(entry.messageId(), entry);
        if (outcome == PersistenceGateway.BurnOutcome.NOT_FOUND) {
            LOG.debug("Message {} already burned or deleted; dropping schedule entry", entry.messageId());
            return;
        }
        recordAudit("burn.executed", entry, "ok", details(entry, burnedAtMs));
        LOG.info("Burned message {} in conversation {}", entry.messageId(), entry.conversationId());
        NotificationSink target = sink;
        try {
            target.messageBurned(new BurnNotification(entry.conversationId(), entry.messageId(), burnedAtMs));
        } catch (RuntimeException e) {
            LOG.warn("Burn notification for message {} not delivered: {}", entry.messageId(), e.getMessage());
        }
    }

    private void onBurnFailure(ScheduledBurn entry, RuntimeException failure) {
        int failed = entry.recordFailure();
        boolean transientIo = failure instanceof LifecycleException
                && ((LifecycleException) failure).kind() == ErrorKind.TRANSIENT_IO;
        if (failed < settings.burnMaxAttempts()) {
            long backoffMs = computeBackoffMs(failed, settings.burnBaseBackoffMs(), settings.burnMaxBackoffMs());
            synchronized (lock) {
                if (!running || index.get(entry.messageId()) != entry) {
                    entry.transition(ScheduledBurn.State.FIRING, ScheduledBurn.State.CANCELLED);
                    index.remove(entry.messageId(), entry);
                    LOG.warn("Burn of message {} failed while scheduler stopping; left for next startup", entry.messageId());
                    return;
                }
                entry.transition(ScheduledBurn.State.FIRING, ScheduledBurn.State.ARMED);
                entry.armed(timer.arm(backoffMs, () -> fire(entry)), timer.clock().millis() + backoffMs);
            }
            LOG.warn("Burn of message {} failed (attempt {}/{}, transient={}); retrying in {} ms: {}",
                    entry.messageId(), failed, settings.burnMaxAttempts(), transientIo, backoffMs, failure.getMessage());
            return;
        }
        entry.transition(ScheduledBurn.State.FIRING, ScheduledBurn.State.STALLED);
        Map<String, Object> details = details(entry, timer.clock().millis());
        details.put("attempts", failed);
        details.put("error", failure.getMessage());
        recordAudit("burn.failed", entry, "incident", details);
        LOG.error("SECURITY: burn of message {} failed after {} attempts; plaintext outlives its deadline until next startup",
                entry.messageId(), failed, failure);
    }

    // Runs after the burn outcome is settled; failures are logged, never propagated.
    private void recordAudit(String action, ScheduledBurn entry, String result, Map<String, Object> details) {
        try {
            audit.log(AuditLogger.AuditEvent.of(action, "burn-scheduler", "message/" + entry.messageId(), result, details));
        } catch (RuntimeException e) {
            LOG.error("Audit write {} for message {} failed", action, entry.messageId(), e);
        }
    }

    private static Map<String, Object> details(ScheduledBurn entry, long atMs) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("conversation_id", entry.conversationId());
        details.put("scheduled_burn_at_ms", entry.scheduledBurnAtMs());
        details.put("at_ms", atMs);
        return details;
    }

    static long computeBackoffMs(int attempt, long baseBackoffMs, long maxBackoffMs) {
        long backoff = baseBackoffMs;
        for (int i = 1; i < attempt; i++) {
            if (backoff >= maxBackoffMs / 2L) {
                backoff = maxBackoffMs;
                break;
            }
            backoff *= 2L;
        }
        backoff = Math.min(backoff, maxBackoffMs);
        long jitter = ThreadLocalRandom.current().nextLong(0L, 251L);
        return Math.min(maxBackoffMs, backoff + jitter);
    }

    private void requireRunning() {
        if (!running) {
            throw new IllegalStateException(stopped
                    ? "BurnScheduler has been shut down"
                    : "BurnScheduler used before initialize()");
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
    }
}
