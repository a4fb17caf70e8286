package io.burnlock.messaging;

import io.burnlock.burn.BurnScheduler;
import io.burnlock.burn.CancelOutcome;
import io.burnlock.error.LifecycleException;
import io.burnlock.model.LockVerdict;
import io.burnlock.model.MessageView;
import io.burnlock.model.NewMessage;
import io.burnlock.observability.AuditLogger;
import io.burnlock.storage.PersistenceGateway;
import io.burnlock.timelock.ChainHeightSource;
import io.burnlock.timelock.TimeLockEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Entry point for the messaging subsystem: message creation, gated reads, acknowledgement and
 * burn-deadline changes. Rejections surface as {@link LifecycleException}.
 *
 * <p>{@code scheduledBurnAt} is only ever changed here, durable row first, in-memory schedule
 * second, so a restart always re-arms what was last written.
 */
public final class MessageLifecycleService {
    private static final Logger LOG = LoggerFactory.getLogger(MessageLifecycleService.class);

    private final PersistenceGateway gateway;
    private final BurnScheduler scheduler;
    private final TimeLockEvaluator timeLock;
    private final ChainHeightSource chainHeight;
    private final AuditLogger audit;
    private final Clock clock;

    public MessageLifecycleService(
            PersistenceGateway gateway,
            BurnScheduler scheduler,
            TimeLockEvaluator timeLock,
            ChainHeightSource chainHeight,
            AuditLogger audit,
            Clock clock
    ) {
        this.gateway = gateway;
        this.scheduler = scheduler;
        this.timeLock = timeLock;
        this.chainHeight = chainHeight;
        this.audit = audit;
        this.clock = clock;
    }

    public MessageView send(String conversationId, String senderId, String body, Long unlockCondition,
                            Long scheduledBurnAtMs) {
        requireText(conversationId, "conversationId");
        requireText(senderId, "senderId");
        if (body == null) {
            throw LifecycleException.precondition("body must not be null");
        }
        long nowMs = clock.millis();
        if (unlockCondition != null) {
            timeLock.validateNew(unlockCondition, chainHeight.currentHeight());
        }
        if (scheduledBurnAtMs != null && scheduledBurnAtMs <= nowMs) {
            throw LifecycleException.precondition("scheduledBurnAt must be in the future: " + scheduledBurnAtMs);
        }
        String messageId = "msg_" + UUID.randomUUID();
        gateway.insertMessage(new NewMessage(
                messageId,
                conversationId,
                senderId,
                body,
                nowMs,
                unlockCondition,
                scheduledBurnAtMs
        ));
        if (scheduledBurnAtMs != null) {
            scheduler.schedule(messageId, conversationId, scheduledBurnAtMs);
        }
        LOG.debug("Stored message {} in conversation {} (timeLocked={}, burnAt={})",
                messageId, conversationId, unlockCondition != null, scheduledBurnAtMs);
        return requireExisting(messageId);
    }

    /**
     * Metadata is visible whatever the lock state; burned messages show as tombstones.
     */
    public MessageStatus view(String messageId) {
        MessageView message = requireExisting(messageId);
        long height = chainHeight.currentHeight();
        return new MessageStatus(message, TimeLockEvaluator.evaluate(message.unlockCondition(), height), height);
    }

    public String readBody(String messageId) {
        MessageView message = requireLive(messageId);
        requireUnlocked(message);
        return gateway.readBody(messageId)
                .orElseThrow(() -> LifecycleException.notFound("Message not found: " + messageId));
    }

    /**
     * Marks the message read by {@code recipientId}. With {@code burnAfterMs} the burn deadline
     * becomes {@code now + burnAfterMs}; without it any existing deadline stays armed.
     */
    public MessageView acknowledge(String messageId, String recipientId, Long burnAfterMs) {
        requireText(recipientId, "recipientId");
        if (burnAfterMs != null && burnAfterMs < 0L) {
            throw LifecycleException.precondition("burnAfterMs must be >= 0");
        }
        MessageView message = requireLive(messageId);
        if (message.senderId().equals(recipientId)) {
            throw LifecycleException.conflict("Sender cannot acknowledge their own message");
        }
        requireUnlocked(message);
        long nowMs = clock.millis();
        Long burnAtMs = null;
        if (burnAfterMs != null) {
            try {
                burnAtMs = Math.addExact(nowMs, burnAfterMs);
            } catch (ArithmeticException e) {
                throw LifecycleException.precondition("burnAfterMs is too large: " + burnAfterMs);
            }
        }
        PersistenceGateway.AckOutcome outcome = gateway.acknowledge(messageId, nowMs);
        if (outcome == PersistenceGateway.AckOutcome.ALREADY_ACKNOWLEDGED) {
            throw LifecycleException.conflict("Message already acknowledged: " + messageId);
        }
        if (outcome == PersistenceGateway.AckOutcome.NOT_FOUND) {
            throw LifecycleException.notFound("Message not found: " + messageId);
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("conversation_id", message.conversationId());
        details.put("recipient_id", recipientId);
        if (burnAtMs != null) {
            if (gateway.updateScheduledBurn(messageId, burnAtMs)) {
                scheduler.schedule(messageId, message.conversationId(), burnAtMs);
                details.put("scheduled_burn_at_ms", burnAtMs);
            }
        } else if (message.scheduledBurnAtMs() != null && !scheduler.isScheduled(messageId)) {
            scheduler.schedule(messageId, message.conversationId(), message.scheduledBurnAtMs());
        }
        audit.log(AuditLogger.AuditEvent.of(
                "message.acknowledge",
                recipientId,
                "message/" + messageId,
                "ok",
                details
        ));
        return requireExisting(messageId);
    }

    public MessageView rescheduleBurn(String messageId, long scheduledBurnAtMs) {
        MessageView message = requireLive(messageId);
        if (!gateway.updateScheduledBurn(messageId, scheduledBurnAtMs)) {
            throw LifecycleException.notFound("Message not found: " + messageId);
        }
        scheduler.schedule(messageId, message.conversationId(), scheduledBurnAtMs);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("conversation_id", message.conversationId());
        details.put("previous_burn_at_ms", message.scheduledBurnAtMs() == null ? "" : message.scheduledBurnAtMs());
        details.put("scheduled_burn_at_ms", scheduledBurnAtMs);
        audit.log(AuditLogger.AuditEvent.of(
                "burn.reschedule",
                "messaging",
                "message/" + messageId,
                "ok",
                details
        ));
        return requireExisting(messageId);
    }

    /**
     * Drops the burn deadline. The in-memory entry is disarmed before the durable column is
     * cleared; if the timer already claimed the burn the message is destroyed anyway and
     * {@link CancelOutcome#LOST_TO_BURN} is returned.
     */
    public CancelOutcome cancelBurn(String messageId) {
        MessageView message = requireExisting(messageId);
        if (message.burned()) {
            return CancelOutcome.LOST_TO_BURN;
        }
        CancelOutcome outcome = scheduler.cancel(messageId);
        if (outcome == CancelOutcome.LOST_TO_BURN) {
            LOG.info("Cancel of burn for message {} lost to an in-flight burn", messageId);
            return outcome;
        }
        if (!gateway.updateScheduledBurn(messageId, null)) {
            return CancelOutcome.LOST_TO_BURN;
        }
        if (outcome == CancelOutcome.NOT_SCHEDULED && message.scheduledBurnAtMs() == null) {
            return outcome;
        }
        audit.log(AuditLogger.AuditEvent.of(
                "burn.cancel",
                "messaging",
                "message/" + messageId,
                "cancelled",
                Map.of("conversation_id", message.conversationId())
        ));
        return CancelOutcome.CANCELLED;
    }

    private void requireUnlocked(MessageView message) {
        long height = chainHeight.currentHeight();
        if (TimeLockEvaluator.evaluate(message.unlockCondition(), height) == LockVerdict.LOCKED) {
            throw LifecycleException.precondition(
                    "Message " + message.messageId() + " is time-locked until height " + message.unlockCondition()
                            + " (current " + height + ")");
        }
    }

    private MessageView requireExisting(String messageId) {
        requireText(messageId, "messageId");
        return gateway.findMessage(messageId)
                .orElseThrow(() -> LifecycleException.notFound("Message not found: " + messageId));
    }

    private MessageView requireLive(String messageId) {
        MessageView message = requireExisting(messageId);
        if (message.burned()) {
            throw LifecycleException.notFound("Message not found: " + messageId);
        }
        return message;
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw LifecycleException.precondition(field + " must not be blank");
        }
    }
}
