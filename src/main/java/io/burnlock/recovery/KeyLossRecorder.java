package io.burnlock.recovery;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.burnlock.error.LifecycleException;
import io.burnlock.observability.AuditLogger;
import io.burnlock.storage.PersistenceGateway;
import io.burnlock.util.Jsons;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Records that a user lost their identity keys so peers can be warned that the trust chain
 * restarted. The record is opaque to the engine; only the recovery flow reads it.
 */
public final class KeyLossRecorder {
    static final String KEY_PREFIX = "trust_star:key_lost:";

    private final PersistenceGateway gateway;
    private final AuditLogger audit;
    private final Clock clock;

    public KeyLossRecorder(PersistenceGateway gateway, AuditLogger audit, Clock clock) {
        this.gateway = gateway;
        this.audit = audit;
        this.clock = clock;
    }

    public KeyLoss markKeyLost(String userId, String reason) {
        if (userId == null || userId.isBlank()) {
            throw LifecycleException.precondition("userId must not be blank");
        }
        long nowMs = clock.millis();
        KeyLoss record = new KeyLoss(nowMs, reason == null || reason.isBlank() ? null : reason.trim());
        gateway.setMetadata(metadataKey(userId), Jsons.toCompactJson(record), nowMs);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("metadata_key", metadataKey(userId));
        details.put("reason", record.reason() == null ? "" : record.reason());
        audit.log(AuditLogger.AuditEvent.of(
                "recovery.key_lost",
                userId,
                "user/" + userId,
                "recorded",
                details
        ));
        return record;
    }

    public Optional<KeyLoss> keyLoss(String userId) {
        if (userId == null || userId.isBlank()) {
            return Optional.empty();
        }
        Optional<String> raw = gateway.getMetadata(metadataKey(userId));
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Jsons.mapper().readValue(raw.get(), KeyLoss.class));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt key-loss record for user " + userId, e);
        }
    }

    static String metadataKey(String userId) {
        return KEY_PREFIX + userId;
    }

    /**
     * Serialized as {@code {"at":<epoch ms>,"reason":<text|null>}}.
     */
    public record KeyLoss(long at, String reason) {
    }
}
