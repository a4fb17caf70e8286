package io.burnlock.notify;

import io.burnlock.model.BurnNotification;
import io.burnlock.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Appends one JSON line per burn to an outbox file. A delivery process (or a test) tails the
 * file; this sink only records the event.
 */
public final class OutboxNotificationSink implements NotificationSink {
    private static final Logger LOG = LoggerFactory.getLogger(OutboxNotificationSink.class);

    private final Path outboxFile;

    public OutboxNotificationSink(Path outboxFile) {
        this.outboxFile = outboxFile;
        try {
            Files.createDirectories(outboxFile.getParent());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create notification outbox dir: " + outboxFile.getParent(), e);
        }
    }

    @Override
    public synchronized void messageBurned(BurnNotification notification) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("event", "message-burned");
        row.put("conversationId", notification.conversationId());
        row.put("messageId", notification.messageId());
        row.put("burnedAt", notification.burnedAtMs());
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(outboxFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append burn notification to " + outboxFile, e);
        }
        LOG.debug("Burn notification queued for conversation {} message {}",
                notification.conversationId(), notification.messageId());
    }

    public Path outboxFile() {
        return outboxFile;
    }
}
