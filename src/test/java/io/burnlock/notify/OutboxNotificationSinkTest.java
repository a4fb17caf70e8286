package io.burnlock.notify;

import com.fasterxml.jackson.databind.JsonNode;
import io.burnlock.model.BurnNotification;
import io.burnlock.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class OutboxNotificationSinkTest {

    @Test
    void appendsOneJsonLinePerBurn() throws Exception {
        Path root = Files.createTempDirectory("burnlock-test-outbox-");
        try {
            OutboxNotificationSink sink = new OutboxNotificationSink(root.resolve("notifications").resolve("burned.jsonl"));
            sink.messageBurned(new BurnNotification("c1", "m1", 10L));
            sink.messageBurned(new BurnNotification("c1", "m2", 20L));

            List<String> lines = Files.readAllLines(sink.outboxFile(), StandardCharsets.UTF_8);
            Assertions.assertEquals(2, lines.size());
            JsonNode first = Jsons.mapper().readTree(lines.get(0));
            Assertions.assertEquals("message-burned", first.path("event").asText());
            Assertions.assertEquals("c1", first.path("conversationId").asText());
            Assertions.assertEquals("m1", first.path("messageId").asText());
            Assertions.assertEquals(10L, first.path("burnedAt").asLong());
            Assertions.assertEquals("m2", Jsons.mapper().readTree(lines.get(1)).path("messageId").asText());
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
