package io.burnlock.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.burnlock.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

final class BurnlockCommandTest {

    @Test
    void messageCommandsMapRejectionsToExitCodes() throws Exception {
        Path root = Files.createTempDirectory("burnlock-test-cli-msg-");
        try {
            String r = root.toString();
            Assertions.assertEquals(0, run(r, 0L, "init").code());

            Result sent = run(r, 5L, "send", "--conversation", "c1", "--sender", "alice", "--body", "hi", "--unlock-height", "10");
            Assertions.assertEquals(0, sent.code(), sent.err());
            String messageId = Jsons.mapper().readTree(sent.out()).path("messageId").asText();
            Assertions.assertTrue(messageId.startsWith("msg_"));

            Result locked = run(r, 5L, "read", messageId);
            Assertions.assertEquals(BurnlockCommand.EXIT_PRECONDITION, locked.code());
            Assertions.assertEquals("PRECONDITION", Jsons.mapper().readTree(locked.err()).path("error").asText());

            Result view = run(r, 5L, "view", messageId);
            Assertions.assertEquals(0, view.code());
            Assertions.assertEquals("LOCKED", Jsons.mapper().readTree(view.out()).path("lock").asText());

            Result read = run(r, 10L, "read", messageId);
            Assertions.assertEquals(0, read.code());
            Assertions.assertEquals("hi", Jsons.mapper().readTree(read.out()).path("body").asText());

            Assertions.assertEquals(BurnlockCommand.EXIT_CONFLICT, run(r, 10L, "ack", messageId, "--recipient", "alice").code());
            Assertions.assertEquals(0, run(r, 10L, "ack", messageId, "--recipient", "bob").code());
            Assertions.assertEquals(BurnlockCommand.EXIT_CONFLICT, run(r, 10L, "ack", messageId, "--recipient", "bob").code());
            Assertions.assertEquals(BurnlockCommand.EXIT_NOT_FOUND, run(r, 10L, "read", "msg_missing").code());

            Result reschedule = run(r, 10L, "burn-reschedule", messageId, "--at", String.valueOf(System.currentTimeMillis() + 600_000L));
            Assertions.assertEquals(0, reschedule.code(), reschedule.err());
            JsonNode stats = Jsons.mapper().readTree(run(r, 10L, "burn-stats").out());
            Assertions.assertEquals(1, stats.path("scheduledCount").asInt());

            Result cancel = run(r, 10L, "burn-cancel", messageId);
            Assertions.assertEquals(0, cancel.code());
            Assertions.assertEquals("CANCELLED", Jsons.mapper().readTree(cancel.out()).path("outcome").asText());
            Assertions.assertEquals(0, Jsons.mapper().readTree(run(r, 10L, "burn-stats").out()).path("scheduledCount").asInt());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void handshakeRecoveryAndAuditCommands() throws Exception {
        Path root = Files.createTempDirectory("burnlock-test-cli-x3dh-");
        try {
            String r = root.toString();
            Assertions.assertEquals(0, run(r, 0L, "handshake-initiate", "--session", "s1", "--initiator", "alice", "--responder", "bob").code());
            Assertions.assertEquals(BurnlockCommand.EXIT_CONFLICT,
                    run(r, 0L, "handshake-initiate", "--session", "s2", "--initiator", "alice", "--responder", "bob").code());
            Assertions.assertEquals(0, run(r, 0L, "handshake-retry", "s1").code());
            Result completed = run(r, 0L, "handshake-complete", "s1");
            Assertions.assertEquals("ACTIVE", Jsons.mapper().readTree(completed.out()).path("state").asText());
            Assertions.assertEquals(BurnlockCommand.EXIT_CONFLICT, run(r, 0L, "handshake-fail", "s1", "--reason", "late").code());
            Assertions.assertEquals(BurnlockCommand.EXIT_NOT_FOUND, run(r, 0L, "handshake-show", "nope").code());
            JsonNode shown = Jsons.mapper().readTree(run(r, 0L, "handshake-show", "s1").out());
            Assertions.assertEquals(1, shown.path("retryCount").asInt());
            Assertions.assertEquals(0, run(r, 0L, "handshake-sweep").code());

            Assertions.assertEquals(0, run(r, 0L, "mark-key-lost", "alice", "--reason", "lost phone").code());
            Result meta = run(r, 0L, "metadata-get", "trust_star:key_lost:alice");
            Assertions.assertEquals(0, meta.code());
            Assertions.assertTrue(Jsons.mapper().readTree(meta.out()).path("value").asText().contains("lost phone"));
            Assertions.assertEquals(BurnlockCommand.EXIT_NOT_FOUND, run(r, 0L, "metadata-get", "missing").code());

            Result verify = run(r, 0L, "audit-verify");
            Assertions.assertEquals(0, verify.code());
            Assertions.assertTrue(Jsons.mapper().readTree(verify.out()).path("valid").asBoolean());
            Assertions.assertEquals(0, run(r, 0L, "schema-migrations").code());
        } finally {
            deleteRecursively(root);
        }
    }

    private static Result run(String root, long chainHeight, String... args) {
        List<String> argv = new ArrayList<>();
        argv.add("--root");
        argv.add(root);
        argv.add("--chain-height");
        argv.add(String.valueOf(chainHeight));
        argv.addAll(List.of(args));

        PrintStream original = System.out;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        StringWriter err = new StringWriter();
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            CommandLine cmd = BurnlockCommand.newCommandLine();
            cmd.setErr(new PrintWriter(err, true));
            int code = cmd.execute(argv.toArray(new String[0]));
            return new Result(code, out.toString(StandardCharsets.UTF_8), err.toString());
        } finally {
            System.setOut(original);
        }
    }

    private record Result(int code, String out, String err) {
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
