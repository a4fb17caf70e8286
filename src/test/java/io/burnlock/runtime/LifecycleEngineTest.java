package io.burnlock.runtime;

import io.burnlock.config.BurnlockConfig;
import io.burnlock.config.EngineSettings;
import io.burnlock.model.BurnNotification;
import io.burnlock.model.HandshakeState;
import io.burnlock.model.MessageView;
import io.burnlock.notify.OutboxNotificationSink;
import io.burnlock.timer.ExecutorTimerDriver;
import io.burnlock.timer.ManualTimerDriver;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Stream;

final class LifecycleEngineTest {
    private static final long T0 = 1_700_000_000_000L;

    @Test
    void restartRehydratesPendingBurnsAndBurnsOverdueOnes() throws Exception {
        Path root = Files.createTempDirectory("burnlock-test-engine-restart-");
        try {
            BurnlockConfig config = BurnlockConfig.fromRoot(root.toString());
            ManualTimerDriver firstTimer = new ManualTimerDriver(T0);
            List<BurnNotification> firstSink = new CopyOnWriteArrayList<>();
            LifecycleEngine first = new LifecycleEngine(config, EngineSettings.defaults(), firstTimer, true, () -> 10L);
            first.initialize(firstSink::add);
            Assertions.assertEquals(0, first.loadPending());
            MessageView soon = first.messages().send("c1", "alice", "soon", null, T0 + 1_000L);
            MessageView later = first.messages().send("c1", "alice", "later", null, T0 + 60_000L);
            MessageView keep = first.messages().send("c1", "alice", "keep", null, null);
            first.shutdown();
            Assertions.assertTrue(firstSink.isEmpty());

            ManualTimerDriver secondTimer = new ManualTimerDriver(T0 + 5_000L);
            List<BurnNotification> secondSink = new CopyOnWriteArrayList<>();
            try (LifecycleEngine second = new LifecycleEngine(config, EngineSettings.defaults(), secondTimer, true, () -> 10L)) {
                second.initialize(secondSink::add);
                Assertions.assertEquals(2, second.loadPending());
                Assertions.assertTrue(second.gateway().findMessage(soon.messageId()).orElseThrow().burned());
                Assertions.assertEquals(1, second.scheduler().stats().scheduledCount());

                secondTimer.advance(55_000L);
                Assertions.assertTrue(second.gateway().findMessage(later.messageId()).orElseThrow().burned());
                Assertions.assertEquals("keep", second.messages().readBody(keep.messageId()));
                Assertions.assertEquals(List.of(soon.messageId(), later.messageId()),
                        secondSink.stream().map(BurnNotification::messageId).toList());
                Assertions.assertTrue(second.audit().verify().valid());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void periodicSweepExpiresStaleHandshakes() throws Exception {
        Path root = Files.createTempDirectory("burnlock-test-engine-sweep-");
        try {
            BurnlockConfig config = BurnlockConfig.fromRoot(root.toString());
            EngineSettings settings = EngineSettings.defaults().withHandshakeTtl(30_000L, 0L);
            ManualTimerDriver timer = new ManualTimerDriver(T0);
            try (LifecycleEngine engine = new LifecycleEngine(config, settings, timer, true, () -> 0L)) {
                engine.initialize(n -> {
                });
                engine.loadPending();
                engine.handshakes().initiate("s1", "alice", "bob");
                timer.advance(settings.handshakeSweepIntervalMs());
                Assertions.assertEquals(HandshakeState.EXPIRED, engine.handshakes().find("s1").orElseThrow().state());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void lifecycleOrderIsEnforced() throws Exception {
        Path root = Files.createTempDirectory("burnlock-test-engine-order-");
        try {
            BurnlockConfig config = BurnlockConfig.fromRoot(root.toString());
            LifecycleEngine engine = new LifecycleEngine(config, EngineSettings.defaults(), new ManualTimerDriver(T0), true, () -> 0L);
            Assertions.assertThrows(IllegalStateException.class, engine::loadPending);
            Assertions.assertThrows(IllegalStateException.class,
                    () -> engine.scheduler().schedule("m1", "c1", T0 + 1_000L));
            engine.initialize(n -> {
            });
            Assertions.assertThrows(IllegalStateException.class, () -> engine.initialize(n -> {
            }));
            engine.loadPending();
            Assertions.assertThrows(IllegalStateException.class, engine::loadPending);
            engine.shutdown();
            engine.shutdown();
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void realTimersBurnAndWriteOutbox() throws Exception {
        Path root = Files.createTempDirectory("burnlock-test-engine-e2e-");
        try {
            BurnlockConfig config = BurnlockConfig.fromRoot(root.toString());
            ExecutorTimerDriver timer = new ExecutorTimerDriver(Clock.systemUTC(), 2);
            try (LifecycleEngine engine = new LifecycleEngine(config, EngineSettings.defaults(), timer, true, () -> 0L)) {
                engine.initialize(new OutboxNotificationSink(config.burnOutboxFile()));
                engine.loadPending();
                MessageView sent = engine.messages().send("c9", "alice", "gone soon", null, System.currentTimeMillis() + 150L);

                long deadline = System.currentTimeMillis() + 5_000L;
                while (System.currentTimeMillis() < deadline
                        && !engine.gateway().findMessage(sent.messageId()).orElseThrow().burned()) {
                    Thread.sleep(20L);
                }
                Assertions.assertTrue(engine.gateway().findMessage(sent.messageId()).orElseThrow().burned());
                String outbox = Files.readString(config.burnOutboxFile(), StandardCharsets.UTF_8);
                Assertions.assertTrue(outbox.contains(sent.messageId()));
                Assertions.assertFalse(outbox.contains("gone soon"));
            }
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
