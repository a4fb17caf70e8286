package io.burnlock.handshake;

import io.burnlock.config.BurnlockConfig;
import io.burnlock.config.EngineSettings;
import io.burnlock.error.ErrorKind;
import io.burnlock.error.LifecycleException;
import io.burnlock.model.HandshakeSession;
import io.burnlock.model.HandshakeState;
import io.burnlock.observability.AuditLogger;
import io.burnlock.storage.Database;
import io.burnlock.storage.SqlitePersistenceGateway;
import io.burnlock.timer.MutableClock;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class HandshakeTrackerTest {
    private static final long T0 = 1_700_000_000_000L;
    private static final long PENDING_TTL = 60_000L;

    @Test
    void secondInitiateForSamePairConflictsEvenWithNewSessionId() throws Exception {
        Path root = Files.createTempDirectory("burnlock-test-x3dh-unique-");
        try {
            HandshakeTracker tracker = open(root, new MutableClock(T0), 0L);
            HandshakeSession first = tracker.initiate("s1", "alice", "bob");
            Assertions.assertEquals(HandshakeState.PENDING, first.state());
            Assertions.assertEquals(T0 + PENDING_TTL, first.expiresAtMs());

            LifecycleException dup = Assertions.assertThrows(LifecycleException.class,
                    () -> tracker.initiate("s2", "alice", "bob"));
            Assertions.assertEquals(ErrorKind.CONFLICT, dup.kind());

            LifecycleException sameId = Assertions.assertThrows(LifecycleException.class,
                    () -> tracker.initiate("s1", "carol", "dave"));
            Assertions.assertEquals(ErrorKind.CONFLICT, sameId.kind());

            Assertions.assertEquals(HandshakeState.PENDING, tracker.initiate("s3", "bob", "alice").state());

            tracker.complete("s1");
            Assertions.assertThrows(LifecycleException.class, () -> tracker.initiate("s4", "alice", "bob"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void completeSucceedsOnceAndNeverFromTerminalStates() throws Exception {
        Path root = Files.createTempDirectory("burnlock-test-x3dh-complete-");
        try {
            MutableClock clock = new MutableClock(T0);
            HandshakeTracker tracker = open(root, clock, 0L);
            tracker.initiate("s1", "alice", "bob");
            clock.advance(500L);

            HandshakeSession active = tracker.complete("s1");
            Assertions.assertEquals(HandshakeState.ACTIVE, active.state());
            Assertions.assertEquals(T0 + 500L, active.updatedAtMs());
            Assertions.assertNull(active.expiresAtMs());
            Assertions.assertEquals(ErrorKind.CONFLICT,
                    Assertions.assertThrows(LifecycleException.class, () -> tracker.complete("s1")).kind());

            tracker.initiate("s2", "carol", "dave");
            tracker.fail("s2", "signed prekey rejected");
            Assertions.assertEquals(ErrorKind.CONFLICT,
                    Assertions.assertThrows(LifecycleException.class, () -> tracker.complete("s2")).kind());

            tracker.initiate("s3", "erin", "frank");
            tracker.expire("s3");
            Assertions.assertEquals(ErrorKind.CONFLICT,
                    Assertions.assertThrows(LifecycleException.class, () -> tracker.complete("s3")).kind());

            Assertions.assertEquals(ErrorKind.NOT_FOUND,
                    Assertions.assertThrows(LifecycleException.class, () -> tracker.complete("nope")).kind());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failRecordsReasonAndFreesThePair() throws Exception {
        Path root = Files.createTempDirectory("burnlock-test-x3dh-fail-");
        try {
            HandshakeTracker tracker = open(root, new MutableClock(T0), 0L);
            tracker.initiate("s1", "alice", "bob");
            HandshakeSession failed = tracker.fail("s1", "  one-time prekey exhausted ");
            Assertions.assertEquals(HandshakeState.FAILED, failed.state());
            Assertions.assertEquals("one-time prekey exhausted", failed.failureReason());
            Assertions.assertEquals(0, failed.retryCount());

            Assertions.assertEquals(ErrorKind.CONFLICT,
                    Assertions.assertThrows(LifecycleException.class, () -> tracker.fail("s1", "again")).kind());
            Assertions.assertEquals(HandshakeState.PENDING, tracker.initiate("s2", "alice", "bob").state());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void retryCountsWithoutChangingState() throws Exception {
        Path root = Files.createTempDirectory("burnlock-test-x3dh-retry-");
        try {
            MutableClock clock = new MutableClock(T0);
            HandshakeTracker tracker = open(root, clock, 0L);
            tracker.initiate("s1", "alice", "bob");
            clock.advance(1_000L);
            tracker.retry("s1");
            clock.advance(1_000L);
            HandshakeSession s = tracker.retry("s1");

            Assertions.assertEquals(HandshakeState.PENDING, s.state());
            Assertions.assertEquals(2, s.retryCount());
            Assertions.assertEquals(T0 + 2_000L, s.lastRetryAtMs());
            Assertions.assertEquals(T0 + 2_000L, s.updatedAtMs());

            tracker.complete("s1");
            Assertions.assertEquals(ErrorKind.CONFLICT,
                    Assertions.assertThrows(LifecycleException.class, () -> tracker.retry("s1")).kind());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void expireHonoursActiveDeadline() throws Exception {
        Path root = Files.createTempDirectory("burnlock-test-x3dh-expire-");
        try {
            MutableClock clock = new MutableClock(T0);
            HandshakeTracker tracker = open(root, clock, 10_000L);
            tracker.initiate("s1", "alice", "bob");
            HandshakeSession active = tracker.complete("s1");
            Assertions.assertEquals(T0 + 10_000L, active.expiresAtMs());

            Assertions.assertEquals(ErrorKind.CONFLICT,
                    Assertions.assertThrows(LifecycleException.class, () -> tracker.expire("s1")).kind());
            clock.advance(10_000L);
            Assertions.assertEquals(HandshakeState.EXPIRED, tracker.expire("s1").state());
            Assertions.assertEquals(ErrorKind.CONFLICT,
                    Assertions.assertThrows(LifecycleException.class, () -> tracker.expire("s1")).kind());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void sweepExpiresStalePendingAndLapsedActiveSessions() throws Exception {
        Path root = Files.createTempDirectory("burnlock-test-x3dh-sweep-");
        try {
            MutableClock clock = new MutableClock(T0);
            HandshakeTracker tracker = open(root, clock, 30_000L);
            tracker.initiate("stale", "a", "b");
            tracker.initiate("active", "a", "c");
            tracker.complete("active");
            clock.advance(20_000L);
            tracker.initiate("fresh", "a", "d");

            Assertions.assertEquals(List.of(), tracker.sweepExpired());
            clock.advance(40_000L);
            Assertions.assertEquals(List.of("active", "stale"), tracker.sweepExpired().stream().sorted().toList());
            Assertions.assertEquals(HandshakeState.PENDING, tracker.find("fresh").orElseThrow().state());
            Assertions.assertTrue(tracker.findLive("a", "b").isEmpty());
            Assertions.assertEquals("fresh", tracker.findLive("a", "d").orElseThrow().sessionId());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void pendingPastTtlCannotBeCompletedBeforeSweep() throws Exception {
        Path root = Files.createTempDirectory("burnlock-test-x3dh-lapsed-");
        try {
            MutableClock clock = new MutableClock(T0);
            HandshakeTracker tracker = open(root, clock, 0L);
            tracker.initiate("s1", "alice", "bob");
            clock.advance(PENDING_TTL);

            Assertions.assertEquals(ErrorKind.CONFLICT,
                    Assertions.assertThrows(LifecycleException.class, () -> tracker.complete("s1")).kind());
            Assertions.assertEquals(HandshakeState.EXPIRED, tracker.find("s1").orElseThrow().state());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void auditRowsCarryOnlyMetadata() throws Exception {
        Path root = Files.createTempDirectory("burnlock-test-x3dh-audit-");
        try {
            HandshakeTracker tracker = open(root, new MutableClock(T0), 0L);
            tracker.initiate("s1", "alice", "bob");
            tracker.complete("s1");
            Assertions.assertThrows(LifecycleException.class, () -> tracker.initiate("s1", "alice", "alice"));

            String log = Files.readString(root.resolve("audit").resolve("audit.log"), StandardCharsets.UTF_8);
            Assertions.assertTrue(log.contains("\"action\":\"handshake.initiate\""));
            Assertions.assertTrue(log.contains("\"action\":\"handshake.complete\""));
            Assertions.assertTrue(log.contains("x3dh_session/s1"));
        } finally {
            deleteRecursively(root);
        }
    }

    private static HandshakeTracker open(Path root, MutableClock clock, long activeTtlMs) {
        BurnlockConfig config = BurnlockConfig.fromRoot(root.toString());
        Database db = new Database(config);
        db.init();
        EngineSettings settings = EngineSettings.defaults().withHandshakeTtl(PENDING_TTL, activeTtlMs);
        return new HandshakeTracker(new SqlitePersistenceGateway(db), new AuditLogger(config.auditFile(), clock), clock, settings);
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
