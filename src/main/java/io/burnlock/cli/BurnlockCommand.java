package io.burnlock.cli;

import io.burnlock.burn.BurnStats;
import io.burnlock.burn.CancelOutcome;
import io.burnlock.config.BurnlockConfig;
import io.burnlock.config.EngineSettings;
import io.burnlock.error.ErrorKind;
import io.burnlock.error.LifecycleException;
import io.burnlock.messaging.MessageStatus;
import io.burnlock.model.HandshakeSession;
import io.burnlock.model.MessageView;
import io.burnlock.notify.OutboxNotificationSink;
import io.burnlock.observability.AuditLogger;
import io.burnlock.recovery.KeyLossRecorder;
import io.burnlock.runtime.LifecycleEngine;
import io.burnlock.storage.Database;
import io.burnlock.timer.ExecutorTimerDriver;
import io.burnlock.util.Jsons;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
        name = "burnlock",
        mixinStandardHelpOptions = true,
        description = "Burnlock message lifecycle engine CLI",
        subcommands = {
                BurnlockCommand.InitCommand.class,
                BurnlockCommand.SendCommand.class,
                BurnlockCommand.ViewCommand.class,
                BurnlockCommand.ReadCommand.class,
                BurnlockCommand.AckCommand.class,
                BurnlockCommand.BurnRescheduleCommand.class,
                BurnlockCommand.BurnCancelCommand.class,
                BurnlockCommand.BurnStatsCommand.class,
                BurnlockCommand.RunCommand.class,
                BurnlockCommand.HandshakeInitiateCommand.class,
                BurnlockCommand.HandshakeCompleteCommand.class,
                BurnlockCommand.HandshakeFailCommand.class,
                BurnlockCommand.HandshakeRetryCommand.class,
                BurnlockCommand.HandshakeExpireCommand.class,
                BurnlockCommand.HandshakeSweepCommand.class,
                BurnlockCommand.HandshakeShowCommand.class,
                BurnlockCommand.MarkKeyLostCommand.class,
                BurnlockCommand.MetadataGetCommand.class,
                BurnlockCommand.AuditVerifyCommand.class,
                BurnlockCommand.SchemaMigrationsCommand.class
        }
)
public final class BurnlockCommand implements Runnable {
    static final int EXIT_PRECONDITION = 2;
    static final int EXIT_NOT_FOUND = 3;
    static final int EXIT_CONFLICT = 4;
    static final int EXIT_TRANSIENT_IO = 5;

    @Option(names = {"--root"}, description = "Data root directory", defaultValue = "data")
    String root;

    @Option(names = {"--chain-height"}, defaultValue = "0",
            description = "Current chain height used to evaluate time-locks")
    long chainHeight;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | send | view | read | ack | burn-reschedule | burn-cancel | burn-stats | run | handshake-initiate | handshake-complete | handshake-fail | handshake-retry | handshake-expire | handshake-sweep | handshake-show | mark-key-lost | metadata-get | audit-verify | schema-migrations");
    }

    public static CommandLine newCommandLine() {
        return new CommandLine(new BurnlockCommand())
                .setExecutionExceptionHandler(BurnlockCommand::handleExecutionException);
    }

    static int exitCodeFor(ErrorKind kind) {
        return switch (kind) {
            case PRECONDITION -> EXIT_PRECONDITION;
            case NOT_FOUND -> EXIT_NOT_FOUND;
            case CONFLICT -> EXIT_CONFLICT;
            case TRANSIENT_IO -> EXIT_TRANSIENT_IO;
        };
    }

    private static int handleExecutionException(Exception ex, CommandLine cmd, CommandLine.ParseResult parseResult)
            throws Exception {
        if (!(ex instanceof LifecycleException)) {
            throw ex;
        }
        LifecycleException error = (LifecycleException) ex;
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error.kind().name());
        body.put("message", error.getMessage());
        cmd.getErr().println(Jsons.toJson(body));
        cmd.getErr().flush();
        return exitCodeFor(error.kind());
    }

    BurnlockConfig config() {
        return BurnlockConfig.fromRoot(root);
    }

    /**
     * Opens the engine the way a server process would: schema, sink, then pending burns.
     * Overdue burns therefore execute on any command that touches messages.
     */
    LifecycleEngine startEngine() {
        BurnlockConfig config = config();
        EngineSettings settings = EngineSettings.load(config.settingsFile());
        LifecycleEngine engine = new LifecycleEngine(
                config,
                settings,
                new ExecutorTimerDriver(Clock.systemUTC(), 2),
                true,
                () -> chainHeight
        );
        engine.initialize(new OutboxNotificationSink(config.burnOutboxFile()));
        engine.loadPending();
        return engine;
    }

    @Command(name = "init", description = "Initialize directories and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        BurnlockCommand parent;

        @Override
        public Integer call() {
            BurnlockConfig config = parent.config();
            new Database(config).init();
            System.out.println("Initialized Burnlock at: " + config.rootDir());
            return 0;
        }
    }

    @Command(name = "send", description = "Store a message, optionally time-locked and/or with a burn deadline")
    static final class SendCommand implements Callable<Integer> {
        @ParentCommand
        BurnlockCommand parent;

        @Option(names = {"--conversation"}, required = true, description = "Conversation id")
        String conversationId;

        @Option(names = {"--sender"}, required = true, description = "Sender user id")
        String senderId;

        @Option(names = {"--body"}, required = true, description = "Opaque (already encrypted) body")
        String body;

        @Option(names = {"--unlock-height"}, description = "Chain height at which the body becomes readable")
        Long unlockHeight;

        @Option(names = {"--burn-at"}, description = "Burn deadline, epoch milliseconds")
        Long burnAtMs;

        @Option(names = {"--burn-in-ms"}, description = "Burn deadline relative to now")
        Long burnInMs;

        @Override
        public Integer call() {
            if (burnAtMs != null && burnInMs != null) {
                throw LifecycleException.precondition("Use either --burn-at or --burn-in-ms, not both");
            }
            try (LifecycleEngine engine = parent.startEngine()) {
                Long deadline = burnInMs == null ? burnAtMs : System.currentTimeMillis() + burnInMs;
                MessageView view = engine.messages().send(conversationId, senderId, body, unlockHeight, deadline);
                System.out.println(Jsons.toJson(view));
                return 0;
            }
        }
    }

    @Command(name = "view", description = "Show message metadata and its time-lock verdict")
    static final class ViewCommand implements Callable<Integer> {
        @ParentCommand
        BurnlockCommand parent;

        @Parameters(index = "0", description = "Message id")
        String messageId;

        @Override
        public Integer call() {
            try (LifecycleEngine engine = parent.startEngine()) {
                MessageStatus status = engine.messages().view(messageId);
                System.out.println(Jsons.toJson(status));
                return 0;
            }
        }
    }

    @Command(name = "read", description = "Print the message body if it is not time-locked or burned")
    static final class ReadCommand implements Callable<Integer> {
        @ParentCommand
        BurnlockCommand parent;

        @Parameters(index = "0", description = "Message id")
        String messageId;

        @Override
        public Integer call() {
            try (LifecycleEngine engine = parent.startEngine()) {
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("messageId", messageId);
                out.put("body", engine.messages().readBody(messageId));
                System.out.println(Jsons.toJson(out));
                return 0;
            }
        }
    }

    @Command(name = "ack", description = "Acknowledge a message as its recipient")
    static final class AckCommand implements Callable<Integer> {
        @ParentCommand
        BurnlockCommand parent;

        @Parameters(index = "0", description = "Message id")
        String messageId;

        @Option(names = {"--recipient"}, required = true, description = "Acknowledging user id")
        String recipientId;

        @Option(names = {"--burn-after-ms"}, description = "Burn this many milliseconds after acknowledgement")
        Long burnAfterMs;

        @Override
        public Integer call() {
            try (LifecycleEngine engine = parent.startEngine()) {
                MessageView view = engine.messages().acknowledge(messageId, recipientId, burnAfterMs);
                System.out.println(Jsons.toJson(view));
                return 0;
            }
        }
    }

    @Command(name = "burn-reschedule", description = "Replace the burn deadline of a message")
    static final class BurnRescheduleCommand implements Callable<Integer> {
        @ParentCommand
        BurnlockCommand parent;

        @Parameters(index = "0", description = "Message id")
        String messageId;

        @Option(names = {"--at"}, required = true, description = "New burn deadline, epoch milliseconds")
        long atMs;

        @Override
        public Integer call() {
            try (LifecycleEngine engine = parent.startEngine()) {
                System.out.println(Jsons.toJson(engine.messages().rescheduleBurn(messageId, atMs)));
                return 0;
            }
        }
    }

    @Command(name = "burn-cancel", description = "Cancel the burn deadline of a message")
    static final class BurnCancelCommand implements Callable<Integer> {
        @ParentCommand
        BurnlockCommand parent;

        @Parameters(index = "0", description = "Message id")
        String messageId;

        @Override
        public Integer call() {
            try (LifecycleEngine engine = parent.startEngine()) {
                CancelOutcome outcome = engine.messages().cancelBurn(messageId);
                System.out.println(Jsons.toJson(Map.of("messageId", messageId, "outcome", outcome.name())));
                return outcome == CancelOutcome.LOST_TO_BURN ? 1 : 0;
            }
        }
    }

    @Command(name = "burn-stats", description = "Show pending burns after rehydrating from storage")
    static final class BurnStatsCommand implements Callable<Integer> {
        @ParentCommand
        BurnlockCommand parent;

        @Override
        public Integer call() {
            try (LifecycleEngine engine = parent.startEngine()) {
                BurnStats stats = engine.scheduler().stats();
                System.out.println(Jsons.toJson(stats));
                return 0;
            }
        }
    }

    @Command(name = "run", description = "Keep the engine alive so burns and handshake expiry fire on time")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        BurnlockCommand parent;

        @Option(names = {"--duration-ms"}, defaultValue = "0", description = "Stop after this long; 0 runs until interrupted")
        long durationMs;

        @Override
        public Integer call() throws InterruptedException {
            LifecycleEngine engine = parent.startEngine();
            Thread hook = new Thread(engine::shutdown, "burnlock-shutdown");
            Runtime.getRuntime().addShutdownHook(hook);
            try {
                System.out.println(Jsons.toJson(engine.scheduler().stats()));
                if (durationMs > 0L) {
                    Thread.sleep(durationMs);
                } else {
                    Thread.currentThread().join();
                }
            } finally {
                engine.shutdown();
                Runtime.getRuntime().removeShutdownHook(hook);
            }
            return 0;
        }
    }

    @Command(name = "handshake-initiate", description = "Open a PENDING X3DH handshake session")
    static final class HandshakeInitiateCommand implements Callable<Integer> {
        @ParentCommand
        BurnlockCommand parent;

        @Option(names = {"--session"}, required = true, description = "Client-generated session id")
        String sessionId;

        @Option(names = {"--initiator"}, required = true, description = "Initiator user id")
        String initiator;

        @Option(names = {"--responder"}, required = true, description = "Responder user id")
        String responder;

        @Override
        public Integer call() {
            try (LifecycleEngine engine = parent.startEngine()) {
                HandshakeSession session = engine.handshakes().initiate(sessionId, initiator, responder);
                System.out.println(Jsons.toJson(session));
                return 0;
            }
        }
    }

    @Command(name = "handshake-complete", description = "Move a PENDING handshake to ACTIVE")
    static final class HandshakeCompleteCommand implements Callable<Integer> {
        @ParentCommand
        BurnlockCommand parent;

        @Parameters(index = "0", description = "Session id")
        String sessionId;

        @Override
        public Integer call() {
            try (LifecycleEngine engine = parent.startEngine()) {
                System.out.println(Jsons.toJson(engine.handshakes().complete(sessionId)));
                return 0;
            }
        }
    }

    @Command(name = "handshake-fail", description = "Move a PENDING handshake to FAILED")
    static final class HandshakeFailCommand implements Callable<Integer> {
        @ParentCommand
        BurnlockCommand parent;

        @Parameters(index = "0", description = "Session id")
        String sessionId;

        @Option(names = {"--reason"}, description = "Failure reason")
        String reason;

        @Override
        public Integer call() {
            try (LifecycleEngine engine = parent.startEngine()) {
                System.out.println(Jsons.toJson(engine.handshakes().fail(sessionId, reason)));
                return 0;
            }
        }
    }

    @Command(name = "handshake-retry", description = "Record a client retry of a PENDING handshake")
    static final class HandshakeRetryCommand implements Callable<Integer> {
        @ParentCommand
        BurnlockCommand parent;

        @Parameters(index = "0", description = "Session id")
        String sessionId;

        @Override
        public Integer call() {
            try (LifecycleEngine engine = parent.startEngine()) {
                System.out.println(Jsons.toJson(engine.handshakes().retry(sessionId)));
                return 0;
            }
        }
    }

    @Command(name = "handshake-expire", description = "Expire a PENDING handshake, or an ACTIVE one past expiresAt")
    static final class HandshakeExpireCommand implements Callable<Integer> {
        @ParentCommand
        BurnlockCommand parent;

        @Parameters(index = "0", description = "Session id")
        String sessionId;

        @Override
        public Integer call() {
            try (LifecycleEngine engine = parent.startEngine()) {
                System.out.println(Jsons.toJson(engine.handshakes().expire(sessionId)));
                return 0;
            }
        }
    }

    @Command(name = "handshake-sweep", description = "Expire every handshake whose expiresAt has passed")
    static final class HandshakeSweepCommand implements Callable<Integer> {
        @ParentCommand
        BurnlockCommand parent;

        @Override
        public Integer call() {
            try (LifecycleEngine engine = parent.startEngine()) {
                List<String> expired = engine.handshakes().sweepExpired();
                System.out.println(Jsons.toJson(Map.of("expired", expired)));
                return 0;
            }
        }
    }

    @Command(name = "handshake-show", description = "Show one handshake session")
    static final class HandshakeShowCommand implements Callable<Integer> {
        @ParentCommand
        BurnlockCommand parent;

        @Parameters(index = "0", description = "Session id")
        String sessionId;

        @Override
        public Integer call() {
            try (LifecycleEngine engine = parent.startEngine()) {
                Optional<HandshakeSession> session = engine.handshakes().find(sessionId);
                if (session.isEmpty()) {
                    throw LifecycleException.notFound("Handshake session not found: " + sessionId);
                }
                System.out.println(Jsons.toJson(session.get()));
                return 0;
            }
        }
    }

    @Command(name = "mark-key-lost", description = "Record that a user lost their identity keys")
    static final class MarkKeyLostCommand implements Callable<Integer> {
        @ParentCommand
        BurnlockCommand parent;

        @Parameters(index = "0", description = "User id")
        String userId;

        @Option(names = {"--reason"}, description = "Optional reason")
        String reason;

        @Override
        public Integer call() {
            try (LifecycleEngine engine = parent.startEngine()) {
                KeyLossRecorder.KeyLoss record = engine.keyLoss().markKeyLost(userId, reason);
                System.out.println(Jsons.toJson(record));
                return 0;
            }
        }
    }

    @Command(name = "metadata-get", description = "Read a raw metadata value")
    static final class MetadataGetCommand implements Callable<Integer> {
        @ParentCommand
        BurnlockCommand parent;

        @Parameters(index = "0", description = "Metadata key")
        String key;

        @Override
        public Integer call() {
            try (LifecycleEngine engine = parent.startEngine()) {
                String value = engine.gateway().getMetadata(key)
                        .orElseThrow(() -> LifecycleException.notFound("Metadata key not found: " + key));
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("key", key);
                out.put("value", value);
                System.out.println(Jsons.toJson(out));
                return 0;
            }
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit log hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        BurnlockCommand parent;

        @Override
        public Integer call() {
            BurnlockConfig config = parent.config();
            AuditLogger.VerifyResult out = new AuditLogger(config.auditFile(), Clock.systemUTC()).verify();
            System.out.println(Jsons.toJson(out));
            return out.valid() ? 0 : 1;
        }
    }

    @Command(name = "schema-migrations", description = "List applied schema migrations")
    static final class SchemaMigrationsCommand implements Callable<Integer> {
        @ParentCommand
        BurnlockCommand parent;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows to print")
        int limit;

        @Override
        public Integer call() {
            Database database = new Database(parent.config());
            database.init();
            System.out.println(Jsons.toJson(database.listSchemaMigrations(limit)));
            return 0;
        }
    }
}
