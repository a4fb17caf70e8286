package io.burnlock.runtime;

import io.burnlock.burn.BurnScheduler;
import io.burnlock.config.BurnlockConfig;
import io.burnlock.config.EngineSettings;
import io.burnlock.handshake.HandshakeTracker;
import io.burnlock.messaging.MessageLifecycleService;
import io.burnlock.notify.NotificationSink;
import io.burnlock.observability.AuditLogger;
import io.burnlock.recovery.KeyLossRecorder;
import io.burnlock.storage.Database;
import io.burnlock.storage.PersistenceGateway;
import io.burnlock.storage.SqlitePersistenceGateway;
import io.burnlock.timelock.ChainHeightSource;
import io.burnlock.timelock.TimeLockEvaluator;
import io.burnlock.timer.TimerDriver;
import io.burnlock.timer.TimerHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

public final class LifecycleEngine implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(LifecycleEngine.class);

    private final BurnlockConfig config;
    private final EngineSettings settings;
    private final Database database;
    private final PersistenceGateway gateway;
    private final TimerDriver timer;
    private final boolean ownsTimer;
    private final AuditLogger audit;
    private final BurnScheduler scheduler;
    private final HandshakeTracker handshakes;
    private final MessageLifecycleService messages;
    private final KeyLossRecorder keyLoss;
    private final Object lifecycleLock = new Object();
    private Phase phase = Phase.NEW;
    private TimerHandle sweepHandle;

    public LifecycleEngine(BurnlockConfig config, TimerDriver timer, ChainHeightSource chainHeight) {
        this(config, EngineSettings.load(config.settingsFile()), timer, false, chainHeight);
    }

    public LifecycleEngine(BurnlockConfig config, EngineSettings settings, TimerDriver timer, boolean ownsTimer,
                           ChainHeightSource chainHeight) {
        this.config = config;
        this.settings = settings;
        this.timer = timer;
        this.ownsTimer = ownsTimer;
        this.database = new Database(config);
        this.gateway = new SqlitePersistenceGateway(database);
        this.audit = new AuditLogger(config.auditFile(), timer.clock());
        this.scheduler = new BurnScheduler(gateway, timer, audit, settings);
        this.handshakes = new HandshakeTracker(gateway, audit, timer.clock(), settings);
        this.messages = new MessageLifecycleService(
                gateway,
                scheduler,
                new TimeLockEvaluator(settings.unlockMaxFutureHeight()),
                chainHeight,
                audit,
                timer.clock()
        );
        this.keyLoss = new KeyLossRecorder(gateway, audit, timer.clock());
    }

    /**
     * Creates the schema if needed and binds the notification sink. Must precede {@link #loadPending()}.
     */
    public void initialize(NotificationSink sink) {
        synchronized (lifecycleLock) {
            if (phase != Phase.NEW) {
                throw new IllegalStateException("Engine cannot initialize from phase " + phase);
            }
            database.init();
            scheduler.initialize(sink);
            phase = Phase.INITIALIZED;
        }
        audit.log(AuditLogger.AuditEvent.of("engine.initialize", "engine", config.rootDir().toString(), "ok", Map.of()));
    }

    /**
     * Re-arms every durable burn deadline and starts the handshake expiry sweep. Call once,
     * before accepting traffic.
     */
    public int loadPending() {
        int loaded;
        synchronized (lifecycleLock) {
            if (phase != Phase.INITIALIZED) {
                throw new IllegalStateException("loadPending() requires an initialized engine, phase=" + phase);
            }
            loaded = scheduler.loadPending();
            long interval = settings.handshakeSweepIntervalMs();
            sweepHandle = timer.schedulePeriodic(interval, interval, this::sweepHandshakes);
            phase = Phase.RUNNING;
        }
        audit.log(AuditLogger.AuditEvent.of("engine.load_pending", "engine", config.rootDir().toString(), "ok",
                Map.of("pending_burns", loaded)));
        return loaded;
    }

    /**
     * Disarms timers without burning anything; the next start picks them up via {@link #loadPending()}.
     */
    public void shutdown() {
        synchronized (lifecycleLock) {
            if (phase == Phase.STOPPED) {
                return;
            }
            Phase previous = phase;
            phase = Phase.STOPPED;
            if (sweepHandle != null) {
                sweepHandle.cancel();
                sweepHandle = null;
            }
            if (previous != Phase.NEW) {
                scheduler.shutdown();
                audit.log(AuditLogger.AuditEvent.of("engine.shutdown", "engine", config.rootDir().toString(), "ok", Map.of()));
            }
            if (ownsTimer) {
                timer.close();
            }
        }
        LOG.info("Lifecycle engine stopped");
    }

    @Override
    public void close() {
        shutdown();
    }

    private void sweepHandshakes() {
        try {
            List<String> expired = handshakes.sweepExpired();
            if (!expired.isEmpty()) {
                LOG.debug("Expired handshakes: {}", expired);
            }
        } catch (RuntimeException e) {
            LOG.warn("Handshake expiry sweep failed; retrying next period: {}", e.getMessage(), e);
        }
    }

    public BurnlockConfig config() {
        return config;
    }

    public EngineSettings settings() {
        return settings;
    }

    public Database database() {
        return database;
    }

    public PersistenceGateway gateway() {
        return gateway;
    }

    public AuditLogger audit() {
        return audit;
    }

    public BurnScheduler scheduler() {
        return scheduler;
    }

    public HandshakeTracker handshakes() {
        return handshakes;
    }

    public MessageLifecycleService messages() {
        return messages;
    }

    public KeyLossRecorder keyLoss() {
        return keyLoss;
    }

    private enum Phase {
        NEW,
        INITIALIZED,
        RUNNING,
        STOPPED
    }
}
