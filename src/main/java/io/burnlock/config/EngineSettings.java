package io.burnlock.config;

import io.burnlock.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Tunables for the lifecycle engine, read from {@code burnlock-settings.json} under the data root.
 *
 * <p>Every field in the file is optional. Missing or out-of-range values fall back to the
 * defaults below, clamped to a minimum, so a partial file is always usable. A file that
 * cannot be parsed is a startup error.
 */
public record EngineSettings(
        int burnMaxAttempts,
        long burnBaseBackoffMs,
        long burnMaxBackoffMs,
        long handshakePendingTtlMs,
        long handshakeActiveTtlMs,
        long handshakeSweepIntervalMs,
        long unlockMaxFutureHeight
) {
    public static final int DEFAULT_BURN_MAX_ATTEMPTS = 5;
    public static final long DEFAULT_BURN_BASE_BACKOFF_MS = 1_000L;
    public static final long DEFAULT_BURN_MAX_BACKOFF_MS = 60_000L;
    public static final long DEFAULT_HANDSHAKE_PENDING_TTL_MS = Duration.ofHours(24).toMillis();
    public static final long DEFAULT_HANDSHAKE_ACTIVE_TTL_MS = 0L;
    public static final long DEFAULT_HANDSHAKE_SWEEP_INTERVAL_MS = 60_000L;
    // ~1 year of 10 minute blocks
    public static final long DEFAULT_UNLOCK_MAX_FUTURE_HEIGHT = 52_560L;

    public static EngineSettings defaults() {
        return new EngineSettings(
                DEFAULT_BURN_MAX_ATTEMPTS,
                DEFAULT_BURN_BASE_BACKOFF_MS,
                DEFAULT_BURN_MAX_BACKOFF_MS,
                DEFAULT_HANDSHAKE_PENDING_TTL_MS,
                DEFAULT_HANDSHAKE_ACTIVE_TTL_MS,
                DEFAULT_HANDSHAKE_SWEEP_INTERVAL_MS,
                DEFAULT_UNLOCK_MAX_FUTURE_HEIGHT
        );
    }

    public static EngineSettings load(Path settingsFile) {
        if (settingsFile == null || !Files.exists(settingsFile)) {
            return defaults();
        }
        try {
            SettingsFile file = Jsons.mapper().readValue(settingsFile.toFile(), SettingsFile.class);
            return fromFile(file, defaults());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load engine settings: " + settingsFile, e);
        }
    }

    static EngineSettings fromFile(SettingsFile file, EngineSettings defaults) {
        if (file == null) {
            return defaults;
        }
        int maxAttempts = sanitizeInt(file.burnMaxAttempts(), defaults.burnMaxAttempts(), 1);
        long baseBackoff = sanitizeLong(file.burnBaseBackoffMs(), defaults.burnBaseBackoffMs(), 1L);
        long maxBackoff = sanitizeLong(file.burnMaxBackoffMs(), defaults.burnMaxBackoffMs(), baseBackoff);
        if (maxBackoff < baseBackoff) {
            maxBackoff = baseBackoff;
        }
        long pendingTtl = sanitizeLong(file.handshakePendingTtlMs(), defaults.handshakePendingTtlMs(), 1_000L);
        long activeTtl = sanitizeLong(file.handshakeActiveTtlMs(), defaults.handshakeActiveTtlMs(), 0L);
        long sweepInterval = sanitizeLong(file.handshakeSweepIntervalMs(), defaults.handshakeSweepIntervalMs(), 1_000L);
        long unlockHorizon = sanitizeLong(file.unlockMaxFutureHeight(), defaults.unlockMaxFutureHeight(), 1L);
        return new EngineSettings(
                maxAttempts,
                baseBackoff,
                maxBackoff,
                pendingTtl,
                activeTtl,
                sweepInterval,
                unlockHorizon
        );
    }

    public EngineSettings withBurnRetry(int maxAttempts, long baseBackoffMs, long maxBackoffMs) {
        return new EngineSettings(
                Math.max(1, maxAttempts),
                Math.max(1L, baseBackoffMs),
                Math.max(Math.max(1L, baseBackoffMs), maxBackoffMs),
                handshakePendingTtlMs,
                handshakeActiveTtlMs,
                handshakeSweepIntervalMs,
                unlockMaxFutureHeight
        );
    }

    public EngineSettings withHandshakeTtl(long pendingTtlMs, long activeTtlMs) {
        return new EngineSettings(
                burnMaxAttempts,
                burnBaseBackoffMs,
                burnMaxBackoffMs,
                Math.max(1L, pendingTtlMs),
                Math.max(0L, activeTtlMs),
                handshakeSweepIntervalMs,
                unlockMaxFutureHeight
        );
    }

    private static long sanitizeLong(Long value, long fallback, long min) {
        if (value == null) {
            return fallback;
        }
        return value < min ? fallback : value;
    }

    private static int sanitizeInt(Integer value, int fallback, int min) {
        if (value == null) {
            return fallback;
        }
        return value < min ? fallback : value;
    }

    record SettingsFile(
            Integer burnMaxAttempts,
            Long burnBaseBackoffMs,
            Long burnMaxBackoffMs,
            Long handshakePendingTtlMs,
            Long handshakeActiveTtlMs,
            Long handshakeSweepIntervalMs,
            Long unlockMaxFutureHeight
    ) {
    }
}
