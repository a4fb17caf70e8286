package io.burnlock.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class BurnlockConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE = "burnlock-settings.json";

    private final Path rootDir;

    public BurnlockConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static BurnlockConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new BurnlockConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("burnlock.db");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path notificationsRoot() {
        return rootDir.resolve("notifications");
    }

    public Path burnOutboxFile() {
        return notificationsRoot().resolve("burned.jsonl");
    }
}
