package io.looming.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class LoomingConfig {
    public static final String SETTINGS_FILE = "looming-settings.json";
    public static final long DEFAULT_POLL_INTERVAL_MS = 1_000L;
    public static final int DEFAULT_WORKER_THREADS = 4;
    public static final int DEFAULT_WORKER_QUEUE_CAPACITY = 16;
    public static final long DEFAULT_LEASE_TIMEOUT_MS = 15L * 60L * 1000L;
    public static final int DEFAULT_MAX_CONSECUTIVE_FAILURES = 5;
    public static final int DEFAULT_BACKEND_MAX_RETRIES = 2;
    public static final long DEFAULT_BASE_BACKOFF_MS = 1_000L;
    public static final long DEFAULT_MAX_BACKOFF_MS = 30_000L;
    public static final double DEFAULT_MIN_OUTPUT_TOKEN_RATIO = 0.1d;
    public static final int DEFAULT_CHARS_PER_TOKEN = 4;
    public static final int DEFAULT_PERSISTENCE_FAILURE_THRESHOLD = 5;
    public static final long DEFAULT_PERSISTENCE_COOLDOWN_MS = 30_000L;
    public static final int DEFAULT_HISTORY_AUTO_SUMMARY_CHARS = 10_000;
    public static final long DEFAULT_BACKEND_TIMEOUT_MS = 120_000L;

    private final Path rootDir;

    public LoomingConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static LoomingConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        return new LoomingConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("looming.db");
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

    public Path narrativesRoot() {
        return rootDir.resolve("narratives");
    }
}
