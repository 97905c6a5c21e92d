package io.looming.config;

import com.fasterxml.jackson.databind.JsonNode;
import io.looming.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runtime settings resolved from {@code looming-settings.json}.
 *
 * <p>Every field in the file is optional. Missing or out-of-range values fall
 * back to the defaults in {@link LoomingConfig}.
 */
public record LoomingSettings(
        long pollIntervalMs,
        int workerThreads,
        int workerQueueCapacity,
        long leaseTimeoutMs,
        int maxConsecutiveFailures,
        boolean autoPause,
        long pauseCooldownMs,
        int backendMaxRetries,
        long baseBackoffMs,
        long maxBackoffMs,
        double minOutputTokenRatio,
        int charsPerToken,
        int persistenceFailureThreshold,
        long persistenceCooldownMs,
        int historyAutoSummaryChars,
        List<TaskDeclaration> tasks,
        List<BackendDeclaration> backends,
        Map<String, List<String>> actorPermissions
) {
    public LoomingSettings {
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
        backends = backends == null ? List.of() : List.copyOf(backends);
        actorPermissions = actorPermissions == null ? null : Map.copyOf(actorPermissions);
    }

    public static LoomingSettings defaults() {
        return new LoomingSettings(
                LoomingConfig.DEFAULT_POLL_INTERVAL_MS,
                LoomingConfig.DEFAULT_WORKER_THREADS,
                LoomingConfig.DEFAULT_WORKER_QUEUE_CAPACITY,
                LoomingConfig.DEFAULT_LEASE_TIMEOUT_MS,
                LoomingConfig.DEFAULT_MAX_CONSECUTIVE_FAILURES,
                true,
                0L,
                LoomingConfig.DEFAULT_BACKEND_MAX_RETRIES,
                LoomingConfig.DEFAULT_BASE_BACKOFF_MS,
                LoomingConfig.DEFAULT_MAX_BACKOFF_MS,
                LoomingConfig.DEFAULT_MIN_OUTPUT_TOKEN_RATIO,
                LoomingConfig.DEFAULT_CHARS_PER_TOKEN,
                LoomingConfig.DEFAULT_PERSISTENCE_FAILURE_THRESHOLD,
                LoomingConfig.DEFAULT_PERSISTENCE_COOLDOWN_MS,
                LoomingConfig.DEFAULT_HISTORY_AUTO_SUMMARY_CHARS,
                List.of(),
                List.of(),
                null
        );
    }

    public static LoomingSettings load(Path file) {
        if (file == null || !Files.exists(file)) {
            return defaults();
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults());
        } catch (IOException e) {
            throw new RuntimeException("Failed to load settings: " + file, e);
        }
    }

    static LoomingSettings fromFile(SettingsFile file, LoomingSettings defaults) {
        if (file == null) {
            return defaults;
        }
        long baseBackoff = sanitizeLong(file.baseBackoffMs(), defaults.baseBackoffMs(), 0L);
        long maxBackoff = sanitizeLong(file.maxBackoffMs(), defaults.maxBackoffMs(), 0L);
        if (maxBackoff < baseBackoff) {
            maxBackoff = baseBackoff;
        }
        double ratio = file.minOutputTokenRatio() == null || file.minOutputTokenRatio() < 0d
                ? defaults.minOutputTokenRatio()
                : file.minOutputTokenRatio();
        List<TaskDeclaration> tasks = new ArrayList<>();
        if (file.tasks() != null) {
            for (TaskDeclaration task : file.tasks()) {
                if (task == null || task.taskId() == null || task.taskId().isBlank()) {
                    throw new IllegalArgumentException("Task declaration requires taskId");
                }
                tasks.add(task);
            }
        }
        List<BackendDeclaration> backends = new ArrayList<>();
        if (file.backends() != null) {
            for (BackendDeclaration backend : file.backends()) {
                if (backend == null || backend.prefix() == null || backend.prefix().isBlank()
                        || backend.command() == null || backend.command().isEmpty()) {
                    throw new IllegalArgumentException("Backend declaration requires prefix and command");
                }
                backends.add(backend);
            }
        }
        return new LoomingSettings(
                sanitizeLong(file.pollIntervalMs(), defaults.pollIntervalMs(), 10L),
                sanitizeInt(file.workerThreads(), defaults.workerThreads(), 1),
                sanitizeInt(file.workerQueueCapacity(), defaults.workerQueueCapacity(), 1),
                sanitizeLong(file.leaseTimeoutMs(), defaults.leaseTimeoutMs(), 1_000L),
                sanitizeInt(file.maxConsecutiveFailures(), defaults.maxConsecutiveFailures(), 1),
                file.autoPause() == null ? defaults.autoPause() : file.autoPause(),
                sanitizeLong(file.pauseCooldownMs(), defaults.pauseCooldownMs(), 0L),
                sanitizeInt(file.backendMaxRetries(), defaults.backendMaxRetries(), 0),
                baseBackoff,
                maxBackoff,
                ratio,
                sanitizeInt(file.charsPerToken(), defaults.charsPerToken(), 1),
                sanitizeInt(file.persistenceFailureThreshold(), defaults.persistenceFailureThreshold(), 1),
                sanitizeLong(file.persistenceCooldownMs(), defaults.persistenceCooldownMs(), 0L),
                sanitizeInt(file.historyAutoSummaryChars(), defaults.historyAutoSummaryChars(), 1),
                tasks,
                backends,
                file.actorPermissions() == null ? defaults.actorPermissions() : file.actorPermissions()
        );
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null || raw < min) {
            return fallback;
        }
        return raw;
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null || raw < min) {
            return fallback;
        }
        return raw;
    }

    /**
     * One scheduled task: an actor running a narrative file on a schedule.
     */
    public record TaskDeclaration(
            String taskId,
            String actor,
            String narrative,
            JsonNode schedule,
            Map<String, Object> metadata
    ) {
    }

    /**
     * A script backend serving every model whose name starts with {@code prefix}.
     */
    public record BackendDeclaration(String prefix, List<String> command, Long timeoutMs) {
        public long effectiveTimeoutMs() {
            return timeoutMs == null || timeoutMs <= 0 ? LoomingConfig.DEFAULT_BACKEND_TIMEOUT_MS : timeoutMs;
        }
    }

    record SettingsFile(
            Long pollIntervalMs,
            Integer workerThreads,
            Integer workerQueueCapacity,
            Long leaseTimeoutMs,
            Integer maxConsecutiveFailures,
            Boolean autoPause,
            Long pauseCooldownMs,
            Integer backendMaxRetries,
            Long baseBackoffMs,
            Long maxBackoffMs,
            Double minOutputTokenRatio,
            Integer charsPerToken,
            Integer persistenceFailureThreshold,
            Long persistenceCooldownMs,
            Integer historyAutoSummaryChars,
            List<TaskDeclaration> tasks,
            List<BackendDeclaration> backends,
            Map<String, List<String>> actorPermissions
    ) {
    }
}
