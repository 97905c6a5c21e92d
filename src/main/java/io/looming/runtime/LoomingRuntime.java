package io.looming.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.looming.backend.BackendRegistry;
import io.looming.backend.EchoBackend;
import io.looming.backend.GenerationBackend;
import io.looming.backend.ScriptBackend;
import io.looming.config.LoomingConfig;
import io.looming.config.LoomingSettings;
import io.looming.input.BudgetGuard;
import io.looming.input.HistorySummarizer;
import io.looming.input.InputResolver;
import io.looming.model.ActExecution;
import io.looming.model.ActInput;
import io.looming.model.ActorExecution;
import io.looming.model.NarrativeDefinition;
import io.looming.model.NarrativeExecution;
import io.looming.model.ProcessorResult;
import io.looming.model.TaskState;
import io.looming.narrative.NarrativeDefinitionLoader;
import io.looming.narrative.NarrativeExecutor;
import io.looming.narrative.NarrativeRunResult;
import io.looming.narrative.RetryPolicy;
import io.looming.narrative.RunRequest;
import io.looming.narrative.Sleeper;
import io.looming.observability.AuditLogger;
import io.looming.platform.Platform;
import io.looming.platform.PlatformRegistry;
import io.looming.processor.ContentDeduplicator;
import io.looming.processor.ProcessorRegistry;
import io.looming.scheduler.ExecutionTracker;
import io.looming.scheduler.NarrativeTaskRunner;
import io.looming.scheduler.SchedulePolicy;
import io.looming.scheduler.Schedules;
import io.looming.scheduler.TaskOutcome;
import io.looming.scheduler.TaskScheduler;
import io.looming.security.ActionPolicyGate;
import io.looming.security.SecurityGate;
import io.looming.state.StateScope;
import io.looming.state.StateStore;
import io.looming.state.StateValue;
import io.looming.storage.ContentStore;
import io.looming.storage.Database;
import io.looming.storage.NarrativeStore;
import io.looming.storage.PersistenceCircuitBreaker;
import io.looming.storage.StateEntryStore;
import io.looming.storage.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * Wires storage, the narrative engine and the scheduler for one data root.
 */
public final class LoomingRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(LoomingRuntime.class);
    private static final long SHUTDOWN_GRACE_MS = 15_000L;

    private final LoomingConfig config;
    private final Clock clock;
    private final Random random;
    private final LoomingSettings settings;
    private final Database database;
    private final NarrativeStore narratives;
    private final TaskStore taskStore;
    private final ContentStore content;
    private final StateStore state;
    private final AuditLogger auditLogger;
    private final BackendRegistry backends;
    private final PlatformRegistry platforms;
    private final NarrativeDefinitionLoader loader;
    private final NarrativeExecutor executor;
    private final ExecutionTracker tracker;
    private final TaskScheduler scheduler;
    private volatile long settingsFileMtimeMs;
    private volatile long lastSettingsCheckMs;

    public LoomingRuntime(LoomingConfig config) {
        this(config, List.of(), Clock.systemUTC(), Sleeper.system());
    }

    public LoomingRuntime(LoomingConfig config, List<Platform> platformBindings, Clock clock, Sleeper sleeper) {
        this.config = config;
        this.clock = clock;
        this.random = new Random();
        this.settings = LoomingSettings.load(config.settingsFile());
        this.settingsFileMtimeMs = settingsMtime();
        PersistenceCircuitBreaker breaker = new PersistenceCircuitBreaker(
                settings.persistenceFailureThreshold(),
                Duration.ofMillis(settings.persistenceCooldownMs()),
                clock
        );
        this.database = new Database(config, breaker);
        this.narratives = new NarrativeStore(database);
        this.taskStore = new TaskStore(database);
        this.content = new ContentStore(database);
        this.state = new StateStore(new StateEntryStore(database), clock);
        this.auditLogger = new AuditLogger(config.auditFile(), clock);
        this.backends = buildBackends(settings);
        this.platforms = new PlatformRegistry(platformBindings);
        SecurityGate gate = settings.actorPermissions() == null
                ? SecurityGate.allowAll()
                : new ActionPolicyGate(settings.actorPermissions());
        InputResolver resolver = new InputResolver(content, platforms, gate, state, config.narrativesRoot(), auditLogger);
        this.loader = new NarrativeDefinitionLoader(config.narrativesRoot());
        this.executor = new NarrativeExecutor(
                narratives,
                resolver,
                state,
                backends,
                ProcessorRegistry.withDefaults(),
                content,
                new ContentDeduplicator(content),
                new NarrativeExecutor.Settings(
                        new RetryPolicy(settings.backendMaxRetries(), settings.baseBackoffMs(), settings.maxBackoffMs()),
                        new BudgetGuard(settings.minOutputTokenRatio(), settings.charsPerToken()),
                        new HistorySummarizer(settings.historyAutoSummaryChars())
                ),
                sleeper,
                auditLogger,
                clock
        );
        this.tracker = new ExecutionTracker(
                taskStore,
                new ExecutionTracker.Settings(
                        settings.maxConsecutiveFailures(),
                        settings.autoPause(),
                        settings.pauseCooldownMs()
                ),
                auditLogger,
                clock
        );
        this.scheduler = new TaskScheduler(
                taskStore,
                tracker,
                new NarrativeTaskRunner(loader, executor),
                breaker,
                new TaskScheduler.Settings(
                        settings.pollIntervalMs(),
                        settings.workerThreads(),
                        settings.workerQueueCapacity(),
                        settings.leaseTimeoutMs(),
                        SHUTDOWN_GRACE_MS
                ),
                auditLogger,
                clock,
                random
        );
    }

    /**
     * Creates directories and schema and registers the tasks declared in the
     * settings file. Safe to call from any command while a scheduler runs.
     */
    public InitOutcome init() {
        database.init();
        try {
            Files.createDirectories(config.narrativesRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to create narratives directory: " + config.narrativesRoot(), e);
        }
        List<String> registered = registerDeclaredTasks(settings.tasks());
        return new InitOutcome(
                config.rootDir().toString(),
                config.dbFile().toString(),
                registered,
                backends.prefixes()
        );
    }

    /**
     * Re-reads the settings file when its modification time changed and
     * registers any newly declared tasks. Engine settings (pool size, retry
     * policy, thresholds) apply on the next start.
     */
    public SettingsReloadOutcome maybeReloadSettings(long minIntervalMs) {
        long nowMs = clock.millis();
        String path = config.settingsFile().toString();
        if (nowMs - lastSettingsCheckMs < Math.max(0L, minIntervalMs)) {
            return new SettingsReloadOutcome(false, path, "skip_interval", List.of(), nowMs);
        }
        lastSettingsCheckMs = nowMs;
        long mtime = settingsMtime();
        if (mtime == settingsFileMtimeMs) {
            return new SettingsReloadOutcome(false, path, "unchanged", List.of(), nowMs);
        }
        LoomingSettings reloaded;
        try {
            reloaded = LoomingSettings.load(config.settingsFile());
        } catch (RuntimeException e) {
            log.warn("Settings reload failed, keeping current settings: {}", e.getMessage());
            return new SettingsReloadOutcome(false, path, "invalid: " + e.getMessage(), List.of(), nowMs);
        }
        settingsFileMtimeMs = mtime;
        List<String> registered = registerDeclaredTasks(reloaded.tasks());
        log.info("Settings reloaded from {}, new tasks={}", path, registered);
        return new SettingsReloadOutcome(true, path, "reloaded", registered, nowMs);
    }

    /**
     * Registers one task. An existing task keeps its schedule position and
     * failure counters; only its actor, narrative and metadata are refreshed.
     */
    public boolean registerTask(LoomingSettings.TaskDeclaration declaration) {
        SchedulePolicy policy = declaration.schedule() == null
                ? SchedulePolicy.immediate()
                : SchedulePolicy.fromJson(declaration.schedule());
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (declaration.metadata() != null) {
            metadata.putAll(declaration.metadata());
        }
        metadata.put(SchedulePolicy.METADATA_KEY, policy.toMetadata());
        long nowMs = clock.millis();
        long firstRunMs = Schedules.firstRun(clock.instant(), policy).toEpochMilli();
        boolean created = taskStore.register(new TaskStore.TaskRegistration(
                declaration.taskId(),
                declaration.actor() == null ? RunRequest.ADHOC_ACTOR : declaration.actor(),
                declaration.narrative(),
                metadata,
                firstRunMs,
                nowMs
        ));
        if (created) {
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "task.registered",
                    declaration.actor(),
                    declaration.narrative(),
                    "ok",
                    Map.of("first_run_ms", firstRunMs)
            ).withTask(declaration.taskId()));
        }
        return created;
    }

    public NarrativeRunResult runNarrative(String nameOrPath, String actorName) {
        NarrativeDefinition definition = loader.load(nameOrPath);
        String actor = actorName == null || actorName.isBlank() ? RunRequest.ADHOC_ACTOR : actorName;
        return executor.run(definition, new RunRequest(actor, null, null));
    }

    /**
     * One scheduler poll on the calling thread.
     */
    public List<TaskOutcome> tick() {
        return scheduler.runDueNow();
    }

    /**
     * Fails the runs a dead scheduler left RUNNING, then starts polling.
     *
     * @return number of interrupted executions marked failed
     */
    public int startScheduler() {
        int interrupted = recoverInterrupted();
        scheduler.start();
        return interrupted;
    }

    /**
     * Fails RUNNING executions older than one lease timeout whose task holds
     * no live lease. A live scheduler renews its leases, so its runs are kept.
     */
    public int recoverInterrupted() {
        long nowMs = clock.millis();
        int interrupted = narratives.failInterrupted(nowMs - settings.leaseTimeoutMs(), nowMs);
        if (interrupted > 0) {
            log.warn("Marked {} interrupted narrative executions as failed", interrupted);
        }
        return interrupted;
    }

    public List<TaskState> listTasks(int limit) {
        return taskStore.list(limit);
    }

    public Optional<TaskView> getTask(String taskId, int historyLimit) {
        return taskStore.get(taskId)
                .map(t -> new TaskView(t, taskStore.listActorExecutions(taskId, historyLimit)));
    }

    public boolean pauseTask(String taskId) {
        return tracker.pause(taskId);
    }

    public boolean resumeTask(String taskId) {
        return tracker.resume(taskId);
    }

    public List<NarrativeExecution> listExecutions(String narrativeName, int limit) {
        return narratives.listExecutions(narrativeName, limit);
    }

    public Optional<ExecutionView> getExecution(String executionId) {
        return narratives.getExecution(executionId).map(execution -> {
            List<ActView> acts = new ArrayList<>();
            for (ActExecution act : narratives.listActs(executionId)) {
                acts.add(new ActView(act, narratives.listInputs(act.id())));
            }
            return new ExecutionView(execution, acts, narratives.listProcessorResults(executionId));
        });
    }

    public Map<String, JsonNode> stateSnapshot(StateScope scope) {
        Map<String, JsonNode> out = new LinkedHashMap<>();
        for (Map.Entry<String, StateValue> e : state.snapshot(scope).entrySet()) {
            out.put(e.getKey(), e.getValue().asNode());
        }
        return out;
    }

    /**
     * Operator write into an actor scope. Narratives of that actor read it as {@code {state:key}}.
     */
    public StateValue setActorState(String actor, String key, StateValue value) {
        if (actor == null || actor.isBlank()) {
            throw new IllegalArgumentException("actor must not be blank");
        }
        state.put(StateScope.actor(actor), key, value);
        auditLogger.log(AuditLogger.AuditEvent.of(
                "state.set",
                "operator",
                "actor:" + actor,
                "ok",
                Map.of("key", key, "kind", value.kind().name())
        ));
        return value;
    }

    public StatusView status() {
        return new StatusView(
                database.breaker().state().name(),
                database.breaker().failureCount(),
                scheduler.degraded(),
                scheduler.inFlightCount(),
                auditLogger.verifyChain() < 0
        );
    }

    public LoomingSettings settings() {
        return settings;
    }

    public LoomingConfig config() {
        return config;
    }

    @Override
    public void close() {
        scheduler.close();
    }

    private List<String> registerDeclaredTasks(List<LoomingSettings.TaskDeclaration> declarations) {
        List<String> registered = new ArrayList<>();
        for (LoomingSettings.TaskDeclaration declaration : declarations) {
            if (registerTask(declaration)) {
                registered.add(declaration.taskId());
            }
        }
        return registered;
    }

    private static BackendRegistry buildBackends(LoomingSettings settings) {
        BackendRegistry registry = new BackendRegistry();
        GenerationBackend echo = new EchoBackend();
        registry.register(echo.name(), echo);
        for (LoomingSettings.BackendDeclaration declaration : settings.backends()) {
            registry.register(
                    declaration.prefix(),
                    new ScriptBackend(declaration.prefix(), declaration.command(), declaration.effectiveTimeoutMs())
            );
        }
        return registry;
    }

    private long settingsMtime() {
        Path file = config.settingsFile();
        try {
            return Files.exists(file) ? Files.getLastModifiedTime(file).toMillis() : -1L;
        } catch (IOException e) {
            log.warn("Cannot read settings mtime {}: {}", file, e.getMessage());
            return -1L;
        }
    }

    public record InitOutcome(
            String root,
            String database,
            List<String> tasksRegistered,
            List<String> backendPrefixes
    ) {
    }

    public record SettingsReloadOutcome(
            boolean changed,
            String settingsFile,
            String reason,
            List<String> tasksRegistered,
            long checkedAtMs
    ) {
    }

    public record TaskView(TaskState task, List<ActorExecution> recentRuns) {
    }

    public record ActView(ActExecution act, List<ActInput> inputs) {
    }

    public record ExecutionView(NarrativeExecution execution, List<ActView> acts, List<ProcessorResult> processorResults) {
    }

    public record StatusView(
            String persistenceCircuit,
            int persistenceFailures,
            boolean schedulerDegraded,
            int inFlightTasks,
            boolean auditChainIntact
    ) {
    }
}
