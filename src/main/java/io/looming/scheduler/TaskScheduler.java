package io.looming.scheduler;

import io.looming.model.TaskState;
import io.looming.narrative.CancellationToken;
import io.looming.observability.AuditLogger;
import io.looming.storage.PersistenceCircuitBreaker;
import io.looming.storage.PersistenceException;
import io.looming.storage.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single polling loop feeding a bounded worker pool.
 *
 * <p>Each poll claims due tasks one by one. A claim takes the task's lease and
 * advances its next run time in the same store update, so a run that outlasts
 * its interval is never dispatched twice. Leases of running tasks are renewed
 * every third of the lease timeout; a run whose lease was lost is cancelled.
 * While the persistence circuit is open the scheduler stops dispatching and
 * only logs.
 */
public final class TaskScheduler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TaskScheduler.class);

    private final TaskStore tasks;
    private final ExecutionTracker tracker;
    private final TaskRunner runner;
    private final PersistenceCircuitBreaker persistence;
    private final Settings settings;
    private final AuditLogger audit;
    private final Clock clock;
    private final Random random;
    private final String ownerId;
    private final Map<String, Lease> inFlight = new ConcurrentHashMap<>();

    private ThreadPoolExecutor workers;
    private ScheduledExecutorService poller;
    private volatile boolean degraded;

    public TaskScheduler(
            TaskStore tasks,
            ExecutionTracker tracker,
            TaskRunner runner,
            PersistenceCircuitBreaker persistence,
            Settings settings,
            AuditLogger audit,
            Clock clock,
            Random random
    ) {
        this.tasks = tasks;
        this.tracker = tracker;
        this.runner = runner;
        this.persistence = persistence;
        this.settings = settings;
        this.audit = audit;
        this.clock = clock;
        this.random = random;
        this.ownerId = "scheduler-" + UUID.randomUUID().toString().substring(0, 8);
    }

    public synchronized void start() {
        if (poller != null) {
            throw new IllegalStateException("Scheduler already started");
        }
        workers = new ThreadPoolExecutor(
                settings.workerThreads(),
                settings.workerThreads(),
                60L,
                TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(settings.queueCapacity()),
                new NamedThreadFactory("looming-worker"),
                new ThreadPoolExecutor.AbortPolicy());
        poller = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("looming-poller"));
        poller.scheduleWithFixedDelay(this::pollSafely, 0L, settings.pollIntervalMs(), TimeUnit.MILLISECONDS);
        poller.scheduleWithFixedDelay(this::renewLeasesSafely, heartbeatMs(), heartbeatMs(), TimeUnit.MILLISECONDS);
        log.info("Scheduler {} started workers={} queue={} poll={}ms",
                ownerId, settings.workerThreads(), settings.queueCapacity(), settings.pollIntervalMs());
    }

    /**
     * One poll: claims due tasks up to free worker capacity and hands them to the pool.
     *
     * @return number of tasks dispatched
     */
    public int pollOnce() {
        ThreadPoolExecutor pool = workers;
        if (pool == null) {
            throw new IllegalStateException("Scheduler not started");
        }
        int capacity = settings.workerThreads() + settings.queueCapacity() - inFlight.size();
        int dispatched = 0;
        for (Lease lease : claimDue(capacity)) {
            try {
                pool.execute(() -> execute(lease));
                dispatched++;
            } catch (RejectedExecutionException e) {
                log.warn("Worker pool full, returning task {} to the store", lease.task().taskId());
                inFlight.remove(lease.task().taskId(), lease);
                tasks.releaseLease(lease.task().taskId(), lease.token(), clock.millis());
            }
        }
        return dispatched;
    }

    /**
     * Claims and runs every due task on the calling thread. Used for single
     * ticks from the command line and in tests.
     */
    public List<TaskOutcome> runDueNow() {
        List<Lease> leases = claimDue(Integer.MAX_VALUE);
        if (leases.isEmpty()) {
            return List.of();
        }
        ScheduledExecutorService heartbeat = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("looming-heartbeat"));
        heartbeat.scheduleWithFixedDelay(this::renewLeasesSafely, heartbeatMs(), heartbeatMs(), TimeUnit.MILLISECONDS);
        try {
            List<TaskOutcome> outcomes = new ArrayList<>();
            for (Lease lease : leases) {
                outcomes.add(execute(lease));
            }
            return outcomes;
        } finally {
            heartbeat.shutdownNow();
        }
    }

    /**
     * Extends the lease of every task running here. A task whose lease was
     * taken over is asked to stop before its next act.
     *
     * @return number of leases renewed
     */
    public int renewLeases() {
        int renewed = 0;
        for (Lease lease : inFlight.values()) {
            long nowMs = clock.millis();
            String taskId = lease.task().taskId();
            if (tasks.heartbeatLease(taskId, lease.token(), nowMs + settings.leaseTimeoutMs(), nowMs)) {
                renewed++;
            } else if (inFlight.get(taskId) == lease) {
                log.warn("Task {} lost its lease, cancelling the run", taskId);
                lease.cancellation().cancel();
            }
        }
        return renewed;
    }

    /**
     * Takes the task's lease if it is still due and unleased.
     */
    public Optional<Lease> tryClaim(TaskState task) {
        if (inFlight.containsKey(task.taskId())) {
            log.debug("Task {} is still running here, not claiming again", task.taskId());
            return Optional.empty();
        }
        long nowMs = clock.millis();
        SchedulePolicy policy;
        try {
            policy = SchedulePolicy.fromMetadata(task.metadata());
        } catch (IllegalArgumentException e) {
            log.error("Task {} has an invalid schedule, pausing it: {}", task.taskId(), e.getMessage());
            tracker.pause(task.taskId());
            return Optional.empty();
        }
        Long nextRunMs = Schedules.nextRun(Instant.ofEpochMilli(nowMs), policy, random)
                .map(Instant::toEpochMilli)
                .orElse(null);
        String token = UUID.randomUUID().toString();
        boolean claimed = tasks.tryClaim(task.taskId(), ownerId, token, nextRunMs, nowMs + settings.leaseTimeoutMs(), nowMs);
        if (!claimed) {
            log.debug("Task {} already claimed or no longer due", task.taskId());
            return Optional.empty();
        }
        Lease lease = new Lease(task, token, new CancellationToken());
        inFlight.put(task.taskId(), lease);
        audit("task.dispatched", task, Map.<String, Object>of("next_run_ms", nextRunMs == null ? "none" : nextRunMs));
        return Optional.of(lease);
    }

    /**
     * Runs a claimed task, records the outcome with the tracker, then releases the lease.
     */
    public TaskOutcome execute(Lease lease) {
        TaskState task = lease.task();
        TaskOutcome outcome;
        try {
            long actorExecutionId = tasks.startActorExecution(task.taskId(), task.actorName(), clock.millis());
            try {
                outcome = runner.run(task, lease.cancellation());
            } catch (RuntimeException e) {
                log.error("Task {} runner threw", task.taskId(), e);
                outcome = TaskOutcome.failed(null, e.getClass().getSimpleName() + ": " + e.getMessage());
            }
            tasks.finishActorExecution(actorExecutionId, outcome.narrativeExecutionId(), outcome.success(), outcome.error(), clock.millis());
            if (outcome.success()) {
                tracker.recordSuccess(task.taskId());
            } else {
                tracker.recordFailure(task.taskId(), outcome.error());
            }
            tasks.releaseLease(task.taskId(), lease.token(), clock.millis());
        } catch (PersistenceException e) {
            log.error("Task {} bookkeeping failed, lease will expire: {}", task.taskId(), e.getMessage());
            outcome = TaskOutcome.failed(null, "persistence failed: " + e.getMessage());
        } finally {
            inFlight.remove(task.taskId(), lease);
        }
        return outcome;
    }

    public boolean degraded() {
        return degraded;
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    /**
     * Stops polling, asks in-flight runs to stop before their next act, and
     * waits for them to finish.
     */
    @Override
    public synchronized void close() {
        if (poller == null) {
            return;
        }
        poller.shutdownNow();
        inFlight.values().forEach(lease -> lease.cancellation().cancel());
        workers.shutdown();
        try {
            if (!workers.awaitTermination(settings.shutdownGraceMs(), TimeUnit.MILLISECONDS)) {
                log.warn("Workers did not finish within {} ms", settings.shutdownGraceMs());
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        poller = null;
        workers = null;
        log.info("Scheduler {} stopped", ownerId);
    }

    private List<Lease> claimDue(int capacity) {
        if (capacity <= 0) {
            return List.of();
        }
        if (persistence.isOpen()) {
            enterDegraded();
            return List.of();
        }
        try {
            tracker.resumeCooledDown();
            List<Lease> out = new ArrayList<>();
            for (TaskState task : tasks.dueTasks(clock.millis(), capacity)) {
                tryClaim(task).ifPresent(out::add);
            }
            leaveDegraded();
            return out;
        } catch (PersistenceException e) {
            log.warn("Poll failed: {}", e.getMessage());
            if (e.kind() == PersistenceException.Kind.CIRCUIT_OPEN || persistence.isOpen()) {
                enterDegraded();
            }
            return List.of();
        }
    }

    private void pollSafely() {
        try {
            pollOnce();
        } catch (RuntimeException e) {
            log.error("Scheduler poll crashed", e);
        }
    }

    private void renewLeasesSafely() {
        try {
            renewLeases();
        } catch (RuntimeException e) {
            log.warn("Lease renewal failed: {}", e.getMessage());
        }
    }

    private long heartbeatMs() {
        return Math.max(1L, settings.leaseTimeoutMs() / 3L);
    }

    private void enterDegraded() {
        if (!degraded) {
            degraded = true;
            log.warn("Persistence circuit open; scheduler stops dispatching");
        }
    }

    private void leaveDegraded() {
        if (degraded) {
            degraded = false;
            log.info("Persistence recovered; scheduler resumes dispatching");
        }
    }

    private void audit(String action, TaskState task, Map<String, Object> details) {
        if (audit == null) {
            return;
        }
        audit.log(AuditLogger.AuditEvent.of(action, task.actorName(), task.narrative(), "ok", details).withTask(task.taskId()));
    }

    public record Lease(TaskState task, String token, CancellationToken cancellation) {
    }

    public record Settings(
            long pollIntervalMs,
            int workerThreads,
            int queueCapacity,
            long leaseTimeoutMs,
            long shutdownGraceMs
    ) {
        public Settings {
            if (workerThreads < 1 || queueCapacity < 1) {
                throw new IllegalArgumentException("worker pool must have at least one thread and one queue slot");
            }
        }
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
