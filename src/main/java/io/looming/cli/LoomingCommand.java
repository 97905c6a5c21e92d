package io.looming.cli;

import io.looming.config.LoomingConfig;
import io.looming.narrative.NarrativeRunResult;
import io.looming.runtime.LoomingRuntime;
import io.looming.scheduler.TaskOutcome;
import io.looming.state.StateScope;
import io.looming.state.StateValue;
import io.looming.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

@Command(
        name = "looming",
        mixinStandardHelpOptions = true,
        description = "Looming narrative scheduler CLI",
        subcommands = {
                LoomingCommand.InitCommand.class,
                LoomingCommand.ServeCommand.class,
                LoomingCommand.TickCommand.class,
                LoomingCommand.RunCommand.class,
                LoomingCommand.TasksCommand.class,
                LoomingCommand.TaskCommand.class,
                LoomingCommand.PauseCommand.class,
                LoomingCommand.ResumeCommand.class,
                LoomingCommand.ExecutionsCommand.class,
                LoomingCommand.ExecutionCommand.class,
                LoomingCommand.StateCommand.class,
                LoomingCommand.StateSetCommand.class,
                LoomingCommand.StatusCommand.class
        }
)
public final class LoomingCommand implements Runnable {
    @Option(names = {"--root"}, description = "Runtime data root directory", defaultValue = "data")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | serve | tick | run | tasks | task | pause | resume | executions | execution | state | state-set | status");
    }

    LoomingRuntime runtime() {
        return new LoomingRuntime(LoomingConfig.fromRoot(root));
    }

    @Command(name = "init", description = "Initialize directories, SQLite schema and declared tasks")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        LoomingCommand parent;

        @Override
        public Integer call() {
            LoomingRuntime runtime = parent.runtime();
            System.out.println(Jsons.toJson(runtime.init()));
            return 0;
        }
    }

    @Command(name = "serve", description = "Run the scheduler until interrupted")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        LoomingCommand parent;

        @Option(names = {"--settings-reload-ms"}, defaultValue = "10000",
                description = "Check interval for hot-reloading looming-settings.json")
        long settingsReloadMs;

        @Override
        public Integer call() throws Exception {
            LoomingRuntime runtime = parent.runtime();
            System.out.println(Jsons.toJson(runtime.init()));
            CountDownLatch stopped = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                runtime.close();
                stopped.countDown();
            }, "looming-shutdown-hook"));
            int interrupted = runtime.startScheduler();
            System.out.println(Jsons.toJson(Map.of("interruptedExecutionsFailed", interrupted)));
            while (stopped.getCount() > 0) {
                LoomingRuntime.SettingsReloadOutcome reload = runtime.maybeReloadSettings(settingsReloadMs);
                if (reload.changed()) {
                    System.out.println(Jsons.toJson(reload));
                }
                Thread.sleep(Math.max(100L, settingsReloadMs));
            }
            return 0;
        }
    }

    @Command(name = "tick", description = "Claim and run every due task once, then exit")
    static final class TickCommand implements Callable<Integer> {
        @ParentCommand
        LoomingCommand parent;

        @Override
        public Integer call() {
            LoomingRuntime runtime = parent.runtime();
            runtime.init();
            List<TaskOutcome> outcomes = runtime.tick();
            System.out.println(Jsons.toJson(outcomes));
            return outcomes.stream().allMatch(TaskOutcome::success) ? 0 : 1;
        }
    }

    @Command(name = "run", description = "Execute a narrative definition once")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        LoomingCommand parent;

        @Parameters(index = "0", description = "Narrative name (under <root>/narratives) or file path")
        String narrative;

        @Option(names = {"--actor"}, defaultValue = "adhoc", description = "Actor identity for state and security checks")
        String actor;

        @Override
        public Integer call() {
            LoomingRuntime runtime = parent.runtime();
            runtime.init();
            NarrativeRunResult result = runtime.runNarrative(narrative, actor);
            System.out.println(Jsons.toJson(result));
            return result.succeeded() ? 0 : 1;
        }
    }

    @Command(name = "tasks", description = "List scheduled tasks")
    static final class TasksCommand implements Callable<Integer> {
        @ParentCommand
        LoomingCommand parent;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max number of rows")
        int limit;

        @Override
        public Integer call() {
            LoomingRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println(Jsons.toJson(runtime.listTasks(limit)));
            return 0;
        }
    }

    @Command(name = "task", description = "Show one task and its recent runs")
    static final class TaskCommand implements Callable<Integer> {
        @ParentCommand
        LoomingCommand parent;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        @Option(names = {"--history"}, defaultValue = "20", description = "Number of recent runs to show")
        int history;

        @Override
        public Integer call() {
            LoomingRuntime runtime = parent.runtime();
            runtime.init();
            Optional<LoomingRuntime.TaskView> task = runtime.getTask(taskId, history);
            if (task.isEmpty()) {
                System.err.println("Task not found: " + taskId);
                return 2;
            }
            System.out.println(Jsons.toJson(task.get()));
            return 0;
        }
    }

    @Command(name = "pause", description = "Pause a task until resumed manually")
    static final class PauseCommand implements Callable<Integer> {
        @ParentCommand
        LoomingCommand parent;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        @Override
        public Integer call() {
            LoomingRuntime runtime = parent.runtime();
            runtime.init();
            boolean paused = runtime.pauseTask(taskId);
            System.out.println(Jsons.toJson(Map.of("taskId", taskId, "paused", paused)));
            return paused ? 0 : 2;
        }
    }

    @Command(name = "resume", description = "Resume a paused task and clear its failure count")
    static final class ResumeCommand implements Callable<Integer> {
        @ParentCommand
        LoomingCommand parent;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        @Override
        public Integer call() {
            LoomingRuntime runtime = parent.runtime();
            runtime.init();
            boolean resumed = runtime.resumeTask(taskId);
            System.out.println(Jsons.toJson(Map.of("taskId", taskId, "resumed", resumed)));
            return resumed ? 0 : 2;
        }
    }

    @Command(name = "executions", description = "List narrative executions, newest first")
    static final class ExecutionsCommand implements Callable<Integer> {
        @ParentCommand
        LoomingCommand parent;

        @Option(names = {"--narrative"}, description = "Filter by narrative name")
        String narrative;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max number of rows")
        int limit;

        @Override
        public Integer call() {
            LoomingRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println(Jsons.toJson(runtime.listExecutions(narrative, limit)));
            return 0;
        }
    }

    @Command(name = "execution", description = "Show one execution with its acts, inputs and processor results")
    static final class ExecutionCommand implements Callable<Integer> {
        @ParentCommand
        LoomingCommand parent;

        @Parameters(index = "0", description = "Execution id")
        String executionId;

        @Override
        public Integer call() {
            LoomingRuntime runtime = parent.runtime();
            runtime.init();
            Optional<LoomingRuntime.ExecutionView> view = runtime.getExecution(executionId);
            if (view.isEmpty()) {
                System.err.println("Execution not found: " + executionId);
                return 2;
            }
            System.out.println(Jsons.toJson(view.get()));
            return 0;
        }
    }

    @Command(name = "state", description = "Dump the state entries of an execution or actor scope")
    static final class StateCommand implements Callable<Integer> {
        @ParentCommand
        LoomingCommand parent;

        @Option(names = {"--execution"}, description = "Execution id")
        String executionId;

        @Option(names = {"--actor"}, description = "Actor name")
        String actor;

        @Override
        public Integer call() {
            if ((executionId == null) == (actor == null)) {
                System.err.println("Specify exactly one of --execution or --actor");
                return 2;
            }
            LoomingRuntime runtime = parent.runtime();
            runtime.init();
            StateScope scope = executionId != null ? StateScope.execution(executionId) : StateScope.actor(actor);
            System.out.println(Jsons.toJson(runtime.stateSnapshot(scope)));
            return 0;
        }
    }

    @Command(name = "state-set", description = "Write one entry into an actor's state scope")
    static final class StateSetCommand implements Callable<Integer> {
        @ParentCommand
        LoomingCommand parent;

        @Option(names = {"--actor"}, required = true, description = "Actor name")
        String actor;

        @Option(names = {"--json"}, description = "Store the value as JSON instead of text")
        boolean json;

        @Parameters(index = "0", description = "State key")
        String key;

        @Parameters(index = "1", description = "Value")
        String value;

        @Override
        public Integer call() {
            StateValue parsed;
            try {
                parsed = json ? StateValue.json(Jsons.readTree(value)) : StateValue.text(value);
            } catch (IllegalArgumentException e) {
                System.err.println("Value is not valid JSON: " + e.getMessage());
                return 2;
            }
            LoomingRuntime runtime = parent.runtime();
            runtime.init();
            runtime.setActorState(actor, key, parsed);
            System.out.println(Jsons.toJson(Map.of("actor", actor, "key", key, "value", parsed.asNode())));
            return 0;
        }
    }

    @Command(name = "status", description = "Show persistence circuit, scheduler and audit chain status")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        LoomingCommand parent;

        @Override
        public Integer call() {
            LoomingRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println(Jsons.toJson(runtime.status()));
            return 0;
        }
    }
}
