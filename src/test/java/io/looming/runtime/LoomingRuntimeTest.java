package io.looming.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.looming.config.LoomingConfig;
import io.looming.model.FailureReason;
import io.looming.model.NarrativeExecution;
import io.looming.model.NarrativeStatus;
import io.looming.model.TaskState;
import io.looming.narrative.NarrativeRunResult;
import io.looming.scheduler.TaskOutcome;
import io.looming.state.StateScope;
import io.looming.state.StateValue;
import io.looming.storage.Database;
import io.looming.storage.NarrativeStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class LoomingRuntimeTest {
    private static final String SETTINGS = """
            {
              "backendMaxRetries": 0,
              "tasks": [
                {"taskId": "daily", "actor": "poster", "narrative": "daily_post", "schedule": {"type": "immediate"}}
              ]
            }
            """;
    private static final String NARRATIVE = """
            {
              "name": "daily_post",
              "target_table": "posts",
              "acts": [
                {"name": "draft", "model": "echo",
                 "inputs": [{"type": "text", "literal": "gardening"}]},
                {"name": "final", "model": "echo", "processors": ["json_extraction"],
                 "schema": {"fields": {"title": "string"}},
                 "inputs": [{"type": "text", "literal": "[{\\"title\\": \\"On {{draft.response}}\\"}]"}]}
              ]
            }
            """;

    private Path root;

    @BeforeEach
    void setUp() throws IOException {
        root = Files.createTempDirectory("looming-test-runtime-");
        Files.writeString(root.resolve(LoomingConfig.SETTINGS_FILE), SETTINGS, StandardCharsets.UTF_8);
        Files.createDirectories(root.resolve("narratives"));
        Files.writeString(root.resolve("narratives").resolve("daily_post.json"), NARRATIVE, StandardCharsets.UTF_8);
    }

    @AfterEach
    void tearDown() throws IOException {
        deleteRecursively(root);
    }

    @Test
    void tickRunsDeclaredTaskEndToEnd() {
        try (LoomingRuntime runtime = newRuntime()) {
            LoomingRuntime.InitOutcome init = runtime.init();
            Assertions.assertEquals(List.of("daily"), init.tasksRegistered());
            Assertions.assertTrue(init.backendPrefixes().contains("echo"));

            List<TaskOutcome> outcomes = runtime.tick();
            Assertions.assertEquals(1, outcomes.size());
            Assertions.assertTrue(outcomes.get(0).success(), String.valueOf(outcomes.get(0).error()));
            String executionId = outcomes.get(0).narrativeExecutionId();

            LoomingRuntime.ExecutionView view = runtime.getExecution(executionId).orElseThrow();
            Assertions.assertEquals(NarrativeStatus.SUCCEEDED, view.execution().status());
            Assertions.assertEquals(2, view.acts().size());
            Assertions.assertEquals("[{\"title\": \"On gardening\"}]", view.acts().get(1).act().response());

            Map<String, JsonNode> executionState = runtime.stateSnapshot(StateScope.execution(executionId));
            Assertions.assertEquals("gardening", executionState.get("draft").path("response").asText());

            LoomingRuntime.TaskView task = runtime.getTask("daily", 10).orElseThrow();
            Assertions.assertEquals(0, task.task().consecutiveFailures());
            Assertions.assertEquals(Long.MAX_VALUE, task.task().nextRunMs());
            Assertions.assertEquals(1, task.recentRuns().size());
            Assertions.assertTrue(runtime.tick().isEmpty());

            LoomingRuntime.StatusView status = runtime.status();
            Assertions.assertEquals("CLOSED", status.persistenceCircuit());
            Assertions.assertTrue(status.auditChainIntact());
        }
    }

    @Test
    void registrationIsIdempotentAcrossRestarts() {
        try (LoomingRuntime first = newRuntime()) {
            Assertions.assertEquals(List.of("daily"), first.init().tasksRegistered());
        }
        try (LoomingRuntime second = newRuntime()) {
            Assertions.assertTrue(second.init().tasksRegistered().isEmpty());
            List<TaskState> tasks = second.listTasks(10);
            Assertions.assertEquals(1, tasks.size());
            Assertions.assertEquals("poster", tasks.get(0).actorName());
        }
    }

    @Test
    void manualPauseAndResume() {
        try (LoomingRuntime runtime = newRuntime()) {
            runtime.init();
            Assertions.assertTrue(runtime.pauseTask("daily"));
            Assertions.assertTrue(runtime.tick().isEmpty());
            Assertions.assertTrue(runtime.resumeTask("daily"));
            Assertions.assertEquals(1, runtime.tick().size());
            Assertions.assertFalse(runtime.pauseTask("missing"));
        }
    }

    @Test
    void operatorCommandsLeaveRunningExecutionsAlone() {
        Database db = new Database(new LoomingConfig(root));
        db.init();
        NarrativeStore store = new NarrativeStore(db);
        store.createExecution("live", "daily_post", "poster", null, System.currentTimeMillis());

        try (LoomingRuntime operator = newRuntime()) {
            operator.init();
            operator.status();
            operator.listTasks(10);
        }

        Assertions.assertTrue(store.completeExecution("live", NarrativeStatus.SUCCEEDED, null, null, System.currentTimeMillis()));
        Assertions.assertEquals(NarrativeStatus.SUCCEEDED, store.getExecution("live").orElseThrow().status());
    }

    @Test
    void schedulerRecoveryFailsOnlyStaleExecutions() {
        Database db = new Database(new LoomingConfig(root));
        db.init();
        NarrativeStore store = new NarrativeStore(db);
        store.createExecution("orphan", "daily_post", "poster", null, 1L);
        store.createExecution("recent", "daily_post", "poster", null, System.currentTimeMillis());

        try (LoomingRuntime runtime = newRuntime()) {
            runtime.init();
            Assertions.assertEquals(1, runtime.recoverInterrupted());
            NarrativeExecution orphan = runtime.getExecution("orphan").orElseThrow().execution();
            Assertions.assertEquals(NarrativeStatus.FAILED, orphan.status());
            Assertions.assertEquals(FailureReason.CANCELLED, orphan.failureReason());
            Assertions.assertEquals(NarrativeStatus.RUNNING, runtime.getExecution("recent").orElseThrow().execution().status());
        }
    }

    @Test
    void operatorStateWritesReachTheActorsNextRun() throws IOException {
        Files.writeString(root.resolve("narratives").resolve("memo.json"), """
                {
                  "name": "memo",
                  "acts": [
                    {"name": "pick", "model": "echo",
                     "inputs": [{"type": "text", "literal": "{state:topic}"}],
                     "remember": {"last_topic": "{{pick.response}}"}}
                  ]
                }
                """, StandardCharsets.UTF_8);

        try (LoomingRuntime serving = newRuntime(); LoomingRuntime operator = newRuntime()) {
            serving.init();
            operator.init();
            operator.setActorState("poster", "topic", StateValue.text("roses"));
            Assertions.assertTrue(serving.runNarrative("memo", "poster").succeeded());
            Assertions.assertEquals("roses", serving.stateSnapshot(StateScope.actor("poster")).get("last_topic").asText());

            operator.setActorState("poster", "topic", StateValue.text("tulips"));
            Assertions.assertTrue(serving.runNarrative("memo", "poster").succeeded());
            Assertions.assertEquals("tulips", serving.stateSnapshot(StateScope.actor("poster")).get("last_topic").asText());

            Assertions.assertEquals(NarrativeStatus.FAILED, serving.runNarrative("memo", "stranger").status());
            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> operator.setActorState(" ", "topic", StateValue.text("x")));
        }
    }

    @Test
    void adHocRunWritesRowsAndRejectsUnknownNarrative() {
        try (LoomingRuntime runtime = newRuntime()) {
            runtime.init();
            NarrativeRunResult result = runtime.runNarrative("daily_post", null);
            Assertions.assertTrue(result.succeeded());
            Assertions.assertEquals(1, result.rowsWritten());
            Assertions.assertThrows(IllegalArgumentException.class, () -> runtime.runNarrative("nope", "poster"));
            Assertions.assertEquals(1, runtime.listExecutions("daily_post", 10).size());
        }
    }

    private LoomingRuntime newRuntime() {
        return new LoomingRuntime(new LoomingConfig(root), List.of(), Clock.systemUTC(), d -> { });
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
