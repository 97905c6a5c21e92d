package io.looming.storage;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.looming.config.LoomingConfig;
import io.looming.model.ActExecution;
import io.looming.model.ActInput;
import io.looming.model.FailureReason;
import io.looming.model.InputKind;
import io.looming.model.NarrativeExecution;
import io.looming.model.NarrativeStatus;
import io.looming.state.StateScope;
import io.looming.state.StateStore;
import io.looming.state.StateValue;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class NarrativeStoreTest {
    private Path root;
    private Database db;
    private NarrativeStore store;

    @BeforeEach
    void setUp() throws IOException {
        root = Files.createTempDirectory("looming-test-narratives-");
        db = new Database(new LoomingConfig(root));
        db.init();
        store = new NarrativeStore(db);
    }

    @AfterEach
    void tearDown() throws IOException {
        deleteRecursively(root);
    }

    @Test
    void recordsActWithItsInputsAtomically() {
        store.createExecution("exec-1", "daily", "poster", "task-1", 10L);
        ActExecution act = store.recordAct(new NarrativeStore.ActCapture(
                "exec-1", "draft", 1, "echo", 0.2d, 400, "raw\r\nresponse ", 7, 9,
                List.of(
                        new ActInput(0L, 0, InputKind.TEXT, "prompt", "h0"),
                        new ActInput(0L, 1, InputKind.TABLE, "| a |", "h1")
                ),
                11L
        ));

        Assertions.assertTrue(act.id() > 0);
        Assertions.assertEquals("raw\r\nresponse ", store.listActs("exec-1").get(0).response());
        List<ActInput> inputs = store.listInputs(act.id());
        Assertions.assertEquals(2, inputs.size());
        Assertions.assertEquals(InputKind.TABLE, inputs.get(1).kind());
    }

    @Test
    void completionIsTerminalAndOnlyOnce() {
        store.createExecution("exec-1", "daily", "poster", null, 10L);
        Assertions.assertTrue(store.completeExecution("exec-1", NarrativeStatus.FAILED, FailureReason.BACKEND_UNAVAILABLE, "timeout", 20L));
        Assertions.assertFalse(store.completeExecution("exec-1", NarrativeStatus.SUCCEEDED, null, null, 30L));

        NarrativeExecution execution = store.getExecution("exec-1").orElseThrow();
        Assertions.assertEquals(NarrativeStatus.FAILED, execution.status());
        Assertions.assertEquals("backend unavailable", execution.reasonText());
        Assertions.assertEquals(20L, execution.completedAtMs());
    }

    @Test
    void restartFailsOnlyStaleRunsWithoutALiveLease() {
        TaskStore tasks = new TaskStore(db);
        tasks.register(new TaskStore.TaskRegistration("live_task", "poster", "daily", Map.of(), 0L, 0L));
        Assertions.assertTrue(tasks.tryClaim("live_task", "scheduler-a", "token-1", 60_000L, 10_000L, 5L));

        store.createExecution("orphan", "daily", "poster", null, 10L);
        store.createExecution("done", "daily", "poster", null, 11L);
        store.completeExecution("done", NarrativeStatus.SUCCEEDED, null, null, 12L);
        store.createExecution("leased", "daily", "poster", "live_task", 20L);
        store.createExecution("fresh", "daily", "poster", null, 90L);

        Assertions.assertEquals(1, store.failInterrupted(50L, 100L));

        NarrativeExecution interrupted = store.getExecution("orphan").orElseThrow();
        Assertions.assertEquals(NarrativeStatus.FAILED, interrupted.status());
        Assertions.assertEquals(FailureReason.CANCELLED, interrupted.failureReason());
        Assertions.assertEquals(NarrativeStatus.SUCCEEDED, store.getExecution("done").orElseThrow().status());
        Assertions.assertEquals(NarrativeStatus.RUNNING, store.getExecution("leased").orElseThrow().status());
        Assertions.assertEquals(NarrativeStatus.RUNNING, store.getExecution("fresh").orElseThrow().status());

        Assertions.assertEquals(1, store.failInterrupted(50L, 20_000L));
        Assertions.assertEquals(NarrativeStatus.FAILED, store.getExecution("leased").orElseThrow().status());
        Assertions.assertTrue(store.completeExecution("fresh", NarrativeStatus.SUCCEEDED, null, null, 20_001L));
        Assertions.assertEquals(4, store.listExecutions("daily", 10).size());
        Assertions.assertTrue(store.listExecutions("other", 10).isEmpty());
    }

    @Test
    void stateSurvivesAFreshStoreInstance() {
        StateScope actor = StateScope.actor("poster");
        StateStore first = new StateStore(new StateEntryStore(db), Clock.systemUTC());
        first.put(actor, "topic", StateValue.text("gardening"));
        ObjectNode fields = JsonNodeFactory.instance.objectNode();
        fields.put("post_id", "p-1");
        first.mergeObject(actor, "publish", fields);

        StateStore second = new StateStore(new StateEntryStore(db), Clock.systemUTC());
        Assertions.assertEquals("gardening", second.get(actor, "topic").orElseThrow().text());
        Assertions.assertEquals("p-1", second.lookupPath(null, actor, "publish.post_id").orElseThrow().asText());
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
