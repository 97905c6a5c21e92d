package io.looming.storage;

import io.looming.config.LoomingConfig;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.stream.Stream;

final class PersistenceCircuitBreakerTest {
    private static final Clock FIXED = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);

    @Test
    void opensOnlyAfterThresholdConsecutiveFailures() {
        PersistenceCircuitBreaker breaker = new PersistenceCircuitBreaker(2, Duration.ofSeconds(30), FIXED);
        breaker.recordFailure(new RuntimeException("busy"));
        Assertions.assertFalse(breaker.isOpen());
        breaker.recordFailure(new RuntimeException("busy"));
        Assertions.assertTrue(breaker.isOpen());
        Assertions.assertEquals(PersistenceCircuitBreaker.State.OPEN, breaker.state());

        breaker.reset();
        Assertions.assertFalse(breaker.isOpen());
        Assertions.assertEquals(0, breaker.failureCount());
    }

    @Test
    void successBetweenFailuresResetsTheCount() {
        PersistenceCircuitBreaker breaker = new PersistenceCircuitBreaker(2, Duration.ofSeconds(30), FIXED);
        breaker.recordFailure(new RuntimeException("busy"));
        breaker.recordSuccess();
        breaker.recordFailure(new RuntimeException("busy"));
        Assertions.assertFalse(breaker.isOpen());
    }

    @Test
    void halfOpenClosesOnSuccessAndReopensOnFailure() {
        PersistenceCircuitBreaker breaker = new PersistenceCircuitBreaker(1, Duration.ZERO, FIXED);
        breaker.recordFailure(new RuntimeException("io"));
        Assertions.assertFalse(breaker.isOpen());
        Assertions.assertEquals(PersistenceCircuitBreaker.State.HALF_OPEN, breaker.state());

        breaker.recordFailure(new RuntimeException("io again"));
        Assertions.assertEquals(PersistenceCircuitBreaker.State.OPEN, breaker.state());

        breaker.isOpen();
        breaker.recordSuccess();
        Assertions.assertEquals(PersistenceCircuitBreaker.State.CLOSED, breaker.state());
    }

    @Test
    void openCircuitRefusesStorageCalls() throws Exception {
        Path root = Files.createTempDirectory("looming-test-breaker-");
        try {
            PersistenceCircuitBreaker breaker = new PersistenceCircuitBreaker(1, Duration.ofHours(1), Clock.systemUTC());
            Database db = new Database(new LoomingConfig(root), breaker);
            db.init();
            breaker.recordFailure(new RuntimeException("disk full"));

            PersistenceException e = Assertions.assertThrows(PersistenceException.class, () -> new TaskStore(db).list(10));
            Assertions.assertEquals(PersistenceException.Kind.CIRCUIT_OPEN, e.kind());
        } finally {
            deleteRecursively(root);
        }
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
