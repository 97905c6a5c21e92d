package io.looming.narrative;

import java.time.Duration;

/**
 * Backoff wait between backend retries; swapped for a recording double in tests.
 */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;

    static Sleeper system() {
        return d -> Thread.sleep(d.toMillis());
    }
}
