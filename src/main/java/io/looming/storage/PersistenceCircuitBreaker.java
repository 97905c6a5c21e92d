package io.looming.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Circuit breaker around storage access.
 *
 * <p>CLOSED lets every call through. After {@code failureThreshold} consecutive
 * failures it moves to OPEN and refuses calls until {@code cooldown} has elapsed,
 * then HALF_OPEN admits calls again: the first success closes the circuit, a
 * failure reopens it.
 */
public final class PersistenceCircuitBreaker {
    private static final Logger log = LoggerFactory.getLogger(PersistenceCircuitBreaker.class);

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final int failureThreshold;
    private final Duration cooldown;
    private final Clock clock;
    private final AtomicInteger failureCount;
    private final AtomicReference<State> state;
    private final AtomicReference<Instant> openedAt;

    public PersistenceCircuitBreaker(int failureThreshold, Duration cooldown, Clock clock) {
        this.failureThreshold = Math.max(1, failureThreshold);
        this.cooldown = cooldown == null ? Duration.ZERO : cooldown;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.failureCount = new AtomicInteger(0);
        this.state = new AtomicReference<>(State.CLOSED);
        this.openedAt = new AtomicReference<>(null);
    }

    /**
     * @return true when calls are currently refused
     */
    public boolean isOpen() {
        if (state.get() != State.OPEN) {
            return false;
        }
        Instant opened = openedAt.get();
        if (opened != null && !Duration.between(opened, clock.instant()).minus(cooldown).isNegative()) {
            if (state.compareAndSet(State.OPEN, State.HALF_OPEN)) {
                log.info("Persistence circuit transitioning from OPEN to HALF_OPEN");
            }
            return false;
        }
        return true;
    }

    public void recordSuccess() {
        State current = state.get();
        if (current == State.HALF_OPEN) {
            log.info("Persistence circuit transitioning from HALF_OPEN to CLOSED");
        }
        if (current != State.CLOSED || failureCount.get() > 0) {
            failureCount.set(0);
            state.set(State.CLOSED);
            openedAt.set(null);
        }
    }

    public void recordFailure(Throwable cause) {
        int failures = failureCount.incrementAndGet();
        State current = state.get();
        String detail = cause == null ? "" : cause.getMessage();
        if (current == State.HALF_OPEN) {
            log.warn("Persistence circuit transitioning from HALF_OPEN to OPEN: {}", detail);
            open();
        } else if (current == State.CLOSED && failures >= failureThreshold) {
            log.warn("Persistence circuit transitioning from CLOSED to OPEN after {} failures: {}", failures, detail);
            open();
        } else {
            log.debug("Persistence failure {}/{}: {}", failures, failureThreshold, detail);
        }
    }

    public void reset() {
        failureCount.set(0);
        state.set(State.CLOSED);
        openedAt.set(null);
    }

    public State state() {
        return state.get();
    }

    public int failureCount() {
        return failureCount.get();
    }

    private void open() {
        openedAt.set(clock.instant());
        state.set(State.OPEN);
    }
}
