package io.looming.scheduler;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.Random;

/**
 * Pure next-run arithmetic. Callers pass the reference instant and the random
 * source, so nothing here reads the wall clock.
 */
public final class Schedules {
    private Schedules() {
    }

    /**
     * First run of a newly registered task.
     */
    public static Instant firstRun(Instant now, SchedulePolicy policy) {
        return switch (policy.type()) {
            case INTERVAL -> intoWindow(now, policy);
            case ONCE -> policy.at();
            case IMMEDIATE -> now;
        };
    }

    /**
     * Next run after a dispatch at {@code reference}; empty for one-shot schedules.
     */
    public static Optional<Instant> nextRun(Instant reference, SchedulePolicy policy, Random random) {
        if (policy.type() != SchedulePolicy.Type.INTERVAL) {
            return Optional.empty();
        }
        long jitter = policy.jitterSeconds() > 0 ? (long) (random.nextDouble() * (policy.jitterSeconds() + 1)) : 0L;
        Instant candidate = reference.plusSeconds(policy.intervalSeconds() + Math.min(jitter, policy.jitterSeconds()));
        return Optional.of(intoWindow(candidate, policy));
    }

    /**
     * Moves an instant forward to the next time inside the policy's UTC window.
     */
    static Instant intoWindow(Instant candidate, SchedulePolicy policy) {
        if (!policy.hasWindow()) {
            return candidate;
        }
        ZonedDateTime at = candidate.atZone(ZoneOffset.UTC);
        LocalTime time = at.toLocalTime();
        LocalTime start = policy.windowStart();
        LocalTime end = policy.windowEnd();
        if (inWindow(time, start, end)) {
            return candidate;
        }
        LocalDate day = at.toLocalDate();
        ZonedDateTime sameDayStart = day.atTime(start).atZone(ZoneOffset.UTC);
        if (sameDayStart.toInstant().isAfter(candidate)) {
            return sameDayStart.toInstant();
        }
        return day.plusDays(1).atTime(start).atZone(ZoneOffset.UTC).toInstant();
    }

    static boolean inWindow(LocalTime time, LocalTime start, LocalTime end) {
        if (start.equals(end)) {
            return true;
        }
        if (start.isBefore(end)) {
            return !time.isBefore(start) && time.isBefore(end);
        }
        return !time.isBefore(start) || time.isBefore(end);
    }
}
