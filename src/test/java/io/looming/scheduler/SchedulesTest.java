package io.looming.scheduler;

import com.fasterxml.jackson.databind.JsonNode;
import io.looming.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalTime;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

final class SchedulesTest {
    private static final Instant NOON = Instant.parse("2026-03-02T12:00:00Z");

    @Test
    void intervalAddsSecondsToReference() {
        Optional<Instant> next = Schedules.nextRun(NOON, SchedulePolicy.interval(3600), new Random(1L));
        Assertions.assertEquals(Optional.of(Instant.parse("2026-03-02T13:00:00Z")), next);
    }

    @Test
    void jitterStaysWithinBound() {
        SchedulePolicy policy = SchedulePolicy.interval(60).withJitter(30);
        Random random = new Random(42L);
        for (int i = 0; i < 200; i++) {
            Instant next = Schedules.nextRun(NOON, policy, random).orElseThrow();
            long delta = next.getEpochSecond() - NOON.getEpochSecond();
            Assertions.assertTrue(delta >= 60 && delta <= 90, "delta=" + delta);
        }
    }

    @Test
    void oneShotSchedulesHaveNoNextRun() {
        Assertions.assertTrue(Schedules.nextRun(NOON, SchedulePolicy.once(NOON), new Random()).isEmpty());
        Assertions.assertTrue(Schedules.nextRun(NOON, SchedulePolicy.immediate(), new Random()).isEmpty());
        Assertions.assertEquals(NOON, Schedules.firstRun(Instant.EPOCH, SchedulePolicy.once(NOON)));
        Assertions.assertEquals(NOON, Schedules.firstRun(NOON, SchedulePolicy.immediate()));
    }

    @Test
    void windowMovesRunToNextOpening() {
        SchedulePolicy policy = SchedulePolicy.interval(3600).withWindow(LocalTime.of(9, 0), LocalTime.of(10, 0));
        Assertions.assertEquals(Instant.parse("2026-03-03T09:00:00Z"),
                Schedules.nextRun(NOON, policy, new Random()).orElseThrow());
        Assertions.assertEquals(Instant.parse("2026-03-03T09:00:00Z"), Schedules.firstRun(NOON, policy));
        Assertions.assertEquals(Instant.parse("2026-03-02T09:30:00Z"),
                Schedules.firstRun(Instant.parse("2026-03-02T09:30:00Z"), policy));
    }

    @Test
    void windowWrappingMidnightIsHonored() {
        LocalTime start = LocalTime.of(22, 0);
        LocalTime end = LocalTime.of(2, 0);
        Assertions.assertTrue(Schedules.inWindow(LocalTime.of(23, 30), start, end));
        Assertions.assertTrue(Schedules.inWindow(LocalTime.of(1, 0), start, end));
        Assertions.assertFalse(Schedules.inWindow(LocalTime.of(12, 0), start, end));
        SchedulePolicy policy = SchedulePolicy.interval(60).withWindow(start, end);
        Assertions.assertEquals(Instant.parse("2026-03-02T22:00:00Z"), Schedules.firstRun(NOON, policy));
    }

    @Test
    void policyRoundTripsThroughTaskMetadata() {
        JsonNode json = Jsons.readTree(
                "{\"type\":\"interval\",\"seconds\":900,\"jitter_seconds\":15,\"window\":{\"start\":\"08:00\",\"end\":\"20:00\"}}");
        SchedulePolicy policy = SchedulePolicy.fromJson(json);
        Assertions.assertEquals(SchedulePolicy.Type.INTERVAL, policy.type());
        Assertions.assertEquals(900L, policy.intervalSeconds());
        Assertions.assertEquals(15L, policy.jitterSeconds());
        Assertions.assertEquals(policy, SchedulePolicy.fromMetadata(Map.of(SchedulePolicy.METADATA_KEY, policy.toMetadata())));
        Assertions.assertEquals(SchedulePolicy.Type.IMMEDIATE, SchedulePolicy.fromMetadata(Map.of()).type());
    }

    @Test
    void unknownScheduleTypeIsRejected() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> SchedulePolicy.fromJson(Jsons.readTree("{\"type\":\"cron\"}")));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> SchedulePolicy.fromJson(Jsons.readTree("{\"type\":\"interval\",\"seconds\":0}")));
    }
}
