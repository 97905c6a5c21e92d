package io.looming.scheduler;

import com.fasterxml.jackson.databind.JsonNode;
import io.looming.util.Jsons;

import java.time.Instant;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * When a task runs.
 *
 * <ul>
 *   <li>{@code INTERVAL}: every {@code intervalSeconds}, plus up to {@code jitterSeconds}
 *       of random delay, optionally only inside a daily UTC window</li>
 *   <li>{@code ONCE}: a single run at {@code at}</li>
 *   <li>{@code IMMEDIATE}: a single run as soon as the task is registered</li>
 * </ul>
 *
 * <p>A window whose start is after its end wraps midnight.
 */
public record SchedulePolicy(
        Type type,
        long intervalSeconds,
        long jitterSeconds,
        LocalTime windowStart,
        LocalTime windowEnd,
        Instant at
) {
    public static final String METADATA_KEY = "schedule";

    public SchedulePolicy {
        if (type == null) {
            throw new IllegalArgumentException("schedule type is required");
        }
        if (type == Type.INTERVAL && intervalSeconds < 1) {
            throw new IllegalArgumentException("interval schedule requires seconds >= 1");
        }
        if (type == Type.ONCE && at == null) {
            throw new IllegalArgumentException("once schedule requires an instant");
        }
        if ((windowStart == null) != (windowEnd == null)) {
            throw new IllegalArgumentException("schedule window requires both start and end");
        }
        jitterSeconds = Math.max(0L, jitterSeconds);
    }

    public static SchedulePolicy interval(long seconds) {
        return new SchedulePolicy(Type.INTERVAL, seconds, 0L, null, null, null);
    }

    public static SchedulePolicy once(Instant at) {
        return new SchedulePolicy(Type.ONCE, 0L, 0L, null, null, at);
    }

    public static SchedulePolicy immediate() {
        return new SchedulePolicy(Type.IMMEDIATE, 0L, 0L, null, null, null);
    }

    public SchedulePolicy withJitter(long seconds) {
        return new SchedulePolicy(type, intervalSeconds, seconds, windowStart, windowEnd, at);
    }

    public SchedulePolicy withWindow(LocalTime start, LocalTime end) {
        return new SchedulePolicy(type, intervalSeconds, jitterSeconds, start, end, at);
    }

    public boolean hasWindow() {
        return windowStart != null;
    }

    /**
     * Parses {@code {"type":"interval","seconds":3600,"jitter_seconds":60,"window":{"start":"09:00","end":"17:00"}}},
     * {@code {"type":"once","at":"2026-01-01T09:00:00Z"}} or {@code {"type":"immediate"}}.
     * A missing node means immediate.
     */
    public static SchedulePolicy fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return immediate();
        }
        String rawType = node.path("type").asText("");
        Type type;
        try {
            type = Type.valueOf(rawType.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown schedule type: " + rawType, e);
        }
        try {
            LocalTime start = null;
            LocalTime end = null;
            JsonNode window = node.path("window");
            if (window.isObject()) {
                start = LocalTime.parse(window.path("start").asText());
                end = LocalTime.parse(window.path("end").asText());
            }
            Instant at = node.hasNonNull("at") ? Instant.parse(node.get("at").asText()) : null;
            return new SchedulePolicy(
                    type,
                    node.path("seconds").asLong(0L),
                    node.path("jitter_seconds").asLong(0L),
                    start,
                    end,
                    at
            );
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid schedule time: " + e.getParsedString(), e);
        }
    }

    /**
     * Reads the policy stored in task metadata, written there by {@link #toMetadata()}.
     */
    public static SchedulePolicy fromMetadata(Map<String, Object> metadata) {
        Object raw = metadata == null ? null : metadata.get(METADATA_KEY);
        return fromJson(raw == null ? null : Jsons.mapper().valueToTree(raw));
    }

    public Map<String, Object> toMetadata() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("type", type.name().toLowerCase(Locale.ROOT));
        if (type == Type.INTERVAL) {
            out.put("seconds", intervalSeconds);
            if (jitterSeconds > 0) {
                out.put("jitter_seconds", jitterSeconds);
            }
        }
        if (hasWindow()) {
            out.put("window", Map.of("start", windowStart.toString(), "end", windowEnd.toString()));
        }
        if (at != null) {
            out.put("at", at.toString());
        }
        return out;
    }

    public enum Type {
        INTERVAL,
        ONCE,
        IMMEDIATE
    }
}
