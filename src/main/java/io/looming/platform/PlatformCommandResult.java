package io.looming.platform;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * @param summary human-readable result fed to the act
 * @param payload structured values, e.g. the id of a created resource
 */
public record PlatformCommandResult(String summary, Map<String, Object> payload) {
    public PlatformCommandResult {
        summary = summary == null ? "" : summary;
        payload = payload == null ? Map.of() : new LinkedHashMap<>(payload);
    }
}
