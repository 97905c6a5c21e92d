package io.looming.platform;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Routes platform commands by platform name. Populated once at startup.
 */
public final class PlatformRegistry implements PlatformCommandExecutor {
    private final Map<String, Platform> platforms = new LinkedHashMap<>();

    public PlatformRegistry(List<Platform> platforms) {
        for (Platform platform : platforms) {
            if (this.platforms.putIfAbsent(platform.name(), platform) != null) {
                throw new IllegalArgumentException("Duplicate platform registration: " + platform.name());
            }
        }
    }

    public List<String> names() {
        return List.copyOf(platforms.keySet());
    }

    @Override
    public PlatformCommandResult execute(String platform, String command, Map<String, String> arguments)
            throws PlatformCommandException {
        Platform target = platforms.get(platform);
        if (target == null) {
            throw new PlatformCommandException("Unknown platform: " + platform);
        }
        return target.execute(command, arguments);
    }
}
