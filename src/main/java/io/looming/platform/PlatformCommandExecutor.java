package io.looming.platform;

import java.util.Map;

@FunctionalInterface
public interface PlatformCommandExecutor {
    PlatformCommandResult execute(String platform, String command, Map<String, String> arguments)
            throws PlatformCommandException;
}
