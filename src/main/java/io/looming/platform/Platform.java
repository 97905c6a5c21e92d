package io.looming.platform;

import java.util.Map;

/**
 * One external platform binding.
 */
public interface Platform {
    String name();

    PlatformCommandResult execute(String command, Map<String, String> arguments) throws PlatformCommandException;
}
