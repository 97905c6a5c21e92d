package io.looming.model;

import java.util.Map;

/**
 * Executes a command on an external platform and feeds its result summary to
 * the act. Argument values may contain template references.
 */
public record PlatformCommandInput(
        String platform,
        String command,
        Map<String, String> arguments,
        HistoryRetention retention
) implements Input {
    public PlatformCommandInput {
        if (platform == null || platform.isBlank()) {
            throw new IllegalArgumentException("platform command input requires a platform");
        }
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("platform command input requires a command");
        }
        arguments = arguments == null ? Map.of() : Map.copyOf(arguments);
        retention = retention == null ? HistoryRetention.FULL : retention;
    }

    @Override
    public InputKind kind() {
        return InputKind.PLATFORM_COMMAND;
    }
}
