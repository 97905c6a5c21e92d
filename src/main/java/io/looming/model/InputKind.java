package io.looming.model;

public enum InputKind {
    TEXT,
    TABLE,
    PLATFORM_COMMAND
}
