package io.looming.platform;

public final class PlatformCommandException extends Exception {
    public PlatformCommandException(String message) {
        super(message);
    }

    public PlatformCommandException(String message, Throwable cause) {
        super(message, cause);
    }
}
