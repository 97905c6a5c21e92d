package io.looming.model;

/**
 * Literal text or the contents of a file. Exactly one of {@code literal} and
 * {@code file} is set.
 */
public record TextInput(String literal, String file, HistoryRetention retention) implements Input {
    public TextInput {
        boolean hasLiteral = literal != null;
        boolean hasFile = file != null && !file.isBlank();
        if (hasLiteral == hasFile) {
            throw new IllegalArgumentException("text input requires exactly one of literal or file");
        }
        retention = retention == null ? HistoryRetention.FULL : retention;
    }

    public static TextInput literal(String text) {
        return new TextInput(text, null, HistoryRetention.FULL);
    }

    public static TextInput file(String path) {
        return new TextInput(null, path, HistoryRetention.FULL);
    }

    @Override
    public InputKind kind() {
        return InputKind.TEXT;
    }
}
