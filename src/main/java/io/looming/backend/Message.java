package io.looming.backend;

public record Message(Role role, String content) {
    public Message {
        if (role == null) {
            throw new IllegalArgumentException("message role is required");
        }
        content = content == null ? "" : content;
    }

    public static Message user(String content) {
        return new Message(Role.USER, content);
    }

    public static Message assistant(String content) {
        return new Message(Role.ASSISTANT, content);
    }
}
