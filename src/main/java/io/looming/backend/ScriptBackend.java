package io.looming.backend;

import io.looming.util.Jsons;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external command per request: the request JSON goes to stdin, the
 * response text is read from stdout verbatim.
 *
 * <p>Exit codes: 0 success, 75 rate limited, 77 auth failure, 69 backend
 * unreachable; anything else is an invalid request.
 */
public final class ScriptBackend implements GenerationBackend {
    static final int EXIT_UNAVAILABLE = 69;
    static final int EXIT_TEMPFAIL = 75;
    static final int EXIT_NOPERM = 77;
    private static final int MAX_ERROR_CHARS = 512;

    private final String name;
    private final List<String> command;
    private final long timeoutMs;

    public ScriptBackend(String name, List<String> command, long timeoutMs) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("script backend name cannot be empty");
        }
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("script backend command cannot be empty: " + name);
        }
        this.name = name;
        this.command = List.copyOf(command);
        this.timeoutMs = Math.max(1_000L, timeoutMs);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public GenerationResponse generate(GenerationRequest request) throws BackendException {
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new BackendException(BackendException.Kind.INVALID, "script spawn failed: " + e.getMessage(), e);
        }
        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readAll(process.getErrorStream()));
        try {
            try (OutputStream in = process.getOutputStream()) {
                in.write(Jsons.toCompactJson(request).getBytes(StandardCharsets.UTF_8));
            }
            if (!process.waitFor(timeoutMs, TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new BackendException(BackendException.Kind.TIMEOUT,
                        "script timeout after " + Duration.ofMillis(timeoutMs));
            }
            String text = stdout.get();
            int exit = process.exitValue();
            if (exit == 0) {
                int completion = text.length() / 4;
                return new GenerationResponse(text, new TokenUsage(promptChars(request) / 4, completion));
            }
            String detail = "script exit=" + exit + " stderr=" + truncate(stderr.get());
            throw new BackendException(kindForExit(exit), detail);
        } catch (IOException e) {
            process.destroyForcibly();
            throw new BackendException(BackendException.Kind.NETWORK, "script io failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new BackendException(BackendException.Kind.TIMEOUT, "interrupted waiting for script", e);
        } catch (ExecutionException e) {
            process.destroyForcibly();
            throw new BackendException(BackendException.Kind.NETWORK, "script output unreadable: " + e.getCause().getMessage(), e);
        }
    }

    static BackendException.Kind kindForExit(int exit) {
        return switch (exit) {
            case EXIT_TEMPFAIL -> BackendException.Kind.RATE_LIMITED;
            case EXIT_NOPERM -> BackendException.Kind.AUTH;
            case EXIT_UNAVAILABLE -> BackendException.Kind.NETWORK;
            default -> BackendException.Kind.INVALID;
        };
    }

    private static int promptChars(GenerationRequest request) {
        int chars = 0;
        for (Message m : request.messages()) {
            chars += m.content().length();
        }
        return chars;
    }

    private static String readAll(InputStream stream) {
        try (InputStream in = stream) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String truncate(String raw) {
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }
}
