package io.looming.input;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.looming.model.Act;
import io.looming.model.Input;
import io.looming.model.PlatformCommandInput;
import io.looming.model.TableInput;
import io.looming.model.TextInput;
import io.looming.observability.AuditLogger;
import io.looming.platform.PlatformCommandException;
import io.looming.platform.PlatformCommandExecutor;
import io.looming.platform.PlatformCommandResult;
import io.looming.security.Authorization;
import io.looming.security.SecurityDeniedException;
import io.looming.security.SecurityGate;
import io.looming.security.SensitiveDataMasker;
import io.looming.state.StateScope;
import io.looming.state.StateStore;
import io.looming.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns declared inputs into backend-ready content.
 *
 * <p>A platform command stores its summary under {@code summary} and its
 * payload fields next to it, in the state object of the act that ran it.
 */
public final class InputResolver {
    public static final String SUMMARY_FIELD = "summary";

    private final TableSource tables;
    private final PlatformCommandExecutor platforms;
    private final SecurityGate securityGate;
    private final StateStore state;
    private final TemplateResolver templates;
    private final TableRenderer renderer;
    private final Path baseDir;
    private final AuditLogger audit;

    public InputResolver(
            TableSource tables,
            PlatformCommandExecutor platforms,
            SecurityGate securityGate,
            StateStore state,
            Path baseDir,
            AuditLogger audit
    ) {
        this.tables = tables;
        this.platforms = platforms;
        this.securityGate = securityGate;
        this.state = state;
        this.templates = new TemplateResolver(state);
        this.renderer = new TableRenderer();
        this.baseDir = baseDir;
        this.audit = audit;
    }

    /**
     * Resolves every input of an act in declared order. Stops at the first failure.
     */
    public List<ResolvedContent> resolveAll(Act act, Context ctx)
            throws InputException, UnresolvedReferenceException, SecurityDeniedException {
        List<ResolvedContent> out = new ArrayList<>(act.inputs().size());
        for (Input input : act.inputs()) {
            out.add(resolve(input, ctx));
        }
        return out;
    }

    public ResolvedContent resolve(Input input, Context ctx)
            throws InputException, UnresolvedReferenceException, SecurityDeniedException {
        if (input instanceof TextInput text) {
            return resolveText(text, ctx);
        }
        if (input instanceof TableInput table) {
            return resolveTable(table, ctx);
        }
        if (input instanceof PlatformCommandInput command) {
            return resolveCommand(command, ctx);
        }
        throw new IllegalArgumentException("Unsupported input type: " + input.getClass().getName());
    }

    /**
     * Resolves a template against the run's execution and actor state.
     */
    public String resolveTemplate(String template, Context ctx) throws UnresolvedReferenceException {
        return templates.resolve(template, ctx.execution(), ctx.actor());
    }

    private ResolvedContent resolveText(TextInput input, Context ctx) throws InputException, UnresolvedReferenceException {
        String raw = input.literal() != null ? input.literal() : readFile(input.file());
        String text = templates.resolve(raw, ctx.execution(), ctx.actor());
        return new ResolvedContent(input.kind(), text, null, HistorySummarizer.textSummary(text), input.retention());
    }

    private ResolvedContent resolveTable(TableInput input, Context ctx) throws InputException, UnresolvedReferenceException {
        Map<String, String> filter = resolveValues(input.filter(), ctx);
        List<Map<String, Object>> rows;
        try {
            rows = tables.query(input.table(), filter, input.limit());
        } catch (RuntimeException e) {
            throw new InputException(InputException.Kind.SOURCE,
                    "Failed to query table " + input.table() + ": " + e.getMessage(), e);
        }
        String text = renderer.render(input.table(), rows, input.format(), input.columns());
        return new ResolvedContent(
                input.kind(),
                text,
                null,
                HistorySummarizer.tableSummary(input.table(), rows.size()),
                input.retention()
        );
    }

    private ResolvedContent resolveCommand(PlatformCommandInput input, Context ctx)
            throws InputException, UnresolvedReferenceException, SecurityDeniedException {
        Map<String, String> arguments = resolveValues(input.arguments(), ctx);
        String action = SecurityGate.platformAction(input.platform(), input.command());
        Authorization decision = securityGate.authorize(ctx.actorName(), action);
        if (!decision.allowed()) {
            auditCommand(ctx, action, arguments, "denied", Map.<String, Object>of("reason", decision.reason()));
            throw new SecurityDeniedException(ctx.actorName(), action, decision.reason());
        }
        PlatformCommandResult result;
        try {
            result = platforms.execute(input.platform(), input.command(), arguments);
        } catch (PlatformCommandException e) {
            auditCommand(ctx, action, arguments, "failed", Map.<String, Object>of("error", String.valueOf(e.getMessage())));
            throw new InputException(InputException.Kind.PLATFORM,
                    "Platform command " + input.platform() + "." + input.command() + " failed: " + e.getMessage(), e);
        }
        ObjectNode payload = Jsons.mapper().valueToTree(result.payload());
        ObjectNode captured = Jsons.mapper().createObjectNode();
        captured.put(SUMMARY_FIELD, result.summary());
        captured.setAll(payload);
        state.mergeObject(ctx.execution(), ctx.actName(), captured);
        auditCommand(ctx, action, arguments, "ok", Map.<String, Object>of("payload_fields", List.copyOf(result.payload().keySet())));
        return new ResolvedContent(
                input.kind(),
                result.summary(),
                payload,
                HistorySummarizer.platformSummary(input.platform(), input.command()),
                input.retention()
        );
    }

    private void auditCommand(Context ctx, String action, Map<String, String> arguments, String outcome, Map<String, Object> extra) {
        if (audit == null) {
            return;
        }
        Map<String, Object> details = new LinkedHashMap<>(extra);
        details.put("act", ctx.actName());
        details.put("arguments", SensitiveDataMasker.maskedArguments(arguments));
        audit.log(AuditLogger.AuditEvent.of("platform.command", ctx.actorName(), action, outcome, details)
                .withExecution(ctx.execution().id()));
    }

    private Map<String, String> resolveValues(Map<String, String> raw, Context ctx) throws UnresolvedReferenceException {
        Map<String, String> out = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : raw.entrySet()) {
            out.put(e.getKey(), templates.resolve(e.getValue(), ctx.execution(), ctx.actor()));
        }
        return out;
    }

    private String readFile(String file) throws InputException {
        Path path = Path.of(file);
        if (!path.isAbsolute() && baseDir != null) {
            path = baseDir.resolve(path);
        }
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new InputException(InputException.Kind.SOURCE, "Failed to read input file: " + path, e);
        }
    }

    /**
     * Where a resolution happens: state scopes for templates, the acting actor
     * for the security gate, and the act that receives platform payloads.
     */
    public record Context(StateScope execution, StateScope actor, String actorName, String actName) {
    }
}
