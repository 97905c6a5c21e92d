package io.looming.narrative;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.looming.backend.BackendException;
import io.looming.backend.GenerationBackend;
import io.looming.backend.GenerationRequest;
import io.looming.backend.GenerationResponse;
import io.looming.backend.Message;
import io.looming.input.BudgetGuard;
import io.looming.input.HistorySummarizer;
import io.looming.input.InputException;
import io.looming.input.InputResolver;
import io.looming.input.ResolvedContent;
import io.looming.input.UnresolvedReferenceException;
import io.looming.model.Act;
import io.looming.model.ActExecution;
import io.looming.model.ActInput;
import io.looming.model.FailureReason;
import io.looming.model.NarrativeDefinition;
import io.looming.model.NarrativeStatus;
import io.looming.model.ProcessorResult;
import io.looming.observability.AuditLogger;
import io.looming.processor.ActProcessor;
import io.looming.processor.ContentDeduplicator;
import io.looming.processor.JsonExtractionProcessor;
import io.looming.processor.ProcessorContext;
import io.looming.processor.ProcessorOutcome;
import io.looming.processor.ProcessorRegistry;
import io.looming.security.SecurityDeniedException;
import io.looming.state.StateScope;
import io.looming.state.StateStore;
import io.looming.state.StateValue;
import io.looming.storage.ContentStore;
import io.looming.storage.NarrativeStore;
import io.looming.storage.PersistenceException;
import io.looming.util.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Drives one narrative run: {@code PENDING -> RUNNING -> SUCCEEDED | FAILED}.
 *
 * <p>Acts run strictly in declared order. For each act the executor resolves
 * inputs, calls the backend (retrying recoverable errors with exponential
 * backoff), persists the raw response together with its inputs in one write,
 * then runs only the processors the act opted into. The first fatal error
 * ends the run; later acts never start.
 */
public final class NarrativeExecutor {
    private static final Logger log = LoggerFactory.getLogger(NarrativeExecutor.class);
    private static final String RESPONSE_FIELD = "response";
    private static final String ROWS_FIELD = "rows";

    private final NarrativeStore narratives;
    private final InputResolver resolver;
    private final StateStore state;
    private final GenerationBackend backend;
    private final ProcessorRegistry processors;
    private final ContentStore content;
    private final ContentDeduplicator deduplicator;
    private final Settings settings;
    private final Sleeper sleeper;
    private final AuditLogger audit;
    private final Clock clock;

    public NarrativeExecutor(
            NarrativeStore narratives,
            InputResolver resolver,
            StateStore state,
            GenerationBackend backend,
            ProcessorRegistry processors,
            ContentStore content,
            ContentDeduplicator deduplicator,
            Settings settings,
            Sleeper sleeper,
            AuditLogger audit,
            Clock clock
    ) {
        this.narratives = narratives;
        this.resolver = resolver;
        this.state = state;
        this.backend = backend;
        this.processors = processors;
        this.content = content;
        this.deduplicator = deduplicator;
        this.settings = settings;
        this.sleeper = sleeper;
        this.audit = audit;
        this.clock = clock;
    }

    public NarrativeRunResult run(NarrativeDefinition definition, RunRequest request) {
        String executionId = UUID.randomUUID().toString();
        narratives.createExecution(executionId, definition.name(), request.actorName(), request.taskId(), clock.millis());
        audit("narrative.started", request, executionId, definition.name(), "ok", Map.of());
        log.info("Narrative {} started execution={} actor={}", definition.name(), executionId, request.actorName());
        Run run = new Run(definition, request, executionId);
        try {
            return run.execute();
        } catch (PersistenceException e) {
            log.error("Narrative {} execution={} lost persistence: {}", definition.name(), executionId, e.getMessage());
            return run.fail(FailureReason.PERSISTENCE_FAILED, e.getMessage());
        } finally {
            state.evict(run.executionScope);
        }
    }

    private void audit(String action, RunRequest request, String executionId, String resource, String result, Map<String, Object> details) {
        if (audit == null) {
            return;
        }
        audit.log(AuditLogger.AuditEvent.of(action, request.actorName(), resource, result, details)
                .withTask(request.taskId())
                .withExecution(executionId));
    }

    /**
     * Mutable state of a single run.
     */
    private final class Run {
        private final NarrativeDefinition definition;
        private final RunRequest request;
        private final String executionId;
        private final StateScope executionScope;
        private final StateScope actorScope;
        private final List<Message> history = new ArrayList<>();
        private final List<ActExecution> captured = new ArrayList<>();
        private List<ObjectNode> finalRows;
        private ProcessorOutcome finalExtractionFailure;

        Run(NarrativeDefinition definition, RunRequest request, String executionId) {
            this.definition = definition;
            this.request = request;
            this.executionId = executionId;
            this.executionScope = StateScope.execution(executionId);
            this.actorScope = StateScope.actor(request.actorName());
            state.refresh(actorScope);
        }

        NarrativeRunResult execute() {
            List<Act> acts;
            try {
                acts = definition.orderedActs();
                for (Act act : acts) {
                    for (String name : act.processors()) {
                        if (!processors.contains(name)) {
                            throw new IllegalStateException("Act " + act.name() + " opts into unknown processor " + name);
                        }
                    }
                }
            } catch (IllegalStateException e) {
                return fail(FailureReason.INVALID_DEFINITION, e.getMessage());
            }
            if (acts.isEmpty()) {
                return fail(FailureReason.INVALID_DEFINITION, "Narrative " + definition.name() + " has no acts");
            }

            for (int i = 0; i < acts.size(); i++) {
                Act act = acts.get(i);
                if (request.cancellation().isCancelled()) {
                    return fail(FailureReason.CANCELLED, "Cancelled before act " + act.name());
                }
                NarrativeRunResult failure = runAct(act, i + 1, i == acts.size() - 1);
                if (failure != null) {
                    return failure;
                }
            }

            if (finalExtractionFailure != null) {
                return fail(FailureReason.EXTRACTION_FAILED, finalExtractionFailure.errorKind() + ": " + finalExtractionFailure.errorDetail());
            }
            int written;
            try {
                written = writeFinalRows();
            } catch (IllegalArgumentException e) {
                return fail(FailureReason.INVALID_DEFINITION, e.getMessage());
            }
            return complete(written);
        }

        /**
         * @return a terminal failure, or null when the act completed
         */
        private NarrativeRunResult runAct(Act act, int sequence, boolean finalAct) {
            InputResolver.Context ctx = new InputResolver.Context(executionScope, actorScope, request.actorName(), act.name());
            List<ResolvedContent> resolved;
            try {
                resolved = resolver.resolveAll(act, ctx);
                settings.budgetGuard().check(act, resolved);
            } catch (UnresolvedReferenceException e) {
                return fail(FailureReason.INPUT_UNRESOLVED, "Act " + act.name() + ": " + e.getMessage());
            } catch (InputException e) {
                return fail(FailureReason.INPUT_UNRESOLVED, "Act " + act.name() + " " + e.kind() + ": " + e.getMessage());
            } catch (SecurityDeniedException e) {
                return fail(FailureReason.SECURITY_DENIED, "Act " + act.name() + ": " + e.getMessage());
            }

            List<Message> messages = new ArrayList<>(history);
            messages.add(Message.user(joinTexts(resolved)));
            GenerationRequest generation = new GenerationRequest(
                    messages,
                    act.generation().model(),
                    act.generation().temperature(),
                    act.generation().maxTokens()
            );

            GenerationResponse response;
            try {
                response = generateWithRetry(act, generation);
            } catch (BackendException e) {
                FailureReason reason = e.recoverable() ? FailureReason.BACKEND_UNAVAILABLE : FailureReason.BACKEND_REJECTED;
                return fail(reason, "Act " + act.name() + " " + e.kind() + ": " + e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return fail(FailureReason.CANCELLED, "Interrupted during backoff in act " + act.name());
            }

            ActExecution capture = narratives.recordAct(new NarrativeStore.ActCapture(
                    executionId,
                    act.name(),
                    sequence,
                    act.generation().model(),
                    act.generation().temperature(),
                    act.generation().maxTokens(),
                    response.text(),
                    response.usage().promptTokens(),
                    response.usage().completionTokens(),
                    toActInputs(resolved),
                    clock.millis()
            ));
            captured.add(capture);
            audit("act.captured", request, executionId, act.name(), "ok", Map.of(
                    "sequence", sequence,
                    "response_chars", capture.response().length(),
                    "completion_tokens", capture.completionTokens()
            ));

            ObjectNode actState = JsonNodeFactory.instance.objectNode();
            actState.put(RESPONSE_FIELD, capture.response());
            state.mergeObject(executionScope, act.name(), actState);

            runProcessors(act, capture, finalAct);
            try {
                remember(act, ctx);
            } catch (UnresolvedReferenceException e) {
                return fail(FailureReason.INPUT_UNRESOLVED, "Act " + act.name() + " remember: " + e.getMessage());
            }
            appendHistory(resolved, capture.response());
            return null;
        }

        private void remember(Act act, InputResolver.Context ctx) throws UnresolvedReferenceException {
            if (act.remember().isEmpty()) {
                return;
            }
            Map<String, String> values = new LinkedHashMap<>();
            for (Map.Entry<String, String> e : act.remember().entrySet()) {
                values.put(e.getKey(), resolver.resolveTemplate(e.getValue(), ctx));
            }
            values.forEach((key, value) -> state.put(actorScope, key, StateValue.text(value)));
            log.debug("Act {} stored actor state {} for {}", act.name(), values.keySet(), request.actorName());
        }

        private GenerationResponse generateWithRetry(Act act, GenerationRequest generation)
                throws BackendException, InterruptedException {
            RetryPolicy retry = settings.retryPolicy();
            int attempt = 0;
            while (true) {
                attempt++;
                try {
                    return backend.generate(generation);
                } catch (BackendException e) {
                    if (!e.recoverable() || attempt > retry.maxRetries()) {
                        log.warn("Act {} backend call failed after {} attempt(s): {} {}", act.name(), attempt, e.kind(), e.getMessage());
                        throw new BackendException(e.kind(), "after " + attempt + " attempt(s): " + e.getMessage(), e);
                    }
                    long delayMs = retry.backoffMs(attempt);
                    log.info("Act {} attempt {} failed ({}), retrying in {} ms", act.name(), attempt, e.kind(), delayMs);
                    sleeper.sleep(Duration.ofMillis(delayMs));
                }
            }
        }

        private void runProcessors(Act act, ActExecution capture, boolean finalAct) {
            for (String name : act.processors()) {
                boolean extraction = JsonExtractionProcessor.isExtraction(name);
                if (extraction && definition.skipExtraction()) {
                    log.debug("Act {} skips {}: extraction disabled for narrative {}", act.name(), name, definition.name());
                    continue;
                }
                ActProcessor processor = processors.find(name).orElseThrow();
                ProcessorOutcome outcome;
                try {
                    outcome = processor.process(new ProcessorContext(definition, act, capture, request.actorName(), finalAct));
                } catch (RuntimeException e) {
                    log.warn("Processor {} threw on act {}", name, act.name(), e);
                    outcome = ProcessorOutcome.failed("ERROR", e.getClass().getSimpleName() + ": " + e.getMessage());
                }
                narratives.recordProcessorResult(new ProcessorResult(
                        capture.id(),
                        name,
                        outcome.success(),
                        outcome.rows().size(),
                        outcome.errorKind(),
                        outcome.errorDetail(),
                        clock.millis()
                ));
                audit("processor." + name, request, executionId, act.name(), outcome.success() ? "ok" : "failed",
                        outcome.success()
                                ? Map.<String, Object>of("rows", outcome.rows().size())
                                : Map.<String, Object>of("error_kind", String.valueOf(outcome.errorKind())));
                if (!extraction) {
                    continue;
                }
                if (outcome.success()) {
                    ArrayNode rows = JsonNodeFactory.instance.arrayNode();
                    outcome.rows().forEach(rows::add);
                    ObjectNode actState = JsonNodeFactory.instance.objectNode();
                    actState.set(ROWS_FIELD, rows);
                    state.mergeObject(executionScope, act.name(), actState);
                    if (finalAct) {
                        finalRows = outcome.rows();
                    }
                } else {
                    log.warn("Extraction failed on act {} of {}: {} {}", act.name(), definition.name(), outcome.errorKind(), outcome.errorDetail());
                    if (finalAct && definition.hasTargetTable()) {
                        finalExtractionFailure = outcome;
                    }
                }
            }
        }

        private void appendHistory(List<ResolvedContent> resolved, String response) {
            List<String> parts = new ArrayList<>();
            for (ResolvedContent rc : resolved) {
                String text = settings.historySummarizer().historyText(rc);
                if (text != null && !text.isEmpty()) {
                    parts.add(text);
                }
            }
            if (!parts.isEmpty()) {
                history.add(Message.user(String.join("\n\n", parts)));
            }
            history.add(Message.assistant(response));
        }

        private int writeFinalRows() {
            if (!definition.hasTargetTable() || definition.skipExtraction() || finalRows == null || finalRows.isEmpty()) {
                return 0;
            }
            List<ObjectNode> rows = deduplicator == null
                    ? finalRows
                    : deduplicator.unique(definition.targetTable(), finalRows);
            Act last = definition.orderedActs().get(definition.order().size() - 1);
            int written = content.insertRows(definition.targetTable(), executionId, last.name(), rows, clock.millis());
            if (written < finalRows.size()) {
                log.info("Suppressed {} duplicate row(s) for {}", finalRows.size() - written, definition.targetTable());
            }
            return written;
        }

        private NarrativeRunResult complete(int rowsWritten) {
            narratives.completeExecution(executionId, NarrativeStatus.SUCCEEDED, null, null, clock.millis());
            audit("narrative.finished", request, executionId, definition.name(), "succeeded", Map.of(
                    "acts", captured.size(),
                    "rows_written", rowsWritten
            ));
            log.info("Narrative {} execution={} succeeded acts={} rows={}", definition.name(), executionId, captured.size(), rowsWritten);
            return new NarrativeRunResult(executionId, NarrativeStatus.SUCCEEDED, null, null, captured, rowsWritten);
        }

        NarrativeRunResult fail(FailureReason reason, String detail) {
            try {
                narratives.completeExecution(executionId, NarrativeStatus.FAILED, reason, detail, clock.millis());
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("reason", reason.name());
                details.put("detail", detail);
                audit("narrative.finished", request, executionId, definition.name(), "failed", details);
            } catch (PersistenceException e) {
                log.error("Could not record failure of execution {}: {}", executionId, e.getMessage());
            }
            log.warn("Narrative {} execution={} failed: {} ({})", definition.name(), executionId, reason.description(), detail);
            return new NarrativeRunResult(executionId, NarrativeStatus.FAILED, reason, detail, captured, 0);
        }
    }

    private static String joinTexts(List<ResolvedContent> resolved) {
        List<String> parts = new ArrayList<>(resolved.size());
        for (ResolvedContent rc : resolved) {
            parts.add(rc.text());
        }
        return String.join("\n\n", parts);
    }

    private static List<ActInput> toActInputs(List<ResolvedContent> resolved) {
        List<ActInput> out = new ArrayList<>(resolved.size());
        for (int i = 0; i < resolved.size(); i++) {
            ResolvedContent rc = resolved.get(i);
            out.add(new ActInput(0L, i, rc.kind(), rc.text(), Hashing.sha256Hex(rc.text())));
        }
        return out;
    }

    /**
     * Per-run tuning drawn from runtime settings.
     */
    public record Settings(RetryPolicy retryPolicy, BudgetGuard budgetGuard, HistorySummarizer historySummarizer) {
    }
}
