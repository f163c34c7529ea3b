package me.golemcore.coder.domain.turn;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.coder.domain.model.AssistantMessage;
import me.golemcore.coder.domain.model.LlmStreamException;
import me.golemcore.coder.domain.model.MessageError;
import me.golemcore.coder.domain.model.ModelInfo;
import me.golemcore.coder.domain.model.Part;
import me.golemcore.coder.domain.model.PartTime;
import me.golemcore.coder.domain.model.Patch;
import me.golemcore.coder.domain.model.PatchPart;
import me.golemcore.coder.domain.model.PermissionRejectedException;
import me.golemcore.coder.domain.model.PermissionRuleset;
import me.golemcore.coder.domain.model.ReasoningPart;
import me.golemcore.coder.domain.model.SessionErrorEvent;
import me.golemcore.coder.domain.model.SessionStatus;
import me.golemcore.coder.domain.model.StepFinishPart;
import me.golemcore.coder.domain.model.StepStartPart;
import me.golemcore.coder.domain.model.StreamEvent;
import me.golemcore.coder.domain.model.StreamRequest;
import me.golemcore.coder.domain.model.StreamingPart;
import me.golemcore.coder.domain.model.TextPart;
import me.golemcore.coder.domain.model.ToolPart;
import me.golemcore.coder.domain.model.ToolState;
import me.golemcore.coder.domain.model.ToolStatus;
import me.golemcore.coder.domain.model.TurnAbortedException;
import me.golemcore.coder.domain.model.TurnOutcome;
import me.golemcore.coder.domain.service.UsageCalculator;
import me.golemcore.coder.domain.system.LlmErrorClassifier;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import me.golemcore.coder.port.outbound.TextCompletionHook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Exceptions;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives one assistant turn to completion.
 *
 * <p>
 * Consumes the model stream event by event, materializes text, reasoning and
 * tool parts of the assistant message, retries failed stream attempts and
 * finally tells the caller whether to continue, stop or compact.
 *
 * <p>
 * A processor is bound to one message and processes it on the calling thread.
 * Only the delta flush timer runs elsewhere; it touches streaming parts under
 * the part's monitor.
 */
public class TurnProcessor {

    private static final Logger log = LoggerFactory.getLogger(TurnProcessor.class);

    static final String ABORTED_TOOL_ERROR = "Tool execution aborted";

    private final AssistantMessage message;
    private final ModelInfo model;
    private final PermissionRuleset ruleset;
    private final TurnCancellation cancellation;
    private final TurnDependencies deps;
    private final CoderProperties.TurnProperties settings;

    private final ToolCallLedger ledger;
    private final DoomLoopDetector doomLoopDetector;
    private final StreamRetryPolicy retryPolicy;

    private final Map<String, TextPart> textParts = new HashMap<>();
    private final Map<String, ReasoningPart> reasoningParts = new HashMap<>();
    private final Map<String, Part> streamingParts = new ConcurrentHashMap<>();
    private final AtomicBoolean processing = new AtomicBoolean();

    private String snapshot;
    private boolean blocked;
    private boolean stopConsuming;
    private boolean needsCompaction;
    private volatile TurnState state = TurnState.IDLE;

    TurnProcessor(AssistantMessage message, ModelInfo model, PermissionRuleset ruleset,
            TurnCancellation cancellation, TurnDependencies deps) {
        this.message = Objects.requireNonNull(message, "message");
        this.model = model;
        this.ruleset = ruleset != null ? ruleset : PermissionRuleset.EMPTY;
        this.cancellation = cancellation != null ? cancellation : new TurnCancellation();
        this.deps = deps;
        this.settings = deps.settings();
        this.ledger = new ToolCallLedger(message, deps.sessionPort(), deps.idGenerator(), deps.clock());
        this.doomLoopDetector = new DoomLoopDetector(deps.sessionPort(), deps.permissionPort(), deps.objectMapper(),
                settings.getDoomLoopThreshold());
        this.retryPolicy = new StreamRetryPolicy(deps.retryService(), message.getProviderId(),
                settings.getMaxStreamIdleTimeoutRetries(), deps.maxRetryAttempts());
    }

    /**
     * Run the turn until the stream is exhausted, a terminal error is recorded
     * or the turn is cancelled.
     *
     * @throws IllegalStateException
     *             if the processor is already running
     */
    public TurnOutcome process(StreamRequest request) {
        if (!processing.compareAndSet(false, true)) {
            throw new IllegalStateException("Turn " + message.getId() + " is already being processed");
        }
        try {
            log.info("[Turn] processing message {} of session {}", message.getId(), message.getSessionId());
            needsCompaction = false;
            boolean retry;
            do {
                retry = runAttempt(request);
            } while (retry);
            return finish();
        } finally {
            processing.set(false);
        }
    }

    public AssistantMessage getMessage() {
        return message;
    }

    public ToolPart partFromToolCall(String callId) {
        return ledger.get(callId);
    }

    public TurnState getState() {
        return state;
    }

    // ==================== stream attempt ====================

    private boolean runAttempt(StreamRequest request) {
        transition(TurnState.STREAMING);
        DeltaFlushBuffer buffer = new DeltaFlushBuffer(deps.scheduler(), settings.getDeltaFlushInterval(),
                this::persistDelta, cancellation);
        RuntimeException failure = null;
        try {
            consumeStream(request, buffer);
        } catch (RuntimeException e) {
            failure = e;
        } finally {
            buffer.flushAll();
            buffer.close();
            textParts.clear();
            reasoningParts.clear();
            streamingParts.clear();
        }
        return failure != null && handleFailure(Exceptions.unwrap(failure));
    }

    private void consumeStream(StreamRequest request, DeltaFlushBuffer buffer) {
        cancellation.throwIfCancelled();
        try (StreamIdleWatchdog.WatchedStream<StreamEvent> events = deps.watchdog()
                .watch(deps.llmStreamPort().stream(request), this::idleDeadlineMs, cancellation)) {
            while (events.hasNext()) {
                cancellation.throwIfCancelled();
                dispatch(events.next(), buffer);
                if (needsCompaction || stopConsuming) {
                    break;
                }
            }
        }
    }

    private long idleDeadlineMs() {
        long base = settings.getStreamIdleTimeout().toMillis();
        if (base <= 0) {
            return 0;
        }
        return ledger.hasPendingInputs() ? settings.getToolInputPendingTimeout().toMillis() : base;
    }

    private void dispatch(StreamEvent event, DeltaFlushBuffer buffer) {
        log.debug("[Turn] event {}", event.type().wireName());
        switch (event.type()) {
        case START -> deps.sessionStatusPort().set(message.getSessionId(), SessionStatus.busy());
        case REASONING_START -> onReasoningStart((StreamEvent.ReasoningStart) event);
        case REASONING_DELTA -> onReasoningDelta((StreamEvent.ReasoningDelta) event, buffer);
        case REASONING_END -> onReasoningEnd((StreamEvent.ReasoningEnd) event, buffer);
        case TOOL_INPUT_START -> {
            StreamEvent.ToolInputStart start = (StreamEvent.ToolInputStart) event;
            ledger.onInputStart(start.id(), start.toolName());
        }
        case TOOL_INPUT_DELTA, TOOL_INPUT_END, FINISH -> {
            // nothing to persist
        }
        case TOOL_CALL -> onToolCall((StreamEvent.ToolCall) event);
        case TOOL_RESULT -> {
            StreamEvent.ToolResult result = (StreamEvent.ToolResult) event;
            ledger.onToolResult(result.toolCallId(), result.input(), result.output());
        }
        case TOOL_ERROR -> onToolError((StreamEvent.ToolError) event);
        case ERROR -> throw asRuntime(((StreamEvent.StreamError) event).error());
        case START_STEP -> onStartStep();
        case FINISH_STEP -> onFinishStep((StreamEvent.FinishStep) event);
        case TEXT_START -> onTextStart((StreamEvent.TextStart) event);
        case TEXT_DELTA -> onTextDelta((StreamEvent.TextDelta) event, buffer);
        case TEXT_END -> onTextEnd((StreamEvent.TextEnd) event, buffer);
        default -> log.warn("[Turn] ignoring unhandled stream event {}", event);
        }
    }

    // ==================== reasoning ====================

    private void onReasoningStart(StreamEvent.ReasoningStart event) {
        if (reasoningParts.containsKey(event.id())) {
            return;
        }
        ReasoningPart part = new ReasoningPart(deps.idGenerator().next("prt"), message.getId(),
                message.getSessionId());
        part.setTime(PartTime.startedAt(now()));
        part.setMetadata(event.metadata());
        reasoningParts.put(event.id(), part);
        streamingParts.put(part.getId(), part);
    }

    private void onReasoningDelta(StreamEvent.ReasoningDelta event, DeltaFlushBuffer buffer) {
        ReasoningPart part = reasoningParts.get(event.id());
        if (part == null) {
            log.debug("[Turn] reasoning delta for unknown id {}", event.id());
            return;
        }
        updateMetadata(part, event.metadata());
        buffer.append(part.getId(), event.text());
    }

    private void onReasoningEnd(StreamEvent.ReasoningEnd event, DeltaFlushBuffer buffer) {
        ReasoningPart part = reasoningParts.remove(event.id());
        if (part == null) {
            return;
        }
        String text = buffer.finalize(part.getId()).stripTrailing();
        streamingParts.remove(part.getId());
        completeStreamingPart(part, text, event.metadata());
    }

    // ==================== text ====================

    private void onTextStart(StreamEvent.TextStart event) {
        String key = textKey(event.id());
        if (textParts.containsKey(key)) {
            return;
        }
        TextPart part = new TextPart(deps.idGenerator().next("prt"), message.getId(), message.getSessionId());
        part.setTime(PartTime.startedAt(now()));
        part.setMetadata(event.metadata());
        textParts.put(key, part);
        streamingParts.put(part.getId(), part);
    }

    private void onTextDelta(StreamEvent.TextDelta event, DeltaFlushBuffer buffer) {
        TextPart part = textParts.get(textKey(event.id()));
        if (part == null) {
            log.debug("[Turn] text delta for unknown id {}", event.id());
            return;
        }
        updateMetadata(part, event.metadata());
        buffer.append(part.getId(), event.text());
    }

    private void onTextEnd(StreamEvent.TextEnd event, DeltaFlushBuffer buffer) {
        TextPart part = textParts.remove(textKey(event.id()));
        if (part == null) {
            return;
        }
        String text = buffer.finalize(part.getId()).stripTrailing();
        streamingParts.remove(part.getId());
        TextCompletionHook.TextCompletionContext context = new TextCompletionHook.TextCompletionContext(
                message.getSessionId(), message.getId(), part.getId());
        for (TextCompletionHook hook : deps.textCompletionHooks()) {
            text = hook.onTextComplete(context, text);
        }
        completeStreamingPart(part, text, event.metadata());
    }

    private void completeStreamingPart(Part part, String text, Map<String, Object> metadata) {
        StreamingPart streaming = (StreamingPart) part;
        synchronized (part) {
            streaming.setText(text != null ? text : "");
            PartTime time = streaming.getTime() != null ? streaming.getTime() : PartTime.startedAt(now());
            time.setEnd(now());
            streaming.setTime(time);
            if (metadata != null) {
                streaming.setMetadata(metadata);
            }
        }
        deps.sessionPort().updatePart(part);
    }

    private void persistDelta(String partId, String fullText, String delta) {
        Part part = streamingParts.get(partId);
        if (part == null) {
            return;
        }
        synchronized (part) {
            ((StreamingPart) part).setText(fullText);
            deps.sessionPort().updatePart(part, delta);
        }
    }

    private static void updateMetadata(Part part, Map<String, Object> metadata) {
        if (metadata == null) {
            return;
        }
        synchronized (part) {
            ((StreamingPart) part).setMetadata(metadata);
        }
    }

    private static String textKey(String id) {
        return id != null ? id : "";
    }

    // ==================== tools ====================

    private void onToolCall(StreamEvent.ToolCall event) {
        Optional<ToolPart> running = ledger.onToolCall(event.toolCallId(), event.toolName(), event.input(),
                event.metadata());
        if (running.isEmpty()) {
            return;
        }
        try {
            doomLoopDetector.inspect(running.get(), ruleset, cancellation);
        } catch (PermissionRejectedException e) {
            if (settings.isContinueLoopOnDeny()) {
                log.info("[Turn] doom-loop approval denied for tool {}, continuing", event.toolName());
                return;
            }
            log.info("[Turn] doom-loop approval denied for tool {}, stopping turn", event.toolName());
            blocked = true;
            stopConsuming = true;
        }
    }

    private void onToolError(StreamEvent.ToolError event) {
        boolean rejected = ledger.onToolError(event.toolCallId(), event.input(), event.error());
        if (rejected && !settings.isContinueLoopOnDeny()) {
            log.info("[Turn] permission rejected for call {}, turn is blocked", event.toolCallId());
            blocked = true;
        }
    }

    // ==================== steps ====================

    private void onStartStep() {
        snapshot = deps.snapshotPort().track();
        deps.sessionPort().updatePart(new StepStartPart(deps.idGenerator().next("prt"), message.getId(),
                message.getSessionId(), snapshot));
    }

    private void onFinishStep(StreamEvent.FinishStep event) {
        UsageCalculator.StepCost usage = deps.usageCalculator().calculate(event.usage(), model);
        message.setFinish(event.finishReason());
        message.addCost(usage.cost());
        message.addTokens(usage.tokens());

        StepFinishPart part = new StepFinishPart(deps.idGenerator().next("prt"), message.getId(),
                message.getSessionId());
        part.setReason(event.finishReason());
        part.setSnapshot(deps.snapshotPort().track());
        part.setTokens(usage.tokens());
        part.setCost(usage.cost());
        deps.sessionPort().updatePart(part);
        deps.sessionPort().updateMessage(message);

        materializePatch();
        summarize();

        if (deps.compactionPolicy().isOverflow(usage.tokens(), model)) {
            needsCompaction = true;
        }
    }

    private void materializePatch() {
        if (snapshot == null) {
            return;
        }
        Patch patch = deps.snapshotPort().patch(snapshot);
        if (patch != null && patch.hasFiles()) {
            deps.sessionPort().updatePart(new PatchPart(deps.idGenerator().next("prt"), message.getId(),
                    message.getSessionId(), patch));
        }
        snapshot = null;
    }

    private void summarize() {
        if (!deps.summaryEnabled()) {
            return;
        }
        String sessionId = message.getSessionId();
        String target = message.getParentId() != null ? message.getParentId() : message.getId();
        CompletableFuture.runAsync(() -> deps.summaryPort().summarize(sessionId, target), deps.summaryExecutor())
                .exceptionally(e -> {
                    log.warn("[Turn] summarization failed for session {}: {}", sessionId, e.getMessage());
                    return null;
                });
    }

    // ==================== failures ====================

    private boolean handleFailure(Throwable failure) {
        if (cancellation.isCancelled() || failure instanceof TurnAbortedException) {
            Throwable aborted = failure instanceof TurnAbortedException
                    ? failure
                    : new TurnAbortedException(cancellation.getReason());
            log.info("[Turn] message {} aborted: {}", message.getId(), aborted.getMessage());
            recordError(LlmErrorClassifier.toMessageError(aborted, message.getProviderId()));
            return false;
        }

        RetryDecision decision = retryPolicy.onFailure(failure);
        if (decision instanceof RetryDecision.Retry retry) {
            transition(TurnState.RETRYING);
            Instant next = now().plusMillis(retry.delayMs());
            deps.sessionStatusPort().set(message.getSessionId(),
                    SessionStatus.retry(retry.attempt(), retry.message(), next));
            deps.retryService().sleep(retry.delayMs(), cancellation);
            return true;
        }

        MessageError error = ((RetryDecision.GiveUp) decision).error();
        if (settings.isCompactOnContextOverflow() && LlmErrorClassifier.isContextOverflowCode(error.code())) {
            log.info("[Turn] context overflow on message {}, requesting compaction", message.getId());
            needsCompaction = true;
            return false;
        }
        log.error("[Turn] stream failed for message {}: {}", message.getId(), error.message(), failure);
        recordError(error);
        return false;
    }

    private void recordError(MessageError error) {
        if (message.getError() == null) {
            message.setError(error);
        }
        deps.eventBus().publish(new SessionErrorEvent(message.getSessionId(), message.getId(), message.getError()));
        deps.sessionStatusPort().set(message.getSessionId(), SessionStatus.idle());
    }

    private static RuntimeException asRuntime(Throwable error) {
        if (error instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        return new LlmStreamException(error);
    }

    // ==================== finalization ====================

    private TurnOutcome finish() {
        transition(TurnState.FINALIZING);
        if (snapshot != null) {
            try {
                materializePatch();
            } catch (RuntimeException e) {
                log.warn("[Turn] failed to record patch of message {}: {}", message.getId(), e.getMessage());
                snapshot = null;
            }
        }

        Instant now = now();
        for (Part part : deps.sessionPort().listParts(message.getId())) {
            if (part instanceof ToolPart tool && (tool.getState() == null || !tool.getState().isFinal())) {
                Map<String, Object> input = tool.getState() != null && tool.getState().getInput() != null
                        ? tool.getState().getInput()
                        : Map.of();
                tool.setState(ToolState.builder()
                        .status(ToolStatus.ERROR)
                        .input(input)
                        .error(ABORTED_TOOL_ERROR)
                        .time(new PartTime(now, now))
                        .build());
                deps.sessionPort().updatePart(tool);
            }
        }
        ledger.clear();

        message.setCompletedAt(now);
        deps.sessionPort().updateMessage(message);

        TurnOutcome outcome;
        if (needsCompaction) {
            outcome = TurnOutcome.COMPACT;
        } else if (blocked || message.hasError()) {
            outcome = TurnOutcome.STOP;
        } else {
            outcome = TurnOutcome.CONTINUE;
        }
        transition(TurnState.DONE);
        log.info("[Turn] message {} finished: {} (cost={}, tokens={})", message.getId(), outcome,
                message.getCost(), message.getTokens());
        return outcome;
    }

    private void transition(TurnState next) {
        if (state != next) {
            log.debug("[Turn] {} -> {}", state, next);
            state = next;
        }
    }

    private Instant now() {
        return deps.clock().instant();
    }
}
