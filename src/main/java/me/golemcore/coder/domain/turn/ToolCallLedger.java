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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.coder.domain.model.AssistantMessage;
import me.golemcore.coder.domain.model.PartTime;
import me.golemcore.coder.domain.model.PermissionRejectedException;
import me.golemcore.coder.domain.model.ToolOutput;
import me.golemcore.coder.domain.model.ToolPart;
import me.golemcore.coder.domain.model.ToolState;
import me.golemcore.coder.domain.model.ToolStatus;
import me.golemcore.coder.domain.service.AscendingIdGenerator;
import me.golemcore.coder.port.outbound.SessionPort;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks the tool calls of one turn from first sighting to completion.
 *
 * <p>
 * A call is registered while PENDING or RUNNING and unregistered once it
 * reaches COMPLETED or ERROR. Events for unknown or finished call ids are
 * ignored, which makes every transition idempotent.
 */
@Slf4j
public class ToolCallLedger {

    private final AssistantMessage message;
    private final SessionPort sessionPort;
    private final AscendingIdGenerator idGenerator;
    private final Clock clock;

    private final Map<String, ToolPart> calls = new HashMap<>();
    private final Set<String> pendingInputs = ConcurrentHashMap.newKeySet();

    public ToolCallLedger(AssistantMessage message, SessionPort sessionPort, AscendingIdGenerator idGenerator,
            Clock clock) {
        this.message = message;
        this.sessionPort = sessionPort;
        this.idGenerator = idGenerator;
        this.clock = clock;
    }

    /**
     * Register a call whose arguments started streaming.
     */
    public ToolPart onInputStart(String callId, String toolName) {
        ToolPart part = calls.get(callId);
        if (part != null && part.status() != ToolStatus.PENDING) {
            log.debug("[Ledger] ignoring tool-input-start for call {} in state {}", callId, part.status());
            return part;
        }
        if (part == null) {
            part = new ToolPart(idGenerator.next("prt"), message.getId(), message.getSessionId());
            part.setCallId(callId);
            part.setTool(toolName);
            part.setState(ToolState.pending());
            part.setMetadata(Map.of());
        }
        sessionPort.updatePart(part);
        calls.put(callId, part);
        pendingInputs.add(callId);
        return part;
    }

    /**
     * Commit the arguments of a call and mark it running.
     *
     * @return the running part, or empty when the call is unknown
     */
    public Optional<ToolPart> onToolCall(String callId, String toolName, Map<String, Object> input,
            Map<String, Object> metadata) {
        pendingInputs.remove(callId);
        ToolPart part = calls.get(callId);
        if (part == null) {
            log.debug("[Ledger] ignoring tool-call for unknown call {}", callId);
            return Optional.empty();
        }
        part.setTool(toolName != null ? toolName : part.getTool());
        part.setState(ToolState.builder()
                .status(ToolStatus.RUNNING)
                .input(input != null ? input : Map.of())
                .time(PartTime.startedAt(now()))
                .build());
        if (metadata != null) {
            part.setMetadata(metadata);
        }
        sessionPort.updatePart(part);
        return Optional.of(part);
    }

    /**
     * Complete a running call.
     *
     * @return true if a transition happened
     */
    public boolean onToolResult(String callId, Map<String, Object> input, ToolOutput output) {
        ToolPart part = runningCall(callId, "tool-result");
        if (part == null) {
            return false;
        }
        ToolState running = part.getState();
        ToolOutput result = output != null ? output : ToolOutput.builder().output("").build();
        part.setState(ToolState.builder()
                .status(ToolStatus.COMPLETED)
                .input(input != null ? input : running.getInput())
                .output(result.output())
                .title(result.title())
                .metadata(result.metadata())
                .attachments(result.attachments() != null ? result.attachments() : List.of())
                .time(new PartTime(running.getTime().getStart(), now()))
                .build());
        sessionPort.updatePart(part);
        calls.remove(callId);
        return true;
    }

    /**
     * Fail a running call.
     *
     * @return true if the failure is a permission rejection
     */
    public boolean onToolError(String callId, Map<String, Object> input, Throwable error) {
        ToolPart part = runningCall(callId, "tool-error");
        if (part == null) {
            return false;
        }
        ToolState running = part.getState();
        part.setState(ToolState.builder()
                .status(ToolStatus.ERROR)
                .input(input != null ? input : running.getInput())
                .error(describe(error))
                .time(new PartTime(running.getTime().getStart(), now()))
                .build());
        sessionPort.updatePart(part);
        calls.remove(callId);
        return isPermissionRejection(error);
    }

    public boolean hasPendingInputs() {
        return !pendingInputs.isEmpty();
    }

    public ToolPart get(String callId) {
        return calls.get(callId);
    }

    public int size() {
        return calls.size();
    }

    public void clear() {
        calls.clear();
        pendingInputs.clear();
    }

    private ToolPart runningCall(String callId, String eventType) {
        ToolPart part = calls.get(callId);
        if (part == null || part.status() != ToolStatus.RUNNING) {
            log.debug("[Ledger] ignoring {} for call {} (not running)", eventType, callId);
            return null;
        }
        return part;
    }

    private Instant now() {
        return clock.instant();
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "Unknown error";
        }
        String message = error.getMessage();
        return message != null && !message.isBlank() ? message : error.getClass().getSimpleName();
    }

    static boolean isPermissionRejection(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current instanceof PermissionRejectedException;
    }
}
