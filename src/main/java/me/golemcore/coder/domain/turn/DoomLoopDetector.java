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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.coder.domain.model.Part;
import me.golemcore.coder.domain.model.PermissionRequest;
import me.golemcore.coder.domain.model.PermissionRuleset;
import me.golemcore.coder.domain.model.ToolPart;
import me.golemcore.coder.domain.model.ToolStatus;
import me.golemcore.coder.domain.model.TurnAbortedException;
import me.golemcore.coder.port.outbound.PermissionPort;
import me.golemcore.coder.port.outbound.SessionPort;
import reactor.core.Disposable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Asks for approval when the model keeps calling the same tool with the same
 * arguments.
 *
 * <p>
 * Inputs are compared as JSON with map keys sorted, so key order does not
 * matter.
 */
@Slf4j
public class DoomLoopDetector {

    public static final String PERMISSION = "doom_loop";

    private final SessionPort sessionPort;
    private final PermissionPort permissionPort;
    private final ObjectMapper canonicalMapper;
    private final int threshold;

    public DoomLoopDetector(SessionPort sessionPort, PermissionPort permissionPort, ObjectMapper objectMapper,
            int threshold) {
        this.sessionPort = sessionPort;
        this.permissionPort = permissionPort;
        this.canonicalMapper = objectMapper.copy().enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        this.threshold = threshold;
    }

    /**
     * Inspect the latest parts after {@code running} was started.
     *
     * @return true if approval was requested and granted
     * @throws me.golemcore.coder.domain.model.PermissionRejectedException
     *             when approval was denied
     * @throws TurnAbortedException
     *             when the turn is cancelled while approval is pending
     */
    public boolean inspect(ToolPart running, PermissionRuleset ruleset, TurnCancellation cancellation) {
        if (threshold <= 0) {
            return false;
        }
        List<Part> parts = sessionPort.listParts(running.getMessageId());
        if (parts.size() < threshold) {
            return false;
        }
        String expectedInput = canonical(running.getState().getInput());
        List<Part> window = parts.subList(parts.size() - threshold, parts.size());
        for (Part part : window) {
            if (!(part instanceof ToolPart tool)
                    || !Objects.equals(tool.getTool(), running.getTool())
                    || tool.status() == ToolStatus.PENDING
                    || !expectedInput.equals(canonical(tool.getState().getInput()))) {
                return false;
            }
        }

        log.info("[DoomLoop] tool '{}' called {} times with identical input, asking for approval",
                running.getTool(), threshold);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("tool", running.getTool());
        metadata.put("input", running.getState().getInput());
        PermissionRequest request = PermissionRequest.builder()
                .permission(PERMISSION)
                .sessionId(running.getSessionId())
                .patterns(List.of(running.getTool()))
                .always(List.of(running.getTool()))
                .metadata(metadata)
                .ruleset(ruleset)
                .build();
        await(request, cancellation);
        return true;
    }

    private void await(PermissionRequest request, TurnCancellation cancellation) {
        cancellation.throwIfCancelled();
        CompletableFuture<Void> answer = permissionPort.ask(request);
        CompletableFuture<Void> gate = new CompletableFuture<>();
        answer.whenComplete((ignored, error) -> {
            if (error != null) {
                gate.completeExceptionally(error);
            } else {
                gate.complete(null);
            }
        });
        Disposable abort = cancellation.whenCancelled().subscribe(reason -> {
            if (gate.completeExceptionally(new TurnAbortedException(reason))) {
                log.info("[DoomLoop] approval for {} abandoned: {}", request.patterns(), reason);
                answer.cancel(false);
            }
        });
        try {
            gate.get();
        } catch (ExecutionException e) {
            Throwable cause = unwrap(e.getCause() != null ? e.getCause() : e);
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new CompletionException(cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TurnAbortedException("Interrupted while waiting for doom-loop approval");
        } finally {
            abort.dispose();
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private String canonical(Map<String, Object> input) {
        try {
            return canonicalMapper.writeValueAsString(input != null ? input : Map.of());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Tool input is not serializable", e);
        }
    }
}
