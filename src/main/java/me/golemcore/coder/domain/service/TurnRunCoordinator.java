package me.golemcore.coder.domain.service;

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
import me.golemcore.coder.domain.model.SessionStatus;
import me.golemcore.coder.domain.model.TurnOutcome;
import me.golemcore.coder.domain.model.TurnRequest;
import me.golemcore.coder.domain.turn.TurnCancellation;
import me.golemcore.coder.domain.turn.TurnProcessor;
import me.golemcore.coder.domain.turn.TurnProcessorFactory;
import me.golemcore.coder.port.outbound.SessionPort;
import me.golemcore.coder.port.outbound.SessionStatusPort;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * Runs assistant turns, at most one per session at a time.
 *
 * <p>
 * Supports:
 * </p>
 * <ul>
 * <li>Submit a turn: the assistant message is created and persisted, then the
 * turn runs on the turn executor.</li>
 * <li>Cancel: signal the running turn of a session to unwind.</li>
 * <li>Runners are evicted as soon as their turn ends.</li>
 * </ul>
 */
@Service
@Slf4j
public class TurnRunCoordinator {

    private final TurnProcessorFactory processorFactory;
    private final SessionPort sessionPort;
    private final SessionStatusPort sessionStatusPort;
    private final AscendingIdGenerator idGenerator;
    private final ExecutorService turnExecutor;
    private final Clock clock;

    private final Map<String, ActiveTurn> activeTurns = new ConcurrentHashMap<>();

    public TurnRunCoordinator(TurnProcessorFactory processorFactory, SessionPort sessionPort,
            SessionStatusPort sessionStatusPort, AscendingIdGenerator idGenerator,
            @Qualifier("turnExecutor") ExecutorService turnExecutor, Clock clock) {
        this.processorFactory = processorFactory;
        this.sessionPort = sessionPort;
        this.sessionStatusPort = sessionStatusPort;
        this.idGenerator = idGenerator;
        this.turnExecutor = turnExecutor;
        this.clock = clock;
    }

    /**
     * Start a turn.
     *
     * @throws IllegalStateException
     *             if the session already has a running turn
     */
    public TurnHandle submit(TurnRequest request) {
        Objects.requireNonNull(request, "request");
        String sessionId = Objects.requireNonNull(request.sessionId(), "sessionId");

        TurnCancellation cancellation = new TurnCancellation();
        ActiveTurn active = new ActiveTurn(cancellation);
        if (activeTurns.putIfAbsent(sessionId, active) != null) {
            throw new IllegalStateException("Session " + sessionId + " already has a running turn");
        }

        CompletableFuture<TurnOutcome> outcome;
        AssistantMessage message;
        try {
            message = AssistantMessage.builder()
                    .id(idGenerator.next("msg"))
                    .sessionId(sessionId)
                    .parentId(request.parentMessageId())
                    .agent(request.agent())
                    .providerId(request.model() != null ? request.model().providerId() : null)
                    .modelId(request.model() != null ? request.model().modelId() : null)
                    .createdAt(clock.instant())
                    .build();
            sessionPort.updateMessage(message);

            TurnProcessor processor = processorFactory.create(message, request.model(), request.ruleset(),
                    cancellation);
            log.info("[Coordinator] starting turn {} for session {}", message.getId(), sessionId);
            outcome = CompletableFuture.supplyAsync(() -> processor.process(request.streamRequest()),
                    turnExecutor);
        } catch (RuntimeException e) {
            activeTurns.remove(sessionId, active);
            throw e;
        }

        return new TurnHandle(message, outcome.whenComplete((result, error) -> {
            activeTurns.remove(sessionId, active);
            sessionStatusPort.set(sessionId, SessionStatus.idle());
            if (error != null) {
                log.error("[Coordinator] turn {} failed", message.getId(), error);
            } else {
                log.info("[Coordinator] turn {} ended: {}", message.getId(), result);
            }
        }));
    }

    /**
     * Cancel the running turn of a session.
     *
     * @return true if a running turn was signalled
     */
    public boolean cancel(String sessionId, String reason) {
        ActiveTurn active = activeTurns.get(sessionId);
        if (active == null) {
            log.info("[Coordinator] cancel requested while idle: session={}", sessionId);
            return false;
        }
        boolean cancelled = active.cancellation().cancel(reason);
        log.info("[Coordinator] cancel requested: session={}, cancelled={}", sessionId, cancelled);
        return cancelled;
    }

    public boolean isRunning(String sessionId) {
        return activeTurns.containsKey(sessionId);
    }

    /**
     * Message created for a submitted turn and the eventual outcome.
     */
    public record TurnHandle(AssistantMessage message, CompletableFuture<TurnOutcome> outcome) {
    }

    private record ActiveTurn(TurnCancellation cancellation) {
    }
}
