package me.golemcore.coder.adapter.outbound.session;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.coder.domain.model.AssistantMessage;
import me.golemcore.coder.domain.model.MessageUpdatedEvent;
import me.golemcore.coder.domain.model.Part;
import me.golemcore.coder.domain.model.PartUpdatedEvent;
import me.golemcore.coder.port.outbound.EventBusPort;
import me.golemcore.coder.port.outbound.SessionPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory session store.
 *
 * <p>
 * Messages and parts are stored as deep copies, so callers may keep mutating
 * their own instances. Parts of a message keep their insertion order. Every
 * write is announced on the event bus.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InMemorySessionAdapter implements SessionPort {

    private final ObjectMapper objectMapper;
    private final EventBusPort eventBus;

    private final Map<String, AssistantMessage> messages = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Part>> partsByMessage = new ConcurrentHashMap<>();

    @Override
    public void updatePart(Part part) {
        updatePart(part, null);
    }

    @Override
    public void updatePart(Part part, String delta) {
        Part stored = copy(part, Part.class);
        Map<String, Part> parts = partsByMessage.computeIfAbsent(stored.getMessageId(),
                id -> new LinkedHashMap<>());
        synchronized (parts) {
            parts.put(stored.getId(), stored);
        }
        log.trace("Stored part {} of message {}", stored.getId(), stored.getMessageId());
        eventBus.publish(new PartUpdatedEvent(copy(stored, Part.class), delta));
    }

    @Override
    public void updateMessage(AssistantMessage message) {
        AssistantMessage stored = copy(message, AssistantMessage.class);
        messages.put(stored.getId(), stored);
        eventBus.publish(new MessageUpdatedEvent(copy(stored, AssistantMessage.class)));
    }

    @Override
    public List<Part> listParts(String messageId) {
        Map<String, Part> parts = partsByMessage.get(messageId);
        if (parts == null) {
            return List.of();
        }
        List<Part> result = new ArrayList<>();
        synchronized (parts) {
            for (Part part : parts.values()) {
                result.add(copy(part, Part.class));
            }
        }
        return result;
    }

    public Optional<AssistantMessage> getMessage(String messageId) {
        return Optional.ofNullable(messages.get(messageId)).map(message -> copy(message, AssistantMessage.class));
    }

    private <T> T copy(T value, Class<T> type) {
        return objectMapper.convertValue(value, type);
    }
}
