package me.golemcore.coder.infrastructure.event;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.coder.port.outbound.EventBusPort;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Event bus implementation using Spring's ApplicationEventPublisher.
 *
 * <p>
 * Carries part and message updates of the session store and session errors of
 * the turn processor. Events are delivered synchronously to all registered
 * {@code @EventListener} methods; a failing listener is logged and does not
 * affect the publisher.
 *
 * <pre>{@code
 * eventBus.publish(new SessionErrorEvent(sessionId, messageId, error));
 * }</pre>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SpringEventBus implements EventBusPort {

    private final ApplicationEventPublisher eventPublisher;

    @Override
    public void publish(Object event) {
        log.debug("Publishing event: {}", event.getClass().getSimpleName());
        try {
            eventPublisher.publishEvent(event);
        } catch (RuntimeException e) { // NOSONAR - listeners must not break the publisher
            log.warn("Event listener failed for {}: {}", event.getClass().getSimpleName(), e.getMessage());
        }
    }
}
