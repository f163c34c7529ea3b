package me.golemcore.coder.adapter.outbound.status;

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
import me.golemcore.coder.domain.model.SessionStatus;
import me.golemcore.coder.domain.model.SessionStatusType;
import me.golemcore.coder.port.outbound.SessionStatusPort;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps the latest status of every non-idle session.
 */
@Component
@Slf4j
public class InMemorySessionStatusAdapter implements SessionStatusPort {

    private final Map<String, SessionStatus> statuses = new ConcurrentHashMap<>();

    @Override
    public void set(String sessionId, SessionStatus status) {
        if (status == null || status.type() == SessionStatusType.IDLE) {
            if (statuses.remove(sessionId) != null) {
                log.debug("[Status] session {} is idle", sessionId);
            }
            return;
        }
        SessionStatus previous = statuses.put(sessionId, status);
        if (status.type() == SessionStatusType.RETRY) {
            log.info("[Status] session {} retrying (attempt {}): {}", sessionId, status.attempt(), status.message());
        } else if (previous == null || previous.type() != status.type()) {
            log.debug("[Status] session {} is {}", sessionId, status.type());
        }
    }

    public SessionStatus get(String sessionId) {
        return statuses.getOrDefault(sessionId, SessionStatus.idle());
    }
}
