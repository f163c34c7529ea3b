package me.golemcore.coder.domain.model;

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

import java.time.Instant;

/**
 * Observable status of a session. Retry statuses carry the attempt number, a
 * human readable reason and the time of the next attempt.
 */
public record SessionStatus(SessionStatusType type, int attempt, String message, Instant next) {

    private static final SessionStatus BUSY = new SessionStatus(SessionStatusType.BUSY, 0, null, null);
    private static final SessionStatus IDLE = new SessionStatus(SessionStatusType.IDLE, 0, null, null);

    public static SessionStatus busy() {
        return BUSY;
    }

    public static SessionStatus idle() {
        return IDLE;
    }

    public static SessionStatus retry(int attempt, String message, Instant next) {
        return new SessionStatus(SessionStatusType.RETRY, attempt, message, next);
    }
}
