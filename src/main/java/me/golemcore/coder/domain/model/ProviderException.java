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

import lombok.Getter;

/**
 * Failure reported by a model provider, with the HTTP status and retry hints
 * when the provider sent them.
 */
@Getter
public class ProviderException extends RuntimeException {

    private final String providerId;
    private final int statusCode;
    private final Long retryAfterMs;
    private final Boolean retryable;

    public ProviderException(String providerId, int statusCode, String message, Long retryAfterMs,
            Boolean retryable) {
        super(message);
        this.providerId = providerId;
        this.statusCode = statusCode;
        this.retryAfterMs = retryAfterMs;
        this.retryable = retryable;
    }

    public ProviderException(String providerId, int statusCode, String message) {
        this(providerId, statusCode, message, null, null);
    }

    public ProviderException(String providerId, int statusCode, String message, Long retryAfterMs,
            Boolean retryable, Throwable cause) {
        super(message, cause);
        this.providerId = providerId;
        this.statusCode = statusCode;
        this.retryAfterMs = retryAfterMs;
        this.retryable = retryable;
    }
}
