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
import me.golemcore.coder.domain.model.MessageError;
import me.golemcore.coder.domain.system.LlmErrorClassifier;
import me.golemcore.coder.domain.turn.TurnCancellation;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.Optional;

/**
 * Decides whether a failed stream attempt may be repeated and how long to wait
 * before the next attempt.
 */
@Slf4j
public class SessionRetryService {

    private final CoderProperties.RetryProperties settings;
    private final Scheduler scheduler;

    public SessionRetryService(CoderProperties.RetryProperties settings, Scheduler scheduler) {
        this.settings = settings;
        this.scheduler = scheduler;
    }

    /**
     * Human readable retry reason, or empty when the error is terminal.
     */
    public Optional<String> retryable(MessageError error) {
        if (error == null || error.isAborted() || !error.retryable()) {
            return Optional.empty();
        }
        String code = error.code();
        if (LlmErrorClassifier.isContextOverflowCode(code)) {
            return Optional.empty();
        }
        if (LlmErrorClassifier.isRateLimitCode(code)) {
            return Optional.of("Rate limited");
        }
        if (LlmErrorClassifier.PROVIDER_OVERLOADED.equals(code)) {
            return Optional.of("Provider is overloaded");
        }
        String message = error.message();
        return Optional.of(message != null && !message.isBlank() ? message : "Transient provider error");
    }

    /**
     * Backoff before the given attempt (1-based). Grows exponentially and never
     * decreases with the attempt number. A provider retry-after hint raises the
     * delay to at least the hinted value.
     */
    public long delay(int attempt, MessageError hint) {
        int safeAttempt = Math.max(1, attempt);
        double exponential = settings.getInitialDelay().toMillis()
                * Math.pow(settings.getBackoffFactor(), safeAttempt - 1.0);
        long capped = (long) Math.min(exponential, settings.getMaxDelayWithoutHints().toMillis());
        long hinted = hint != null && hint.retryAfterMs() != null ? hint.retryAfterMs() : 0L;
        long delay = Math.max(capped, hinted);
        return Math.max(0L, Math.min(delay, settings.getMaxDelay().toMillis()));
    }

    /**
     * Sleep for {@code delayMs}, returning early and silently when the turn is
     * cancelled. The caller observes the cancellation on its next check.
     */
    public void sleep(long delayMs, TurnCancellation cancellation) {
        if (delayMs <= 0 || cancellation.isCancelled()) {
            return;
        }
        try {
            Mono.delay(Duration.ofMillis(delayMs), scheduler)
                    .takeUntilOther(cancellation.whenCancelled())
                    .block();
        } catch (RuntimeException e) {
            if (Exceptions.unwrap(e) instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                cancellation.cancel("Interrupted during retry backoff");
                log.info("[Retry] backoff interrupted, turn cancelled");
                return;
            }
            throw e;
        }
    }
}
