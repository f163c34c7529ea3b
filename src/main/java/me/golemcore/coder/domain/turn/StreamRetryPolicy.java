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
import me.golemcore.coder.domain.model.MessageError;
import me.golemcore.coder.domain.model.StreamIdleTimeoutException;
import me.golemcore.coder.domain.service.SessionRetryService;
import me.golemcore.coder.domain.system.LlmErrorClassifier;

import java.util.Map;
import java.util.Optional;

/**
 * Per-turn retry bookkeeping. Idle timeouts have their own budget; every other
 * failure is classified and retried while the classification says it is
 * transient.
 */
@Slf4j
public class StreamRetryPolicy {

    private final SessionRetryService retryService;
    private final String providerId;
    private final int maxIdleTimeoutRetries;
    private final int maxAttempts;

    private int attempt;
    private int idleTimeoutRetries;

    public StreamRetryPolicy(SessionRetryService retryService, String providerId, int maxIdleTimeoutRetries,
            int maxAttempts) {
        this.retryService = retryService;
        this.providerId = providerId;
        this.maxIdleTimeoutRetries = maxIdleTimeoutRetries;
        this.maxAttempts = maxAttempts;
    }

    public RetryDecision onFailure(Throwable failure) {
        if (failure instanceof StreamIdleTimeoutException timeout) {
            return onIdleTimeout(timeout);
        }

        MessageError error = LlmErrorClassifier.toMessageError(failure, providerId);
        Optional<String> reason = retryService.retryable(error);
        if (reason.isEmpty()) {
            return new RetryDecision.GiveUp(error);
        }
        if (maxAttempts > 0 && attempt >= maxAttempts) {
            log.warn("[Retry] giving up after {} attempts: {}", attempt, error.message());
            return new RetryDecision.GiveUp(error);
        }
        attempt++;
        long delayMs = retryService.delay(attempt, error);
        log.info("[Retry] attempt {} in {}ms: {}", attempt, delayMs, reason.get());
        return new RetryDecision.Retry(attempt, delayMs, reason.get());
    }

    public int getAttempt() {
        return attempt;
    }

    public int getIdleTimeoutRetries() {
        return idleTimeoutRetries;
    }

    private RetryDecision onIdleTimeout(StreamIdleTimeoutException timeout) {
        if (idleTimeoutRetries >= maxIdleTimeoutRetries) {
            log.warn("[Retry] stream idle timeout persisted after {} retries", idleTimeoutRetries);
            return new RetryDecision.GiveUp(idleTimeoutExhausted(timeout));
        }
        idleTimeoutRetries++;
        long delayMs = retryService.delay(idleTimeoutRetries, null);
        String message = "Stream idle timeout (attempt " + idleTimeoutRetries + "/" + maxIdleTimeoutRetries + ")";
        log.info("[Retry] {} in {}ms", message, delayMs);
        return new RetryDecision.Retry(idleTimeoutRetries, delayMs, message);
    }

    private MessageError idleTimeoutExhausted(StreamIdleTimeoutException timeout) {
        String message = "Stream timed out after " + idleTimeoutRetries + " retries (" + timeout.getTimeoutMs()
                + "ms idle). The model may be generating content that exceeds output limits or the connection"
                + " is unstable. Try breaking the task into smaller pieces or check your network connection.";
        return MessageError.builder()
                .name(MessageError.API_ERROR)
                .message(message)
                .code(LlmErrorClassifier.STREAM_IDLE_TIMEOUT_EXHAUSTED)
                .retryable(false)
                .metadata(Map.of(
                        "retries", String.valueOf(idleTimeoutRetries),
                        "timeoutMs", String.valueOf(timeout.getTimeoutMs())))
                .build();
    }
}
