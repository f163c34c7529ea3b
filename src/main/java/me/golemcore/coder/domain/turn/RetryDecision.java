package me.golemcore.coder.domain.turn;

import me.golemcore.coder.domain.model.MessageError;

/**
 * Outcome of a failed stream attempt.
 */
public sealed interface RetryDecision {

    /**
     * Reopen the stream after {@code delayMs}.
     */
    record Retry(int attempt, long delayMs, String message) implements RetryDecision {
    }

    /**
     * Stop the turn and record {@code error} on the message.
     */
    record GiveUp(MessageError error) implements RetryDecision {
    }
}
