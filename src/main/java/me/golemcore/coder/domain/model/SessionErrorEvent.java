package me.golemcore.coder.domain.model;

/**
 * Published when a turn ends with an error recorded on its message.
 */
public record SessionErrorEvent(String sessionId, String messageId, MessageError error) {
}
