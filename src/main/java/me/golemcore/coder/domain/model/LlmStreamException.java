package me.golemcore.coder.domain.model;

/**
 * Wraps a checked failure delivered inside a stream error event.
 */
public class LlmStreamException extends RuntimeException {

    public LlmStreamException(Throwable cause) {
        super(cause.getMessage(), cause);
    }
}
