package me.golemcore.coder.port.outbound;

/**
 * Port for session summarization. Invoked fire-and-forget after each step.
 */
public interface SummaryPort {

    void summarize(String sessionId, String messageId);
}
