package me.golemcore.coder.domain.model;

/**
 * Lifecycle of a tool call: PENDING, then RUNNING, then COMPLETED or ERROR.
 */
public enum ToolStatus {
    PENDING, RUNNING, COMPLETED, ERROR;

    public boolean isFinal() {
        return this == COMPLETED || this == ERROR;
    }
}
