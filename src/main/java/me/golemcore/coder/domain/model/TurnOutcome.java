package me.golemcore.coder.domain.model;

/**
 * What the caller should do after a turn: run another turn, stop, or compact
 * the session history first.
 */
public enum TurnOutcome {
    CONTINUE, STOP, COMPACT
}
