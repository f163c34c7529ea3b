package me.golemcore.coder.domain.turn;

public enum TurnState {
    IDLE, STREAMING, RETRYING, FINALIZING, DONE
}
