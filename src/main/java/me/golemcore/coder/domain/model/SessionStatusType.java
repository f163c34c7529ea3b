package me.golemcore.coder.domain.model;

public enum SessionStatusType {
    BUSY, RETRY, IDLE
}
