package me.golemcore.coder.domain.model;

public enum PermissionAction {
    ALLOW, DENY, ASK
}
