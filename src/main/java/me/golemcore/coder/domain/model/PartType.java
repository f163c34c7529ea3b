package me.golemcore.coder.domain.model;

public enum PartType {
    TEXT, REASONING, TOOL, STEP_START, STEP_FINISH, PATCH
}
