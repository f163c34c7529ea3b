package me.golemcore.coder.domain.model;

public record MessageUpdatedEvent(AssistantMessage message) {
}
