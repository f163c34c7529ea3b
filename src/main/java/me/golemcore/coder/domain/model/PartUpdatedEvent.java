package me.golemcore.coder.domain.model;

/**
 * Published after a part is persisted. {@code delta} is the newly appended
 * text for streaming updates, otherwise null.
 */
public record PartUpdatedEvent(Part part, String delta) {
}
