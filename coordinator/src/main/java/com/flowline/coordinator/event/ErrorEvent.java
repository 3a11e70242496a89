package com.flowline.coordinator.event;

/** Human-readable failure, either from a step (origin set) or from the build itself. */
public record ErrorEvent(String message, String origin) implements BuildEvent {

    public ErrorEvent(String message) {
        this(message, null);
    }

    @Override
    public EventType eventType() { return EventType.ERROR; }
}
