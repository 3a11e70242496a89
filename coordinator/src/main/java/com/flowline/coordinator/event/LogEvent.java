package com.flowline.coordinator.event;

/** A chunk of step output. origin names the step that produced it and may be null. */
public record LogEvent(String origin, String payload) implements BuildEvent {

    public LogEvent(String payload) {
        this(null, payload);
    }

    @Override
    public EventType eventType() { return EventType.LOG; }
}
