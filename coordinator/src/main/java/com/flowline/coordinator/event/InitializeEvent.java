package com.flowline.coordinator.event;

/** Marks the start of a step. */
public record InitializeEvent(String origin, long time) implements BuildEvent {

    @Override
    public EventType eventType() { return EventType.INITIALIZE; }
}
