package com.flowline.coordinator.event;

/** Marks the end of a step with its exit status. */
public record FinishEvent(String origin, long time, int exitStatus) implements BuildEvent {

    @Override
    public EventType eventType() { return EventType.FINISH; }
}
