package com.flowline.coordinator.event;

import com.flowline.coordinator.model.BuildStatus;

/** Emitted on every lifecycle transition; time is in epoch seconds. */
public record StatusEvent(BuildStatus status, long time) implements BuildEvent {

    @Override
    public EventType eventType() { return EventType.STATUS; }
}
