package com.flowline.coordinator.event;

/** A decoded event together with its position in the build's log. */
public record StoredBuildEvent(long buildId, int eventId, BuildEvent event) {}
