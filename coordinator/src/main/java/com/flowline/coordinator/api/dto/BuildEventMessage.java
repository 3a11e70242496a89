package com.flowline.coordinator.api.dto;

import com.flowline.coordinator.event.BuildEvent;
import com.flowline.coordinator.event.StoredBuildEvent;

/**
 * Data of one server-sent event on GET /api/v1/builds/{id}/events.
 * The SSE id field carries the event id, so clients resume with Last-Event-ID.
 */
public record BuildEventMessage(String event, String version, BuildEvent data) {

    public static BuildEventMessage from(StoredBuildEvent stored) {
        return new BuildEventMessage(
                stored.event().eventType().typeName(),
                stored.event().eventType().version(),
                stored.event());
    }
}
