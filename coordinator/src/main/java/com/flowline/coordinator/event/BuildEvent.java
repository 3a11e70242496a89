package com.flowline.coordinator.event;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Payload of one entry in a build's event log.
 *
 * Implementations are immutable records; {@link BuildEventCodec} maps them
 * to and from the (type, version, JSON) triple stored in build_events.
 */
public interface BuildEvent {

    @JsonIgnore
    EventType eventType();
}
