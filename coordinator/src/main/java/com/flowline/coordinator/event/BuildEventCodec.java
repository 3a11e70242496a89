package com.flowline.coordinator.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowline.coordinator.model.BuildEventRecord;
import org.springframework.stereotype.Component;

/**
 * Converts between {@link BuildEvent} records and the stored
 * (type, version, JSON payload) columns of build_events.
 */
@Component
public class BuildEventCodec {

    private final ObjectMapper json;

    public BuildEventCodec(ObjectMapper objectMapper) {
        this.json = objectMapper;
    }

    public BuildEventRecord encode(long buildId, int eventId, BuildEvent event) {
        EventType type = event.eventType();
        try {
            return new BuildEventRecord(buildId, eventId, type.typeName(), type.version(),
                    json.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            throw new BuildEventCodecException("Failed to encode " + type.typeName() + " event for build " + buildId, e);
        }
    }

    public StoredBuildEvent decode(BuildEventRecord record) {
        EventType type = EventType.fromTypeName(record.getType())
                .orElseThrow(() -> new BuildEventCodecException("Unknown type '" + record.getType()
                        + "' of event " + record.getEventId() + " of build " + record.getBuildId()));
        try {
            BuildEvent event = json.readValue(record.getPayload(), type.eventClass());
            return new StoredBuildEvent(record.getBuildId(), record.getEventId(), event);
        } catch (JsonProcessingException e) {
            throw new BuildEventCodecException("Failed to decode event " + record.getEventId()
                    + " of build " + record.getBuildId(), e);
        }
    }
}
