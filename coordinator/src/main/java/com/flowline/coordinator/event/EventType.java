package com.flowline.coordinator.event;

import java.util.Arrays;
import java.util.Optional;

/**
 * Stored event types and the record class each decodes into.
 */
public enum EventType {
    LOG("log", "1.0", LogEvent.class),
    STATUS("status", "1.0", StatusEvent.class),
    ERROR("error", "1.0", ErrorEvent.class),
    INITIALIZE("initialize", "1.0", InitializeEvent.class),
    FINISH("finish", "1.0", FinishEvent.class);

    private final String typeName;
    private final String version;
    private final Class<? extends BuildEvent> eventClass;

    EventType(String typeName, String version, Class<? extends BuildEvent> eventClass) {
        this.typeName   = typeName;
        this.version    = version;
        this.eventClass = eventClass;
    }

    public String typeName()                       { return typeName; }
    public String version()                        { return version; }
    public Class<? extends BuildEvent> eventClass() { return eventClass; }

    public static Optional<EventType> fromTypeName(String typeName) {
        return Arrays.stream(values())
                .filter(t -> t.typeName.equals(typeName))
                .findFirst();
    }
}
