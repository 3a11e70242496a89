package com.flowline.coordinator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle status of a Build.
 *
 * Transitions:
 *   PENDING → STARTED → SUCCEEDED | FAILED | ERRORED | ABORTED
 *   PENDING → ABORTED | ERRORED
 *
 * Terminal states are absorbing: once a build reaches one of them no
 * further lifecycle transition is accepted.
 */
public enum BuildStatus {
    PENDING,
    STARTED,
    SUCCEEDED,
    FAILED,
    ERRORED,
    ABORTED;

    public boolean isTerminal() {
        return this != PENDING && this != STARTED;
    }

    /** Lower-case name used in events and API payloads ("succeeded"). */
    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static BuildStatus fromWireName(String value) {
        return BuildStatus.valueOf(value.toUpperCase(Locale.ROOT));
    }
}
