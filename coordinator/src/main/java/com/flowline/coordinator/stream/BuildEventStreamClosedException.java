package com.flowline.coordinator.stream;

/**
 * The subscriber closed its cursor, either before or while calling next().
 * Not an error of the build: the viewer went away.
 */
public class BuildEventStreamClosedException extends RuntimeException {

    private final long buildId;

    public BuildEventStreamClosedException(long buildId) {
        super("Event stream for build " + buildId + " is closed");
        this.buildId = buildId;
    }

    public long getBuildId() { return buildId; }
}
