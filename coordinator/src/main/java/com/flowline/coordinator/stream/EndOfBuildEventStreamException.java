package com.flowline.coordinator.stream;

/**
 * The build has finished and every event it will ever have has been delivered.
 */
public class EndOfBuildEventStreamException extends RuntimeException {

    private final long buildId;

    public EndOfBuildEventStreamException(long buildId) {
        super("End of event stream for build " + buildId);
        this.buildId = buildId;
    }

    public long getBuildId() { return buildId; }
}
