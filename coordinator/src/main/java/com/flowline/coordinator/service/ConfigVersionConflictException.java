package com.flowline.coordinator.service;

/**
 * A pipeline config save targeted a version that is no longer current.
 *
 * Nothing was written. The editor should re-read the config (and its new
 * version), re-apply its change and save again.
 */
public class ConfigVersionConflictException extends RuntimeException {

    private final long expectedVersion;
    private final long actualVersion;

    public ConfigVersionConflictException(long teamId, String pipelineName, long expectedVersion, long actualVersion) {
        super("Config for pipeline '" + pipelineName + "' (team " + teamId + ") is at version "
                + actualVersion + ", not " + expectedVersion);
        this.expectedVersion = expectedVersion;
        this.actualVersion   = actualVersion;
    }

    public long getExpectedVersion() { return expectedVersion; }
    public long getActualVersion()   { return actualVersion; }
}
