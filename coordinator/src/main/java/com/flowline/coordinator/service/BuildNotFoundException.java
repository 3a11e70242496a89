package com.flowline.coordinator.service;

public class BuildNotFoundException extends RuntimeException {

    private final long buildId;

    public BuildNotFoundException(long buildId) {
        super("Build not found: " + buildId);
        this.buildId = buildId;
    }

    public long getBuildId() { return buildId; }
}
