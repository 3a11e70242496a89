package com.flowline.coordinator.service;

import com.flowline.coordinator.model.BuildStatus;

/**
 * A lifecycle transition was requested from a status that does not allow it,
 * e.g. finishing a build that never started or aborting one that already ended.
 */
public class BuildTransitionException extends RuntimeException {

    private final long        buildId;
    private final BuildStatus currentStatus;
    private final BuildStatus targetStatus;

    public BuildTransitionException(long buildId, BuildStatus currentStatus, BuildStatus targetStatus) {
        super(currentStatus.isTerminal()
                ? "Build " + buildId + " already ended as " + currentStatus + ", cannot move to " + targetStatus
                : "Build " + buildId + " cannot move from " + currentStatus + " to " + targetStatus);
        this.buildId       = buildId;
        this.currentStatus = currentStatus;
        this.targetStatus  = targetStatus;
    }

    public long        getBuildId()       { return buildId; }
    public BuildStatus getCurrentStatus() { return currentStatus; }
    public BuildStatus getTargetStatus()  { return targetStatus; }
}
