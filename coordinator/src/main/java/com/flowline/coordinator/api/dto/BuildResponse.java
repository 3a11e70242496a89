package com.flowline.coordinator.api.dto;

import com.flowline.coordinator.model.Build;
import com.flowline.coordinator.model.BuildStatus;

import java.time.Instant;

/**
 * Response body for POST /api/v1/teams/{team}/builds and GET /api/v1/builds/{id}.
 * pipelineId and jobId are null for one-off builds.
 */
public record BuildResponse(
        Long        id,
        String      name,
        BuildStatus status,
        Long        teamId,
        Long        pipelineId,
        Long        jobId,
        Instant     startTime,
        Instant     endTime,
        boolean     completed,
        Instant     createdAt
) {
    public static BuildResponse from(Build build) {
        return new BuildResponse(
                build.getId(),
                build.getName(),
                build.getStatus(),
                build.getTeamId(),
                build.getPipelineId(),
                build.getJobId(),
                build.getStartTime(),
                build.getEndTime(),
                build.isCompleted(),
                build.getCreatedAt()
        );
    }
}
