package com.flowline.coordinator.api.dto;

import com.flowline.coordinator.model.Pipeline;
import com.flowline.coordinator.model.SaveConfigResult;

/** Response body for PUT /api/v1/teams/{team}/pipelines/{name}/config. */
public record SaveConfigResponse(Long pipelineId, String name, long version, boolean paused, boolean created) {

    public static SaveConfigResponse from(SaveConfigResult result) {
        Pipeline p = result.pipeline();
        return new SaveConfigResponse(p.getId(), p.getName(), p.getVersion(), p.isPaused(), result.created());
    }
}
