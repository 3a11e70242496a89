package com.flowline.coordinator.api.dto;

import com.flowline.coordinator.model.PipelineConfig;
import com.flowline.coordinator.model.SavedPipelineConfig;

/**
 * Response body for GET /api/v1/teams/{team}/pipelines/{name}/config.
 * The version is also sent as the X-Config-Version header.
 */
public record PipelineConfigResponse(PipelineConfig config, long version, boolean paused) {

    public static PipelineConfigResponse from(SavedPipelineConfig saved) {
        return new PipelineConfigResponse(saved.config(), saved.version(), saved.paused());
    }
}
