package com.flowline.coordinator.service;

public class PipelineNotFoundException extends RuntimeException {

    public PipelineNotFoundException(long pipelineId) {
        super("Pipeline not found: " + pipelineId);
    }

    public PipelineNotFoundException(long teamId, String pipelineName) {
        super("Pipeline not found: '" + pipelineName + "' (team " + teamId + ")");
    }
}
