package com.flowline.coordinator.service;

public class JobNotFoundException extends RuntimeException {

    public JobNotFoundException(long pipelineId, String jobName) {
        super("Job not found: '" + jobName + "' (pipeline " + pipelineId + ")");
    }
}
