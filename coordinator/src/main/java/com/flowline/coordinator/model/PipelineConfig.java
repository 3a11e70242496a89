package com.flowline.coordinator.model;

import java.util.List;
import java.util.Map;

/**
 * Pipeline configuration document as supplied by the config editor.
 * Stored as JSON in pipelines.config.
 */
public record PipelineConfig(List<JobConfig> jobs, List<ResourceConfig> resources) {

    public PipelineConfig {
        jobs      = jobs      == null ? List.of() : List.copyOf(jobs);
        resources = resources == null ? List.of() : List.copyOf(resources);
    }

    public record JobConfig(String name, boolean serial, List<Map<String, Object>> plan) {
        public JobConfig {
            plan = plan == null ? List.of() : List.copyOf(plan);
        }

        public JobConfig(String name) {
            this(name, false, List.of());
        }
    }

    public record ResourceConfig(String name, String type, Map<String, Object> source) {
        public ResourceConfig {
            source = source == null ? Map.of() : Map.copyOf(source);
        }

        public ResourceConfig(String name, String type) {
            this(name, type, Map.of());
        }
    }

    public List<String> jobNames() {
        return jobs.stream().map(JobConfig::name).toList();
    }
}
