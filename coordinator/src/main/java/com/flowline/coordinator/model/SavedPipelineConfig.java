package com.flowline.coordinator.model;

/** A pipeline's config together with the version an editor must send back when saving. */
public record SavedPipelineConfig(PipelineConfig config, long version, boolean paused) {}
