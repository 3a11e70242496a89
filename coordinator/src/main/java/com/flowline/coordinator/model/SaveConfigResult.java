package com.flowline.coordinator.model;

/** Outcome of a successful config save: the stored pipeline and whether it was newly created. */
public record SaveConfigResult(Pipeline pipeline, boolean created) {}
