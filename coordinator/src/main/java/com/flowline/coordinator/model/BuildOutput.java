package com.flowline.coordinator.model;

/** A versioned resource a build produced as a declared (explicit) output. */
public record BuildOutput(VersionedResource versionedResource) {}
