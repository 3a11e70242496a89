package com.flowline.coordinator.model;

/** One name/value pair of resource metadata; order within a list is preserved. */
public record MetadataField(String name, String value) {}
