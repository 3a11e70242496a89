package com.flowline.coordinator.model;

import java.util.List;
import java.util.Map;

/**
 * A specific version of a pipeline resource.
 *
 * {@code version} is compared as an unordered map; {@code metadata} keeps
 * the order the resource reported it in.
 */
public record VersionedResource(
        String              resource,
        String              type,
        Map<String, String> version,
        List<MetadataField> metadata,
        Long                pipelineId
) {
    public VersionedResource {
        version  = version  == null ? Map.of()  : Map.copyOf(version);
        metadata = metadata == null ? List.of() : List.copyOf(metadata);
    }
}
