package com.flowline.coordinator.model;

/**
 * A versioned resource consumed by a build under an input name.
 *
 * firstOccurrence is only meaningful when read back: it is true when no
 * earlier build of the same job used this version under the same name.
 */
public record BuildInput(String name, VersionedResource versionedResource, boolean firstOccurrence) {

    public BuildInput(String name, VersionedResource versionedResource) {
        this(name, versionedResource, false);
    }
}
