package com.flowline.coordinator.model;

import java.time.Instant;

/**
 * A versioned resource as stored in the ledger.
 *
 * checkOrder is assigned by the resource-version ledger that runs checks;
 * this core only carries it through.
 */
public record SavedVersionedResource(
        long              id,
        VersionedResource versionedResource,
        int               checkOrder,
        Instant           modifiedTime
) {}
