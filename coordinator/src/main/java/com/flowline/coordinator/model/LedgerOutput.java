package com.flowline.coordinator.model;

/** Ledger view of an output link, including implicit outputs. */
public record LedgerOutput(SavedVersionedResource savedVersionedResource, boolean explicit) {}
