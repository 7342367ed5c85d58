package com.purchasingpower.itemgraph.storage;

/**
 * Whether an upsert created a new node/edge or overwrote an existing one.
 */
public enum UpsertOutcome {
    CREATED,
    UPDATED
}
