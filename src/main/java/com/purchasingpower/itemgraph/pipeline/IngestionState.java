package com.purchasingpower.itemgraph.pipeline;

/**
 * Pipeline states.
 *
 * @since 1.0.0
 */
public enum IngestionState {
    IDLE,
    READING,
    NORMALIZING,
    RESOLVING,
    RECONCILING,
    WRITING,
    COMPLETED,
    FAILED,
    CANCELLED
}
