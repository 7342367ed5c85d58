package com.purchasingpower.itemgraph.report;

/**
 * Pipeline stages a diagnostic or failure can be attributed to.
 *
 * @since 1.0.0
 */
public enum IngestionStage {
    NORMALIZE,
    RESOLVE,
    TAXONOMY,
    NODE_BATCH,
    EDGE_BATCH,
    RECONCILE
}
