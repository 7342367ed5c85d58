package com.purchasingpower.itemgraph.report;

/**
 * Overall outcome of an ingestion run.
 *
 * @since 1.0.0
 */
public enum RunStatus {
    SUCCEEDED,
    SUCCEEDED_WITH_WARNINGS,
    FAILED,
    CANCELLED;

    public boolean isSuccess() {
        return this == SUCCEEDED || this == SUCCEEDED_WITH_WARNINGS;
    }
}
