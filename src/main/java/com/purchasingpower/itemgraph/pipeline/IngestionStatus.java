package com.purchasingpower.itemgraph.pipeline;

import com.purchasingpower.itemgraph.report.RunStatus;
import lombok.Builder;
import lombok.Value;

/**
 * Snapshot of the pipeline: the active run if there is one, else the outcome of the last run.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class IngestionStatus {
    String runId;
    IngestionState state;
    String currentStep;
    long startedAt;
    boolean running;

    /** Status of the last finished run, {@code null} before the first one. */
    RunStatus lastRunStatus;
}
