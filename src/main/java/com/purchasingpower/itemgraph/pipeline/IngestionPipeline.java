package com.purchasingpower.itemgraph.pipeline;

import com.purchasingpower.itemgraph.report.IngestionReport;
import com.purchasingpower.itemgraph.source.RecordSource;

import java.util.Optional;

/**
 * One ingestion run: read, normalize, resolve, derive taxonomy, reconcile, upsert, report.
 *
 * <p>At most one run is active per process. A run always ends with a report, whatever
 * its status; exceptions only escape for a run that could not start.
 *
 * @since 1.0.0
 */
public interface IngestionPipeline {

    /**
     * Run against the configured export files.
     *
     * @throws com.purchasingpower.itemgraph.exception.IngestionInProgressException if a run is active
     */
    IngestionReport run();

    /**
     * Run against the given source.
     *
     * @throws com.purchasingpower.itemgraph.exception.IngestionInProgressException if a run is active
     */
    IngestionReport run(RecordSource source);

    IngestionStatus getStatus();

    Optional<IngestionReport> getLastReport();
}
