package com.purchasingpower.itemgraph.report;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * End-of-run document: counts per node and relationship kind, store totals,
 * and every diagnostic collected along the way.
 *
 * <p>Serialized to JSON by {@link ReportWriter} and returned by the REST API.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestionReport {

    private String runId;
    private RunStatus status;
    private String startedAt;
    private long durationMs;

    /** Set only when the run failed. */
    private IngestionStage failedStage;
    private String failedBatch;
    private String failureMessage;

    /** Records read per ingested kind, keyed by label. */
    @Builder.Default
    private Map<String, Integer> recordsRead = new LinkedHashMap<>();

    /** Node upserts per kind, keyed by label. */
    @Builder.Default
    private Map<String, KindCounts> nodes = new LinkedHashMap<>();

    /** Edge upserts per relationship type. */
    @Builder.Default
    private Map<String, KindCounts> edges = new LinkedHashMap<>();

    private int edgesRemoved;
    private int staleNodes;

    /** Store contents after the run, keyed by label / relationship type. */
    @Builder.Default
    private Map<String, Long> storeNodeTotals = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Long> storeEdgeTotals = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Integer> diagnosticCounts = new LinkedHashMap<>();

    @Builder.Default
    private List<Diagnostic> diagnostics = new ArrayList<>();
}
