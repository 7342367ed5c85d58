package com.purchasingpower.itemgraph.pipeline.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.itemgraph.configuration.ItemGraphProperties;
import com.purchasingpower.itemgraph.core.GraphEdge;
import com.purchasingpower.itemgraph.core.NodeKind;
import com.purchasingpower.itemgraph.core.NodeSet;
import com.purchasingpower.itemgraph.core.NormalizedNode;
import com.purchasingpower.itemgraph.core.RawRecord;
import com.purchasingpower.itemgraph.exception.GraphStoreException;
import com.purchasingpower.itemgraph.exception.IngestionInProgressException;
import com.purchasingpower.itemgraph.exception.RecordSourceException;
import com.purchasingpower.itemgraph.exception.UpsertFailedException;
import com.purchasingpower.itemgraph.normalize.NormalizationResult;
import com.purchasingpower.itemgraph.normalize.RecordNormalizer;
import com.purchasingpower.itemgraph.pipeline.IngestionPipeline;
import com.purchasingpower.itemgraph.pipeline.IngestionState;
import com.purchasingpower.itemgraph.pipeline.IngestionStatus;
import com.purchasingpower.itemgraph.report.Diagnostic;
import com.purchasingpower.itemgraph.report.DiagnosticKind;
import com.purchasingpower.itemgraph.report.IngestionReport;
import com.purchasingpower.itemgraph.report.IngestionStage;
import com.purchasingpower.itemgraph.report.IntegrityReporter;
import com.purchasingpower.itemgraph.report.ReportWriter;
import com.purchasingpower.itemgraph.report.RunStatus;
import com.purchasingpower.itemgraph.resolve.ReferenceResolver;
import com.purchasingpower.itemgraph.resolve.ResolutionResult;
import com.purchasingpower.itemgraph.source.RecordSource;
import com.purchasingpower.itemgraph.storage.GraphStore;
import com.purchasingpower.itemgraph.taxonomy.TaxonomyBuilder;
import com.purchasingpower.itemgraph.taxonomy.TaxonomyResult;
import com.purchasingpower.itemgraph.upsert.GraphUpsertCoordinator;
import com.purchasingpower.itemgraph.upsert.UpsertResult;
import com.purchasingpower.itemgraph.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Default ingestion pipeline.
 *
 * <p>Stages up to reconciliation only read the store, so a run cancelled before
 * the upsert leaves the graph untouched. Once the first batch is written a cancel
 * or store failure ends the run FAILED with whatever batches had committed.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class ItemGraphIngestionPipeline implements IngestionPipeline {

    private static final int MAX_ERROR_LENGTH = 500;

    private final RecordSource defaultSource;
    private final RecordNormalizer normalizer;
    private final ReferenceResolver resolver;
    private final TaxonomyBuilder taxonomyBuilder;
    private final GraphUpsertCoordinator upsertCoordinator;
    private final GraphStore graphStore;
    private final ReportWriter reportWriter;
    private final ItemGraphProperties properties;
    private final Executor executor;

    private final AtomicReference<String> activeRun = new AtomicReference<>();
    private volatile IngestionState state = IngestionState.IDLE;
    private volatile String currentStep = "Waiting for first run";
    private volatile long startedAt;
    private volatile IngestionReport lastReport;

    public ItemGraphIngestionPipeline(RecordSource defaultSource,
                                      RecordNormalizer normalizer,
                                      ReferenceResolver resolver,
                                      TaxonomyBuilder taxonomyBuilder,
                                      GraphUpsertCoordinator upsertCoordinator,
                                      GraphStore graphStore,
                                      ReportWriter reportWriter,
                                      ItemGraphProperties properties,
                                      @Qualifier("ingestionExecutor") Executor executor) {
        this.defaultSource = defaultSource;
        this.normalizer = normalizer;
        this.resolver = resolver;
        this.taxonomyBuilder = taxonomyBuilder;
        this.upsertCoordinator = upsertCoordinator;
        this.graphStore = graphStore;
        this.reportWriter = reportWriter;
        this.properties = properties;
        this.executor = executor;
    }

    @Override
    public IngestionReport run() {
        return run(defaultSource);
    }

    @Override
    public IngestionReport run(RecordSource source) {
        Preconditions.checkNotNull(source, "source must not be null");

        String runId = UUID.randomUUID().toString().substring(0, 8);
        if (!activeRun.compareAndSet(null, runId)) {
            throw new IngestionInProgressException(activeRun.get());
        }

        try {
            startedAt = System.currentTimeMillis();
            IngestionReport report = execute(runId, source);
            lastReport = report;
            reportWriter.write(report);
            return report;
        } finally {
            activeRun.set(null);
        }
    }

    @Override
    public IngestionStatus getStatus() {
        IngestionReport last = lastReport;
        String runId = activeRun.get();
        return IngestionStatus.builder()
                .runId(runId != null ? runId : last != null ? last.getRunId() : null)
                .state(state)
                .currentStep(currentStep)
                .startedAt(startedAt)
                .running(runId != null)
                .lastRunStatus(last != null ? last.getStatus() : null)
                .build();
    }

    @Override
    public Optional<IngestionReport> getLastReport() {
        return Optional.ofNullable(lastReport);
    }

    // =========================================================================
    // Run
    // =========================================================================

    private IngestionReport execute(String runId, RecordSource source) {
        Instant start = Instant.now();
        IntegrityReporter reporter = new IntegrityReporter(runId);
        IngestionReport report = IngestionReport.builder()
                .runId(runId)
                .startedAt(start.toString())
                .build();

        log.info("🚀 Ingestion run {} started from {} into {}", runId, source.describe(), graphStore.getServiceType().getName());

        IngestionStage stage = IngestionStage.NORMALIZE;
        boolean writesBegan = false;
        boolean committed = false;
        boolean cancelled = false;

        try {
            // Step 1: read
            step(IngestionState.READING, "Reading " + source.describe());
            Map<NodeKind, List<RawRecord>> raw = source.read();
            checkCancelled();

            // Step 2: normalize every kind, then join
            step(IngestionState.NORMALIZING, "Normalizing records");
            Map<NodeKind, NormalizationResult> normalized = normalize(raw);
            Map<NodeKind, List<NormalizedNode>> nodesByKind = new EnumMap<>(NodeKind.class);
            for (NodeKind kind : NodeKind.values()) {
                NormalizationResult result = normalized.get(kind);
                if (result == null) {
                    continue;
                }
                report.getRecordsRead().put(kind.getLabel(), result.getRecordsRead());
                nodesByKind.put(kind, result.getNodes());
                reporter.recordAll(result.getDiagnostics());
            }
            NodeSet ingested = NodeSet.of(nodesByKind);
            checkCancelled();

            // Step 3: resolve references and derive the taxonomy
            stage = IngestionStage.RESOLVE;
            step(IngestionState.RESOLVING, "Resolving references across " + ingested.size() + " nodes");
            ResolutionResult resolution = resolver.resolve(ingested);
            reporter.recordAll(resolution.getDiagnostics());

            stage = IngestionStage.TAXONOMY;
            // reuse stored Category spellings so re-runs never fork a category
            Set<String> knownCategories = properties.getStore().isClearBeforeRun()
                    ? Set.of()
                    : graphStore.listIdentifiers(NodeKind.CATEGORY);
            TaxonomyResult taxonomy = taxonomyBuilder.build(ingested, knownCategories);
            reporter.recordAll(taxonomy.getDiagnostics());

            NodeSet nodes = ingested.with(NodeKind.CATEGORY, taxonomy.getCategories());
            List<GraphEdge> edges = new ArrayList<>(resolution.getEdges());
            edges.addAll(taxonomy.getMemberships());
            checkCancelled();

            // Step 4: flag nodes the export no longer contains
            stage = IngestionStage.RECONCILE;
            if (!properties.getStore().isClearBeforeRun()) {
                step(IngestionState.RECONCILING, "Checking for stale nodes");
                report.setStaleNodes(reportStaleNodes(nodes, reporter));
            }
            checkCancelled();

            // Step 5: write
            stage = IngestionStage.NODE_BATCH;
            step(IngestionState.WRITING, "Writing " + nodes.size() + " nodes and " + edges.size() + " edges");
            writesBegan = true;
            if (properties.getStore().isClearBeforeRun()) {
                log.info("🗑️ Clearing item graph before run {}", runId);
                graphStore.clear();
            }
            UpsertResult upsert = upsertCoordinator.upsert(nodes, edges);
            committed = true;

            report.setNodes(upsert.getNodes());
            report.setEdges(upsert.getEdges());
            report.setEdgesRemoved(upsert.getEdgesRemoved());

        } catch (RunCancelledException e) {
            cancelled = true;
            report.setFailedStage(stage);
            report.setFailureMessage("Cancelled before any store write");
            log.warn("⚠️ Ingestion run {} cancelled during {}", runId, stage);

        } catch (UpsertFailedException e) {
            report.setFailedStage(e.getStage());
            report.setFailedBatch(e.getBatchId());
            report.setFailureMessage(e.getMessage());
            reporter.record(Diagnostic.of(e.getStage(), e.getBatchId(), DiagnosticKind.STORE_COMMIT_FAILURE, e.getMessage()));
            log.error("❌ Ingestion run {} failed in batch {}: {}", runId, e.getBatchId(), e.getMessage());

        } catch (RecordSourceException e) {
            report.setFailedStage(stage);
            report.setFailedBatch(e.getLocation());
            report.setFailureMessage(e.getMessage());
            log.error("❌ Ingestion run {} could not read its input: {}", runId, e.getMessage());

        } catch (GraphStoreException e) {
            report.setFailedStage(stage);
            report.setFailedBatch(e.getBatchId());
            report.setFailureMessage(partialStateMessage(writesBegan, e.getMessage()));
            if (writesBegan) {
                reporter.record(Diagnostic.of(stage, e.getBatchId(), DiagnosticKind.STORE_COMMIT_FAILURE, e.getMessage()));
            }
            log.error("❌ Ingestion run {} failed at {}: {}", runId, stage, e.getMessage(), e);

        } catch (RuntimeException e) {
            report.setFailedStage(stage);
            report.setFailureMessage(partialStateMessage(writesBegan, e.getMessage()));
            log.error("❌ Ingestion run {} failed unexpectedly at {}", runId, stage, e);
        }

        RunStatus status = reporter.resolveStatus(committed, cancelled);
        report.setStatus(status);
        if (status != RunStatus.CANCELLED || writesBegan) {
            fillStoreTotals(report);
        }
        report.setDiagnostics(new ArrayList<>(reporter.getDiagnostics()));
        report.setDiagnosticCounts(reporter.countsByKind());
        report.setDurationMs(System.currentTimeMillis() - start.toEpochMilli());

        switch (status) {
            case SUCCEEDED, SUCCEEDED_WITH_WARNINGS -> step(IngestionState.COMPLETED, "Run " + runId + " " + status);
            case CANCELLED -> step(IngestionState.CANCELLED, "Run " + runId + " cancelled");
            default -> step(IngestionState.FAILED, "Run " + runId + " failed at " + report.getFailedStage());
        }

        log.info("🏁 Ingestion run {} finished: {} in {}ms ({} diagnostics)",
                runId, status, report.getDurationMs(), report.getDiagnostics().size());
        return report;
    }

    private Map<NodeKind, NormalizationResult> normalize(Map<NodeKind, List<RawRecord>> raw) {
        Map<NodeKind, NormalizationResult> results = new EnumMap<>(NodeKind.class);

        if (!properties.getNormalizer().isParallel()) {
            for (NodeKind kind : NodeKind.values()) {
                if (kind.isIngested()) {
                    results.put(kind, normalizer.normalizeAll(kind, raw.getOrDefault(kind, List.of())));
                }
            }
            return results;
        }

        Map<NodeKind, CompletableFuture<NormalizationResult>> futures = new EnumMap<>(NodeKind.class);
        for (NodeKind kind : NodeKind.values()) {
            if (kind.isIngested()) {
                List<RawRecord> records = raw.getOrDefault(kind, List.of());
                futures.put(kind, CompletableFuture.supplyAsync(() -> normalizer.normalizeAll(kind, records), executor));
            }
        }

        for (Map.Entry<NodeKind, CompletableFuture<NormalizationResult>> entry : futures.entrySet()) {
            try {
                results.put(entry.getKey(), entry.getValue().get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.values().forEach(f -> f.cancel(true));
                throw new RunCancelledException();
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                throw cause instanceof RuntimeException runtime
                        ? runtime
                        : new IllegalStateException("Normalization of " + entry.getKey() + " failed", cause);
            }
        }
        return results;
    }

    private int reportStaleNodes(NodeSet nodes, IntegrityReporter reporter) {
        int stale = 0;
        for (NodeKind kind : NodeKind.values()) {
            Set<String> current = new HashSet<>();
            for (NormalizedNode node : nodes.get(kind)) {
                current.add(node.getIdentifier());
            }
            for (String identifier : graphStore.listIdentifiers(kind)) {
                if (!current.contains(identifier)) {
                    reporter.record(Diagnostic.of(IngestionStage.RECONCILE, identifier, DiagnosticKind.STALE_NODE,
                            kind.getLabel() + " is in the graph but no longer in the export; left in place"));
                    stale++;
                }
            }
        }
        if (stale > 0) {
            log.warn("⚠️ {} stale nodes found in the graph", stale);
        }
        return stale;
    }

    private void fillStoreTotals(IngestionReport report) {
        try {
            report.setStoreNodeTotals(graphStore.countNodes());
            report.setStoreEdgeTotals(graphStore.countEdges());
        } catch (GraphStoreException e) {
            log.warn("⚠️ Could not read store totals for run {}: {}", report.getRunId(), e.getMessage());
        }
    }

    private static String partialStateMessage(boolean writesBegan, String message) {
        String detail = ExternalCallLogger.truncate(message, MAX_ERROR_LENGTH);
        return writesBegan ? detail + " (unknown partial state)" : detail;
    }

    private void checkCancelled() {
        if (Thread.currentThread().isInterrupted()) {
            throw new RunCancelledException();
        }
    }

    private void step(IngestionState newState, String description) {
        state = newState;
        currentStep = description;
        log.info("📍 [{}] {}", newState, description);
    }

    /**
     * Interrupt observed before any store write.
     */
    private static final class RunCancelledException extends RuntimeException {
        RunCancelledException() {
            super("Ingestion run cancelled", null, false, false);
        }
    }
}
