package com.purchasingpower.itemgraph.upsert.impl;

import com.purchasingpower.itemgraph.configuration.ItemGraphProperties;
import com.purchasingpower.itemgraph.configuration.UpsertProperties;
import com.purchasingpower.itemgraph.core.GraphEdge;
import com.purchasingpower.itemgraph.core.NodeKind;
import com.purchasingpower.itemgraph.core.NodeSet;
import com.purchasingpower.itemgraph.core.NormalizedNode;
import com.purchasingpower.itemgraph.core.RelationshipKind;
import com.purchasingpower.itemgraph.exception.GraphStoreException;
import com.purchasingpower.itemgraph.exception.UpsertFailedException;
import com.purchasingpower.itemgraph.report.IngestionStage;
import com.purchasingpower.itemgraph.report.KindCounts;
import com.purchasingpower.itemgraph.storage.GraphStore;
import com.purchasingpower.itemgraph.storage.GraphWriter;
import com.purchasingpower.itemgraph.storage.UpsertOutcome;
import com.purchasingpower.itemgraph.upsert.GraphUpsertCoordinator;
import com.purchasingpower.itemgraph.upsert.UpsertResult;
import com.purchasingpower.itemgraph.util.CallContext;
import com.purchasingpower.itemgraph.util.ExternalCallLogger;
import com.purchasingpower.itemgraph.util.ServiceType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Writes nodes then edges, one transaction per kind.
 *
 * <p>Node batches run sequentially in kind order. Edge batches only need their
 * endpoints, so with {@code itemgraph.upsert.parallel-edge-batches} they run
 * concurrently on the ingestion executor; otherwise they run in kind order and the
 * first failure stops the rest. Each edge batch also prunes the
 * outgoing edges its sources no longer declare, inside the same transaction.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class DefaultGraphUpsertCoordinator implements GraphUpsertCoordinator {

    private static final int MAX_ERROR_LENGTH = 500;

    private final GraphStore graphStore;
    private final ItemGraphProperties properties;
    private final Executor executor;

    public DefaultGraphUpsertCoordinator(GraphStore graphStore,
                                         ItemGraphProperties properties,
                                         @Qualifier("ingestionExecutor") Executor executor) {
        this.graphStore = graphStore;
        this.properties = properties;
        this.executor = executor;
    }

    @Override
    public UpsertResult upsert(NodeSet nodes, List<GraphEdge> edges) {
        UpsertResult result = new UpsertResult();

        ensureConstraints();

        for (NodeKind kind : NodeKind.values()) {
            result.getNodes().put(kind.getLabel(), writeNodes(kind, nodes.get(kind)));
        }

        Map<RelationshipKind, List<GraphEdge>> edgesByKind = new EnumMap<>(RelationshipKind.class);
        for (RelationshipKind kind : RelationshipKind.values()) {
            edgesByKind.put(kind, new ArrayList<>());
        }
        for (GraphEdge edge : edges) {
            edgesByKind.get(edge.getKind()).add(edge);
        }

        List<EdgeBatch> batches = new ArrayList<>();
        for (RelationshipKind kind : RelationshipKind.values()) {
            batches.add(new EdgeBatch(kind, edgesByKind.get(kind), nodes));
        }

        boolean parallel = properties.getUpsert().isParallelEdgeBatches();
        if (parallel && graphStore.getServiceType() == ServiceType.NEO4J && properties.getUpsert().getMaxAttempts() < 2) {
            log.warn("⚠️ Parallel edge batches on Neo4j without retries: a deadlock abort will fail the run");
        }
        List<EdgeBatchOutcome> outcomes = parallel
                ? runConcurrently(batches)
                : batches.stream().map(this::writeEdges).toList();

        for (EdgeBatchOutcome outcome : outcomes) {
            result.getEdges().put(outcome.kind().name(), outcome.counts());
            result.setEdgesRemoved(result.getEdgesRemoved() + outcome.removed());
        }

        log.info("✅ Upsert complete: {} nodes, {} edges written, {} stale edges removed",
                result.getNodesWritten(), result.getEdgesWritten(), result.getEdgesRemoved());
        return result;
    }

    private void ensureConstraints() {
        try {
            graphStore.ensureConstraints();
        } catch (GraphStoreException e) {
            throw new UpsertFailedException(IngestionStage.NODE_BATCH, e.getBatchId(),
                    "Could not declare uniqueness constraints: " + ExternalCallLogger.truncate(e.getMessage(), MAX_ERROR_LENGTH), e);
        }
    }

    // =========================================================================
    // Node batches
    // =========================================================================

    private KindCounts writeNodes(NodeKind kind, List<NormalizedNode> nodes) {
        if (nodes.isEmpty()) {
            return new KindCounts();
        }
        String batchId = "nodes:" + kind.getLabel();
        return commit(IngestionStage.NODE_BATCH, batchId, nodes.size() + " " + kind.getLabel() + " nodes", writer -> {
            KindCounts counts = new KindCounts();
            for (NormalizedNode node : nodes) {
                count(counts, writer.upsertNode(kind, node.getIdentifier(), node.getProperties()));
            }
            return counts;
        });
    }

    // =========================================================================
    // Edge batches
    // =========================================================================

    private record EdgeBatch(RelationshipKind kind, List<GraphEdge> edges, NodeSet nodes) {
    }

    private record EdgeBatchOutcome(RelationshipKind kind, KindCounts counts, int removed) {
    }

    private List<EdgeBatchOutcome> runConcurrently(List<EdgeBatch> batches) {
        List<CompletableFuture<EdgeBatchOutcome>> futures = batches.stream()
                .map(batch -> CompletableFuture.supplyAsync(() -> writeEdges(batch), executor))
                .toList();

        // wait for every batch so the first failure in kind order is the one reported
        List<EdgeBatchOutcome> outcomes = new ArrayList<>();
        UpsertFailedException failure = null;
        for (CompletableFuture<EdgeBatchOutcome> future : futures) {
            try {
                outcomes.add(future.join());
            } catch (CompletionException e) {
                if (failure == null) {
                    failure = unwrap(e);
                } else {
                    log.warn("Additional edge batch failure: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
        return outcomes;
    }

    private static UpsertFailedException unwrap(CompletionException e) {
        if (e.getCause() instanceof UpsertFailedException upsertFailure) {
            return upsertFailure;
        }
        return new UpsertFailedException(IngestionStage.EDGE_BATCH, "edges", "Edge batch failed: " + e.getMessage(), e);
    }

    private EdgeBatchOutcome writeEdges(EdgeBatch batch) {
        RelationshipKind kind = batch.kind();
        Map<NodeKind, List<String>> sourceIds = new EnumMap<>(NodeKind.class);
        for (NodeKind sourceKind : kind.getSourceKinds()) {
            sourceIds.put(sourceKind, batch.nodes().get(sourceKind).stream()
                    .map(NormalizedNode::getIdentifier)
                    .collect(Collectors.toList()));
        }
        boolean hasSources = sourceIds.values().stream().anyMatch(ids -> !ids.isEmpty());
        if (batch.edges().isEmpty() && !hasSources) {
            return new EdgeBatchOutcome(kind, new KindCounts(), 0);
        }

        String batchId = "edges:" + kind.name();
        return commit(IngestionStage.EDGE_BATCH, batchId, batch.edges().size() + " " + kind + " edges", writer -> {
            KindCounts counts = new KindCounts();
            for (GraphEdge edge : batch.edges()) {
                count(counts, writer.upsertEdge(edge));
            }
            int removed = 0;
            for (Map.Entry<NodeKind, List<String>> entry : sourceIds.entrySet()) {
                if (entry.getValue().isEmpty()) {
                    continue;
                }
                List<GraphEdge> keep = batch.edges().stream()
                        .filter(edge -> edge.getSourceKind() == entry.getKey())
                        .toList();
                removed += writer.pruneEdges(kind, entry.getKey(), entry.getValue(), keep);
            }
            return new EdgeBatchOutcome(kind, counts, removed);
        });
    }

    // =========================================================================
    // Commit with retry
    // =========================================================================

    private <T> T commit(IngestionStage stage, String batchId, String summary, Function<GraphWriter, T> work) {
        UpsertProperties upsert = properties.getUpsert();
        int maxAttempts = Math.max(1, upsert.getMaxAttempts());

        for (int attempt = 1; ; attempt++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new UpsertFailedException(stage, batchId,
                        "Interrupted before batch " + batchId + "; unknown partial state", null);
            }

            CallContext ctx = ExternalCallLogger.startCall(graphStore.getServiceType(), batchId, log);
            ctx.logRequest(summary, "Attempt", attempt + "/" + maxAttempts);
            try {
                T result = graphStore.write(batchId, work);
                ctx.logResponse("Committed " + summary);
                return result;
            } catch (GraphStoreException e) {
                ctx.logError(e.getMessage(), e);
                if (attempt >= maxAttempts) {
                    throw new UpsertFailedException(stage, batchId,
                            "Batch " + batchId + " failed after " + attempt + " attempt(s): "
                                    + ExternalCallLogger.truncate(e.getMessage(), MAX_ERROR_LENGTH), e);
                }
                long delay = upsert.getBackoffMs() * (1L << (attempt - 1));
                log.warn("⚠️ Batch {} failed (attempt {}/{}), retrying in {}ms", batchId, attempt, maxAttempts, delay);
                sleep(stage, batchId, delay);
            }
        }
    }

    private static void sleep(IngestionStage stage, String batchId, long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpsertFailedException(stage, batchId, "Interrupted while waiting to retry " + batchId, e);
        }
    }

    private static void count(KindCounts counts, UpsertOutcome outcome) {
        if (outcome == UpsertOutcome.CREATED) {
            counts.setCreated(counts.getCreated() + 1);
        } else {
            counts.setUpdated(counts.getUpdated() + 1);
        }
    }
}
