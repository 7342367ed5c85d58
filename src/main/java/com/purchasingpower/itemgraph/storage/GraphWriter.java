package com.purchasingpower.itemgraph.storage;

import com.purchasingpower.itemgraph.core.GraphEdge;
import com.purchasingpower.itemgraph.core.NodeKind;
import com.purchasingpower.itemgraph.core.RelationshipKind;

import java.util.Collection;
import java.util.Map;

/**
 * Write operations available inside one store transaction.
 *
 * <p>Only valid for the duration of {@link GraphStore#write}.
 *
 * @since 1.0.0
 */
public interface GraphWriter {

    /**
     * Create or fully replace a node keyed by (kind, identifier).
     *
     * @param kind Node kind
     * @param identifier Value of the kind's key property
     * @param properties Complete property set; properties not listed are removed
     * @return Whether the node was created or updated
     */
    UpsertOutcome upsertNode(NodeKind kind, String identifier, Map<String, Object> properties);

    /**
     * Create or overwrite an edge keyed by (source, kind, target). Both endpoints must exist.
     *
     * @param edge Edge to write
     * @return Whether the edge was created or updated
     */
    UpsertOutcome upsertEdge(GraphEdge edge);

    /**
     * Delete the outgoing {@code kind} edges of the given sources that are not in {@code keep}.
     *
     * @param kind Relationship kind
     * @param sourceKind Kind of the source nodes
     * @param sourceIds Sources whose edges were re-derived in this run
     * @param keep Edges that must survive
     * @return Number of edges deleted
     */
    int pruneEdges(RelationshipKind kind, NodeKind sourceKind, Collection<String> sourceIds, Collection<GraphEdge> keep);
}
