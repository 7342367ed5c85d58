package com.purchasingpower.itemgraph.upsert;

import com.purchasingpower.itemgraph.core.GraphEdge;
import com.purchasingpower.itemgraph.core.NodeSet;

import java.util.List;

/**
 * Writes a resolved node set and its edges to the graph store.
 *
 * <p>All node batches commit before any edge batch starts, so every edge finds
 * both endpoints. One batch per node kind, one per relationship kind, each its own
 * transaction. A failed batch stops the pass; batches committed before it remain.
 *
 * @since 1.0.0
 */
public interface GraphUpsertCoordinator {

    /**
     * @param nodes Every node to write, Category nodes included
     * @param edges Every resolved edge; for each relationship kind, outgoing edges of
     *              the listed sources that are not in this list are removed
     * @return Per-kind counts
     * @throws com.purchasingpower.itemgraph.exception.UpsertFailedException naming the
     *         stage and batch that failed
     */
    UpsertResult upsert(NodeSet nodes, List<GraphEdge> edges);
}
