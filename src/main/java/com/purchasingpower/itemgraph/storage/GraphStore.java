package com.purchasingpower.itemgraph.storage;

import com.purchasingpower.itemgraph.core.GraphEdge;
import com.purchasingpower.itemgraph.core.NodeKind;
import com.purchasingpower.itemgraph.core.RelationshipKind;
import com.purchasingpower.itemgraph.util.ServiceType;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Interface for the backing graph store.
 *
 * <p>Writes happen in batches: each {@link #write} call is one transaction that
 * either commits completely or not at all. Reads serve stale-node detection,
 * run summaries and verification.
 *
 * @since 1.0.0
 */
public interface GraphStore {

    // =========================================================================
    // Lifecycle
    // =========================================================================

    /**
     * Fail fast when the store is unreachable.
     *
     * @throws com.purchasingpower.itemgraph.exception.GraphStoreException when it is
     */
    void verifyConnectivity();

    /**
     * Declare uniqueness of (label, key property) for every node kind. Idempotent.
     */
    void ensureConstraints();

    ServiceType getServiceType();

    // =========================================================================
    // Writes
    // =========================================================================

    /**
     * Run {@code work} in a single transaction and commit it.
     *
     * @param batchId Batch identity reported on failure, e.g. {@code nodes:Weapon}
     * @param work Writes to perform
     * @return Whatever {@code work} returns
     * @throws com.purchasingpower.itemgraph.exception.GraphStoreException when the batch
     *         could not be committed; nothing of it is kept
     */
    <T> T write(String batchId, Function<GraphWriter, T> work);

    /**
     * Delete every node of the item graph kinds and their relationships.
     */
    void clear();

    // =========================================================================
    // Reads
    // =========================================================================

    Set<String> listIdentifiers(NodeKind kind);

    Optional<Map<String, Object>> findNode(NodeKind kind, String identifier);

    List<GraphEdge> findEdges(RelationshipKind kind);

    /**
     * Node counts keyed by label.
     */
    Map<String, Long> countNodes();

    /**
     * Relationship counts keyed by type.
     */
    Map<String, Long> countEdges();
}
