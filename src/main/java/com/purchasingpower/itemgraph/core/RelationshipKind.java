package com.purchasingpower.itemgraph.core;

import java.util.List;

/**
 * Relationship types in the item graph, with the node kinds they can start from.
 *
 * @since 1.0.0
 */
public enum RelationshipKind {
    REQUIRES(List.of(NodeKind.RECIPE)),      // Recipe needs an ingredient, weighted by quantity
    BUILDS(List.of(NodeKind.RECIPE)),        // Recipe yields a weapon or resource, weighted by quantity
    BELONGS_TO(List.of(NodeKind.WEAPON, NodeKind.RESOURCE, NodeKind.RECIPE));   // Item is a member of a category

    private final List<NodeKind> sourceKinds;

    RelationshipKind(List<NodeKind> sourceKinds) {
        this.sourceKinds = sourceKinds;
    }

    public List<NodeKind> getSourceKinds() {
        return sourceKinds;
    }
}
