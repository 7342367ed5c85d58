package com.purchasingpower.itemgraph.resolve;

import com.purchasingpower.itemgraph.core.NodeKind;
import com.purchasingpower.itemgraph.core.NodeSet;
import com.purchasingpower.itemgraph.core.NormalizedNode;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Identifier lookup across node kinds, built before any edge is emitted.
 *
 * @since 1.0.0
 */
public final class IdentifierIndex {

    private final Map<NodeKind, Set<String>> identifiers = new EnumMap<>(NodeKind.class);

    private IdentifierIndex() {
    }

    public static IdentifierIndex of(NodeSet nodeSet) {
        IdentifierIndex index = new IdentifierIndex();
        for (NodeKind kind : NodeKind.values()) {
            Set<String> ids = new HashSet<>();
            for (NormalizedNode node : nodeSet.get(kind)) {
                ids.add(node.getIdentifier());
            }
            index.identifiers.put(kind, ids);
        }
        return index;
    }

    public boolean contains(NodeKind kind, String identifier) {
        return identifiers.get(kind).contains(identifier);
    }

    /**
     * First kind in {@code searchOrder} that has the identifier.
     */
    public Optional<NodeKind> find(String identifier, List<NodeKind> searchOrder) {
        for (NodeKind kind : searchOrder) {
            if (contains(kind, identifier)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    /**
     * Every kind in {@code searchOrder} that has the identifier, in search order.
     */
    public List<NodeKind> findAll(String identifier, List<NodeKind> searchOrder) {
        List<NodeKind> matches = new ArrayList<>();
        for (NodeKind kind : searchOrder) {
            if (contains(kind, identifier)) {
                matches.add(kind);
            }
        }
        return matches;
    }

    public int size(NodeKind kind) {
        return identifiers.get(kind).size();
    }
}
