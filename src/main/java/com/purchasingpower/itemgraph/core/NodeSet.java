package com.purchasingpower.itemgraph.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Normalized nodes of every kind, each list in input order.
 *
 * <p>Built once at the join point after all categories are normalized, then only read.
 *
 * @since 1.0.0
 */
public final class NodeSet {

    private final Map<NodeKind, List<NormalizedNode>> nodes;

    private NodeSet(Map<NodeKind, List<NormalizedNode>> nodes) {
        this.nodes = nodes;
    }

    public static NodeSet of(Map<NodeKind, List<NormalizedNode>> nodesByKind) {
        Map<NodeKind, List<NormalizedNode>> copy = new EnumMap<>(NodeKind.class);
        for (NodeKind kind : NodeKind.values()) {
            List<NormalizedNode> list = nodesByKind.get(kind);
            copy.put(kind, list != null ? List.copyOf(list) : List.of());
        }
        return new NodeSet(Collections.unmodifiableMap(copy));
    }

    public List<NormalizedNode> get(NodeKind kind) {
        return nodes.get(kind);
    }

    /**
     * Every node, kinds in declaration order.
     */
    public List<NormalizedNode> all() {
        List<NormalizedNode> all = new ArrayList<>();
        for (NodeKind kind : NodeKind.values()) {
            all.addAll(nodes.get(kind));
        }
        return all;
    }

    public int size() {
        return nodes.values().stream().mapToInt(List::size).sum();
    }

    /**
     * Copy of this set with the given kind's nodes replaced, e.g. to add derived Category nodes.
     */
    public NodeSet with(NodeKind kind, List<NormalizedNode> replacement) {
        Map<NodeKind, List<NormalizedNode>> copy = new EnumMap<>(nodes);
        copy.put(kind, replacement);
        return of(copy);
    }
}
