package com.purchasingpower.itemgraph.core;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * A resolved, directed edge between two nodes.
 *
 * <p>Edges are identified by {@link Key}: source, relationship kind and target.
 * Properties (the {@code quantity} weight) are overwritten on upsert.
 *
 * @since 1.0.0
 */
@Value
@Builder(toBuilder = true)
public class GraphEdge {

    public static final String QUANTITY = "quantity";

    RelationshipKind kind;
    NodeKind sourceKind;
    String sourceId;
    NodeKind targetKind;
    String targetId;

    @Builder.Default
    Map<String, Object> properties = Map.of();

    public Key key() {
        return new Key(sourceKind, sourceId, kind, targetKind, targetId);
    }

    public long getQuantity() {
        Object value = properties.get(QUANTITY);
        return value instanceof Number ? ((Number) value).longValue() : 0L;
    }

    /**
     * Edge identity. Two edges with the same key are the same relationship.
     */
    @Value
    public static class Key {
        NodeKind sourceKind;
        String sourceId;
        RelationshipKind kind;
        NodeKind targetKind;
        String targetId;

        @Override
        public String toString() {
            return sourceKind.getLabel() + ":" + sourceId + " -" + kind + "-> " + targetKind.getLabel() + ":" + targetId;
        }
    }
}
