package com.purchasingpower.itemgraph.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Graph contents by label and relationship type.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphSummaryResponse {

    private String store;
    private Map<String, Long> nodes;
    private Map<String, Long> relationships;
    private long totalNodes;
    private long totalRelationships;

    public static GraphSummaryResponse of(String store, Map<String, Long> nodes, Map<String, Long> relationships) {
        return GraphSummaryResponse.builder()
            .store(store)
            .nodes(nodes)
            .relationships(relationships)
            .totalNodes(nodes.values().stream().mapToLong(Long::longValue).sum())
            .totalRelationships(relationships.values().stream().mapToLong(Long::longValue).sum())
            .build();
    }
}
