package com.purchasingpower.itemgraph.resolve;

import com.purchasingpower.itemgraph.core.GraphEdge;
import com.purchasingpower.itemgraph.core.RelationshipKind;
import com.purchasingpower.itemgraph.report.Diagnostic;
import lombok.Value;

import java.util.List;

/**
 * Edges that resolved plus a diagnostic for every reference that did not.
 *
 * @since 1.0.0
 */
@Value
public class ResolutionResult {
    List<GraphEdge> edges;
    List<Diagnostic> diagnostics;

    public List<GraphEdge> edgesOf(RelationshipKind kind) {
        return edges.stream().filter(e -> e.getKind() == kind).toList();
    }
}
