package com.purchasingpower.itemgraph.taxonomy;

import com.purchasingpower.itemgraph.core.GraphEdge;
import com.purchasingpower.itemgraph.core.NormalizedNode;
import com.purchasingpower.itemgraph.report.Diagnostic;
import lombok.Value;

import java.util.List;

/**
 * Derived Category nodes, BELONGS_TO edges and unlinked-item warnings.
 */
@Value
public class TaxonomyResult {
    List<NormalizedNode> categories;
    List<GraphEdge> memberships;
    List<Diagnostic> diagnostics;
}
