package com.purchasingpower.itemgraph.normalize;

import com.purchasingpower.itemgraph.core.NodeKind;
import com.purchasingpower.itemgraph.core.NormalizedNode;
import com.purchasingpower.itemgraph.report.Diagnostic;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Normalized node set of one category, deduplicated by identifier, in input order.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class NormalizationResult {
    NodeKind kind;
    int recordsRead;
    int rejected;
    List<NormalizedNode> nodes;
    List<Diagnostic> diagnostics;

    public static NormalizationResult empty(NodeKind kind) {
        return NormalizationResult.builder()
                .kind(kind)
                .nodes(List.of())
                .diagnostics(List.of())
                .build();
    }
}
