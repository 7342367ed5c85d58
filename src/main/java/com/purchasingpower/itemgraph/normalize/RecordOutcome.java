package com.purchasingpower.itemgraph.normalize;

import com.purchasingpower.itemgraph.core.NormalizedNode;
import com.purchasingpower.itemgraph.report.Diagnostic;
import lombok.Value;

import java.util.List;

/**
 * Result of normalizing one record: the node, or nothing when the record was
 * rejected, plus whatever was noticed along the way.
 */
@Value
public class RecordOutcome {

    NormalizedNode node;
    List<Diagnostic> diagnostics;

    public static RecordOutcome accepted(NormalizedNode node, List<Diagnostic> diagnostics) {
        return new RecordOutcome(node, List.copyOf(diagnostics));
    }

    public static RecordOutcome rejected(Diagnostic reason) {
        return new RecordOutcome(null, List.of(reason));
    }

    public boolean isRejected() {
        return node == null;
    }
}
