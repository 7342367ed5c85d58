package com.purchasingpower.itemgraph.upsert;

import com.purchasingpower.itemgraph.report.KindCounts;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Created/updated counts of one upsert pass, keyed by label and relationship type,
 * plus the number of edges pruned because their source no longer declares them.
 */
@Data
public class UpsertResult {

    private final Map<String, KindCounts> nodes = new LinkedHashMap<>();
    private final Map<String, KindCounts> edges = new LinkedHashMap<>();
    private int edgesRemoved;

    public int getNodesWritten() {
        return nodes.values().stream().mapToInt(KindCounts::getTotal).sum();
    }

    public int getEdgesWritten() {
        return edges.values().stream().mapToInt(KindCounts::getTotal).sum();
    }
}
