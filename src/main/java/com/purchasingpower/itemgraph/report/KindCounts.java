package com.purchasingpower.itemgraph.report;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Created/updated counters for one node or relationship kind.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class KindCounts {

    private int created;
    private int updated;

    public int getTotal() {
        return created + updated;
    }
}
