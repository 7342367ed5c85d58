package com.purchasingpower.itemgraph.configuration;

import jakarta.validation.constraints.Pattern;
import lombok.Data;

@Data
public class StoreProperties {

    /**
     * {@code neo4j} for the real graph, {@code in-memory} for dry runs.
     */
    @Pattern(regexp = "neo4j|in-memory")
    private String type = "neo4j";

    /**
     * Delete every item graph node before writing. Stale-node detection is meaningless
     * when this is on.
     */
    private boolean clearBeforeRun = false;
}
