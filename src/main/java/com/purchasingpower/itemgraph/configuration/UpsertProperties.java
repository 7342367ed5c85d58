package com.purchasingpower.itemgraph.configuration;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;

/**
 * Store write settings.
 *
 * <p>Properties are loaded from the {@code itemgraph.upsert} namespace:
 * <pre>
 * itemgraph:
 *   upsert:
 *     max-attempts: 1
 *     backoff-ms: 1000
 *     parallel-edge-batches: false
 * </pre>
 *
 * <p>A failed batch is only retried when {@code max-attempts} is raised above 1.
 * Every batch is a single transaction and every write is an upsert, so a retried
 * batch converges to the same state.
 */
@Data
public class UpsertProperties {

    @Min(1)
    @Max(10)
    private int maxAttempts = 1;

    private long backoffMs = 1000;

    /**
     * Write the batches of different relationship kinds concurrently.
     *
     * <p>Off by default. On Neo4j, concurrent kinds lock shared endpoint nodes in
     * different orders and one transaction can be aborted as a deadlock, so enable it
     * together with {@code max-attempts > 1}.
     */
    private boolean parallelEdgeBatches = false;
}
