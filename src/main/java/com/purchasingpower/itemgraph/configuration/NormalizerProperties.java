package com.purchasingpower.itemgraph.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class NormalizerProperties {

    /** Log progress every N records. */
    @Min(1)
    private int progressInterval = 500;

    /** Normalize the Weapon, Resource and Recipe collections concurrently. */
    private boolean parallel = true;
}
