package com.purchasingpower.itemgraph.core;

import lombok.Value;

/**
 * A recipe ingredient as declared in the export: target identifier and count.
 */
@Value
public class Ingredient {
    String itemType;
    long quantity;
}
