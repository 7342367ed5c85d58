package com.purchasingpower.itemgraph.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Canonical node produced by the normalizer.
 *
 * <p>{@code properties} holds every declared field of the kind (defaults filled in),
 * including the identifier under the kind's key property. It is exactly what gets
 * written to the store. Ingredients and the category label travel alongside because
 * they become edges, not properties.
 *
 * @since 1.0.0
 */
@Value
@Builder(toBuilder = true)
public class NormalizedNode {

    NodeKind kind;

    String identifier;

    /** Index of the source record in its collection; the first occurrence for a duplicated identifier. */
    int position;

    Map<String, Object> properties;

    @Singular
    List<Ingredient> ingredients;

    /**
     * Raw category label, or {@code null} when the kind takes no part in the taxonomy.
     */
    String category;

    public String getString(String field) {
        Object value = properties.get(field);
        return value != null ? value.toString() : "";
    }

    public long getLong(String field) {
        Object value = properties.get(field);
        return value instanceof Number ? ((Number) value).longValue() : 0L;
    }
}
