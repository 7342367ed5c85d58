package com.purchasingpower.itemgraph.normalize;

import java.util.List;

/**
 * Canonical field types and their defaults when a record omits the field.
 *
 * @since 1.0.0
 */
public enum FieldType {
    STRING(""),
    INTEGER(0L),
    DECIMAL(0.0d),
    BOOLEAN(Boolean.FALSE),
    NUMBER_LIST(List.of()),
    /** Recipe ingredient list. Turned into edges, never stored as a property. */
    INGREDIENT_LIST(List.of());

    private final Object defaultValue;

    FieldType(Object defaultValue) {
        this.defaultValue = defaultValue;
    }

    public Object getDefaultValue() {
        return defaultValue;
    }

    public boolean isStoredAsProperty() {
        return this != INGREDIENT_LIST;
    }
}
