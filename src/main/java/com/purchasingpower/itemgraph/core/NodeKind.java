package com.purchasingpower.itemgraph.core;

/**
 * Node kinds in the item graph.
 *
 * <p>Each kind maps to a graph label and the property holding its identifier.
 *
 * @since 1.0.0
 */
public enum NodeKind {
    WEAPON("Weapon", "uniqueName"),
    RESOURCE("Resource", "uniqueName"),
    RECIPE("Recipe", "uniqueName"),
    CATEGORY("Category", "name");

    private final String label;
    private final String keyProperty;

    NodeKind(String label, String keyProperty) {
        this.label = label;
        this.keyProperty = keyProperty;
    }

    public String getLabel() {
        return label;
    }

    public String getKeyProperty() {
        return keyProperty;
    }

    public static NodeKind fromLabel(String label) {
        for (NodeKind kind : values()) {
            if (kind.label.equals(label)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown node label: " + label);
    }

    /**
     * Kinds read from export files. Category nodes are derived, never ingested.
     */
    public boolean isIngested() {
        return this != CATEGORY;
    }
}
