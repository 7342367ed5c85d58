package com.purchasingpower.itemgraph.util;

/**
 * External systems the ingestion talks to, for unified call logging.
 *
 * @see ExternalCallLogger
 */
public enum ServiceType {
    NEO4J("🟢", "Neo4j"),
    IN_MEMORY("⚪", "InMemoryGraph"),
    EXPORT_FILES("📄", "ExportFiles");

    private final String emoji;
    private final String name;

    ServiceType(String emoji, String name) {
        this.emoji = emoji;
        this.name = name;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getName() {
        return name;
    }
}
