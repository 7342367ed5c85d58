package com.purchasingpower.itemgraph.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One loosely-typed record from an export file.
 *
 * <p>Values are whatever the JSON reader produced: strings, numbers, booleans,
 * lists and maps. Nothing is validated here.
 *
 * @since 1.0.0
 */
public final class RawRecord {

    private final Map<String, Object> fields;

    private RawRecord(Map<String, Object> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static RawRecord of(Map<String, ?> fields) {
        return new RawRecord(fields != null ? new LinkedHashMap<>(fields) : Map.of());
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public boolean has(String field) {
        return fields.get(field) != null;
    }

    public Map<String, Object> getFields() {
        return fields;
    }

    @Override
    public String toString() {
        return "RawRecord" + fields;
    }
}
