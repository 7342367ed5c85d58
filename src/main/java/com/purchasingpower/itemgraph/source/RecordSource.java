package com.purchasingpower.itemgraph.source;

import com.purchasingpower.itemgraph.core.NodeKind;
import com.purchasingpower.itemgraph.core.RawRecord;

import java.util.List;
import java.util.Map;

/**
 * Supplies raw records per ingested kind. The kind of every record is decided
 * here, by where it came from, never by its content.
 *
 * @since 1.0.0
 */
public interface RecordSource {

    /**
     * @return Records of every ingested kind, each list in source order; a kind with
     *         no records maps to an empty list
     * @throws com.purchasingpower.itemgraph.exception.RecordSourceException when a
     *         source cannot be read at all
     */
    Map<NodeKind, List<RawRecord>> read();

    /**
     * Human-readable origin for logs and reports.
     */
    String describe();
}
