package com.purchasingpower.itemgraph.normalize;

import com.purchasingpower.itemgraph.core.NodeKind;
import com.purchasingpower.itemgraph.core.RawRecord;

import java.util.List;

/**
 * Maps raw export records to canonical nodes.
 *
 * <p>Every declared field ends up present: absent fields take their default,
 * mistyped values are coerced or defaulted, out-of-range numbers are kept and
 * reported. Records without an identifier are rejected.
 *
 * <p>Implementations hold no mutable state, so collections of different kinds
 * can be normalized concurrently.
 *
 * @since 1.0.0
 */
public interface RecordNormalizer {

    /**
     * Normalize one record.
     *
     * @param kind Declared category of the record
     * @param record Raw field bag
     * @param position Index of the record in its collection, used when it has no identifier
     * @return Node or rejection, plus diagnostics
     */
    RecordOutcome normalize(NodeKind kind, RawRecord record, int position);

    /**
     * Normalize a whole collection, collapsing repeated identifiers.
     *
     * @param kind Declared category of every record
     * @param records Records in export order
     * @return Node set in input order plus all diagnostics
     */
    NormalizationResult normalizeAll(NodeKind kind, List<RawRecord> records);
}
