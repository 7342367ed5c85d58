package com.purchasingpower.itemgraph.resolve;

import com.purchasingpower.itemgraph.core.NodeSet;

/**
 * Turns string-keyed recipe references into BUILDS and REQUIRES edges.
 *
 * <p>Resolution never aborts: one bad reference costs exactly one edge and
 * produces exactly one diagnostic. Output order follows input order, so
 * unchanged input resolves to an identical edge list.
 *
 * @since 1.0.0
 */
public interface ReferenceResolver {

    /**
     * Resolve every recipe's {@code resultType} and ingredient list.
     *
     * @param nodes Complete normalized node sets of all kinds
     * @return Resolved edges and diagnostics
     */
    ResolutionResult resolve(NodeSet nodes);
}
