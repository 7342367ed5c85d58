package com.purchasingpower.itemgraph.taxonomy;

import com.purchasingpower.itemgraph.core.NodeSet;

import java.util.Collection;
import java.util.List;

/**
 * Derives the Category taxonomy from the category labels of all item nodes.
 *
 * <p>Runs as one pass over the complete node set after normalization, so category
 * creation never races between concurrent normalizers.
 *
 * @since 1.0.0
 */
public interface TaxonomyBuilder {

    /**
     * Build one Category per distinct normalized label and link every labelled item to it.
     *
     * @param nodes Complete normalized node sets
     * @return Categories, memberships and warnings for unlabelled items
     */
    default TaxonomyResult build(NodeSet nodes) {
        return build(nodes, List.of());
    }

    /**
     * Same as {@link #build(NodeSet)}, but a Category name already in the graph keeps
     * its spelling when a label normalizes to the same key.
     *
     * @param nodes      Complete normalized node sets
     * @param knownNames Category names currently stored
     * @return Categories, memberships and warnings for unlabelled items
     */
    TaxonomyResult build(NodeSet nodes, Collection<String> knownNames);
}
