package com.purchasingpower.itemgraph.taxonomy.impl;

import com.purchasingpower.itemgraph.core.GraphEdge;
import com.purchasingpower.itemgraph.core.NodeKind;
import com.purchasingpower.itemgraph.core.NodeSet;
import com.purchasingpower.itemgraph.core.NormalizedNode;
import com.purchasingpower.itemgraph.core.RelationshipKind;
import com.purchasingpower.itemgraph.report.Diagnostic;
import com.purchasingpower.itemgraph.report.DiagnosticKind;
import com.purchasingpower.itemgraph.report.IngestionStage;
import com.purchasingpower.itemgraph.taxonomy.CategoryNames;
import com.purchasingpower.itemgraph.taxonomy.TaxonomyBuilder;
import com.purchasingpower.itemgraph.taxonomy.TaxonomyResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Default taxonomy builder.
 *
 * <p>A Category's name is chosen independently of input order: a stored name with the
 * same key is reused, otherwise the lexicographically smallest observed spelling wins.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class DefaultTaxonomyBuilder implements TaxonomyBuilder {

    @Override
    public TaxonomyResult build(NodeSet nodes, Collection<String> knownNames) {
        Map<String, String> stored = new HashMap<>();
        for (String name : knownNames) {
            stored.merge(CategoryNames.key(name), name, DefaultTaxonomyBuilder::canonical);
        }

        Map<String, String> displayByKey = new LinkedHashMap<>();
        List<Map.Entry<NormalizedNode, String>> keyByItem = new ArrayList<>();
        List<Diagnostic> diagnostics = new ArrayList<>();

        for (NormalizedNode item : nodes.all()) {
            if (item.getCategory() == null) {
                continue;
            }

            String key = CategoryNames.key(item.getCategory());
            if (key.isEmpty()) {
                diagnostics.add(Diagnostic.of(IngestionStage.TAXONOMY, item.getIdentifier(), DiagnosticKind.MISSING_CATEGORY,
                        item.getKind().getLabel() + " has no category; not linked to any Category"));
                continue;
            }

            displayByKey.merge(key, CategoryNames.display(item.getCategory()), DefaultTaxonomyBuilder::canonical);
            keyByItem.add(Map.entry(item, key));
        }
        displayByKey.replaceAll((key, display) -> stored.getOrDefault(key, display));

        List<GraphEdge> memberships = new ArrayList<>(keyByItem.size());
        for (Map.Entry<NormalizedNode, String> entry : keyByItem) {
            NormalizedNode item = entry.getKey();
            memberships.add(GraphEdge.builder()
                    .kind(RelationshipKind.BELONGS_TO)
                    .sourceKind(item.getKind())
                    .sourceId(item.getIdentifier())
                    .targetKind(NodeKind.CATEGORY)
                    .targetId(displayByKey.get(entry.getValue()))
                    .build());
        }

        List<NormalizedNode> categories = new ArrayList<>(displayByKey.size());
        int position = 0;
        for (String display : displayByKey.values()) {
            categories.add(NormalizedNode.builder()
                    .kind(NodeKind.CATEGORY)
                    .identifier(display)
                    .position(position++)
                    .properties(Map.of(NodeKind.CATEGORY.getKeyProperty(), display))
                    .build());
        }

        log.info("✅ Derived {} categories, {} memberships ({} unlabelled items)",
                categories.size(), memberships.size(), diagnostics.size());

        return new TaxonomyResult(List.copyOf(categories), List.copyOf(memberships), List.copyOf(diagnostics));
    }

    private static String canonical(String a, String b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
