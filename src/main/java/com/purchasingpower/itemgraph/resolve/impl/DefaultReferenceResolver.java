package com.purchasingpower.itemgraph.resolve.impl;

import com.purchasingpower.itemgraph.core.GraphEdge;
import com.purchasingpower.itemgraph.core.Ingredient;
import com.purchasingpower.itemgraph.core.NodeKind;
import com.purchasingpower.itemgraph.core.NodeSet;
import com.purchasingpower.itemgraph.core.NormalizedNode;
import com.purchasingpower.itemgraph.core.RelationshipKind;
import com.purchasingpower.itemgraph.normalize.NodeSchemaRegistry;
import com.purchasingpower.itemgraph.report.Diagnostic;
import com.purchasingpower.itemgraph.report.DiagnosticKind;
import com.purchasingpower.itemgraph.report.IngestionStage;
import com.purchasingpower.itemgraph.resolve.IdentifierIndex;
import com.purchasingpower.itemgraph.resolve.ReferenceResolver;
import com.purchasingpower.itemgraph.resolve.ResolutionResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Resolves recipe references against an {@link IdentifierIndex}.
 *
 * <p>Lookup order:
 * <ul>
 *   <li>{@code resultType}: Weapon, then Resource</li>
 *   <li>ingredient {@code ItemType}: Resource, then Weapon, then Recipe</li>
 * </ul>
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class DefaultReferenceResolver implements ReferenceResolver {

    static final List<NodeKind> PRODUCT_KINDS = List.of(NodeKind.WEAPON, NodeKind.RESOURCE);
    static final List<NodeKind> INGREDIENT_KINDS = List.of(NodeKind.RESOURCE, NodeKind.WEAPON, NodeKind.RECIPE);

    @Override
    public ResolutionResult resolve(NodeSet nodes) {
        IdentifierIndex index = IdentifierIndex.of(nodes);
        List<NormalizedNode> recipes = nodes.get(NodeKind.RECIPE);

        log.info("Resolving references of {} recipes against {} weapons and {} resources",
                recipes.size(), index.size(NodeKind.WEAPON), index.size(NodeKind.RESOURCE));

        List<GraphEdge> edges = new ArrayList<>();
        List<Diagnostic> diagnostics = new ArrayList<>();

        for (NormalizedNode recipe : recipes) {
            resolveProduct(recipe, index, diagnostics).ifPresent(edges::add);
            edges.addAll(resolveIngredients(recipe, index, diagnostics));
        }

        Map<RelationshipKind, Long> perKind = edges.stream()
                .collect(Collectors.groupingBy(GraphEdge::getKind, Collectors.counting()));
        log.info("✅ Resolved {} BUILDS and {} REQUIRES edges ({} unresolved references)",
                perKind.getOrDefault(RelationshipKind.BUILDS, 0L),
                perKind.getOrDefault(RelationshipKind.REQUIRES, 0L),
                diagnostics.stream().filter(d -> d.getKind() != DiagnosticKind.AMBIGUOUS_REFERENCE).count());

        return new ResolutionResult(List.copyOf(edges), List.copyOf(diagnostics));
    }

    private Optional<GraphEdge> resolveProduct(NormalizedNode recipe, IdentifierIndex index, List<Diagnostic> diagnostics) {
        String resultType = recipe.getString(NodeSchemaRegistry.RESULT_TYPE).trim();
        if (resultType.isEmpty()) {
            diagnostics.add(Diagnostic.of(IngestionStage.RESOLVE, recipe.getIdentifier(), DiagnosticKind.MISSING_REFERENCE,
                    "recipe declares no resultType; no BUILDS edge"));
            return Optional.empty();
        }

        List<NodeKind> matches = index.findAll(resultType, PRODUCT_KINDS);
        if (matches.isEmpty()) {
            diagnostics.add(Diagnostic.of(IngestionStage.RESOLVE, recipe.getIdentifier(), DiagnosticKind.DANGLING_REFERENCE,
                    "resultType '" + resultType + "' matches no Weapon or Resource"));
            return Optional.empty();
        }
        if (matches.size() > 1) {
            diagnostics.add(Diagnostic.of(IngestionStage.RESOLVE, recipe.getIdentifier(), DiagnosticKind.AMBIGUOUS_REFERENCE,
                    "resultType '" + resultType + "' exists as both Weapon and Resource; linking the Weapon"));
        }

        return Optional.of(GraphEdge.builder()
                .kind(RelationshipKind.BUILDS)
                .sourceKind(NodeKind.RECIPE)
                .sourceId(recipe.getIdentifier())
                .targetKind(matches.get(0))
                .targetId(resultType)
                .properties(Map.of(GraphEdge.QUANTITY, recipe.getLong(NodeSchemaRegistry.OUTPUT_QUANTITY)))
                .build());
    }

    private List<GraphEdge> resolveIngredients(NormalizedNode recipe, IdentifierIndex index, List<Diagnostic> diagnostics) {
        Map<GraphEdge.Key, GraphEdge> merged = new LinkedHashMap<>();

        for (Ingredient ingredient : recipe.getIngredients()) {
            String itemType = ingredient.getItemType();
            Optional<NodeKind> target = index.find(itemType, INGREDIENT_KINDS);
            if (target.isEmpty()) {
                diagnostics.add(Diagnostic.of(IngestionStage.RESOLVE, recipe.getIdentifier(), DiagnosticKind.DANGLING_REFERENCE,
                        "ingredient '" + itemType + "' matches no Resource, Weapon or Recipe"));
                continue;
            }

            GraphEdge edge = GraphEdge.builder()
                    .kind(RelationshipKind.REQUIRES)
                    .sourceKind(NodeKind.RECIPE)
                    .sourceId(recipe.getIdentifier())
                    .targetKind(target.get())
                    .targetId(itemType)
                    .properties(Map.of(GraphEdge.QUANTITY, ingredient.getQuantity()))
                    .build();

            // Repeated ingredients collapse into one edge with the summed quantity
            merged.merge(edge.key(), edge, (existing, repeat) -> existing.toBuilder()
                    .properties(Map.of(GraphEdge.QUANTITY, existing.getQuantity() + repeat.getQuantity()))
                    .build());
        }

        return new ArrayList<>(merged.values());
    }
}
