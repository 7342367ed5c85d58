package com.purchasingpower.itemgraph.normalize.impl;

import com.purchasingpower.itemgraph.configuration.ItemGraphProperties;
import com.purchasingpower.itemgraph.core.Ingredient;
import com.purchasingpower.itemgraph.core.NodeKind;
import com.purchasingpower.itemgraph.core.NormalizedNode;
import com.purchasingpower.itemgraph.core.RawRecord;
import com.purchasingpower.itemgraph.normalize.FieldRule;
import com.purchasingpower.itemgraph.normalize.FieldType;
import com.purchasingpower.itemgraph.normalize.NodeSchema;
import com.purchasingpower.itemgraph.normalize.NodeSchemaRegistry;
import com.purchasingpower.itemgraph.normalize.NormalizationResult;
import com.purchasingpower.itemgraph.normalize.RecordNormalizer;
import com.purchasingpower.itemgraph.normalize.RecordOutcome;
import com.purchasingpower.itemgraph.report.Diagnostic;
import com.purchasingpower.itemgraph.report.DiagnosticKind;
import com.purchasingpower.itemgraph.report.IngestionStage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Table-driven normalizer: walks the {@link NodeSchema} of the record's kind and
 * fills, coerces and range-checks every declared field.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DefaultRecordNormalizer implements RecordNormalizer {

    private final NodeSchemaRegistry schemaRegistry;
    private final ItemGraphProperties properties;

    @Override
    public RecordOutcome normalize(NodeKind kind, RawRecord record, int position) {
        NodeSchema schema = schemaRegistry.get(kind);

        String identifier = identifierOf(record.get(schema.getIdentifierField()));
        if (identifier.isEmpty()) {
            return RecordOutcome.rejected(Diagnostic.of(
                    IngestionStage.NORMALIZE,
                    "#" + position,
                    DiagnosticKind.MALFORMED_RECORD,
                    String.format("%s record #%d has no %s%s", kind.getLabel(), position,
                            schema.getIdentifierField(), describeName(record))));
        }

        List<Diagnostic> diagnostics = new ArrayList<>();
        Map<String, Object> props = new LinkedHashMap<>();
        props.put(kind.getKeyProperty(), identifier);

        List<Ingredient> ingredients = List.of();
        for (FieldRule rule : schema.getFields()) {
            Object raw = record.get(rule.getName());
            if (rule.getType() == FieldType.INGREDIENT_LIST) {
                ingredients = ingredientsOf(identifier, rule.getName(), raw, diagnostics);
                continue;
            }
            props.put(rule.getName(), valueOf(identifier, rule, raw, diagnostics));
        }

        NormalizedNode node = NormalizedNode.builder()
                .kind(kind)
                .identifier(identifier)
                .position(position)
                .properties(Collections.unmodifiableMap(props))
                .ingredients(ingredients)
                .category(schema.hasCategory() ? (String) props.get(schema.getCategoryField()) : null)
                .build();

        return RecordOutcome.accepted(node, diagnostics);
    }

    @Override
    public NormalizationResult normalizeAll(NodeKind kind, List<RawRecord> records) {
        if (records == null || records.isEmpty()) {
            log.info("No {} records to normalize", kind.getLabel());
            return NormalizationResult.empty(kind);
        }

        log.info("Normalizing {} {} records...", records.size(), kind.getLabel());
        int progressInterval = properties.getNormalizer().getProgressInterval();

        Map<String, NormalizedNode> byIdentifier = new LinkedHashMap<>();
        List<Diagnostic> diagnostics = new ArrayList<>();
        int rejected = 0;

        for (int i = 0; i < records.size(); i++) {
            RawRecord record = records.get(i);
            RecordOutcome outcome = normalize(kind, record != null ? record : RawRecord.of(Map.of()), i);
            diagnostics.addAll(outcome.getDiagnostics());

            if (outcome.isRejected()) {
                rejected++;
            } else {
                NormalizedNode node = outcome.getNode();
                NormalizedNode previous = byIdentifier.get(node.getIdentifier());
                if (previous == null) {
                    byIdentifier.put(node.getIdentifier(), node);
                } else {
                    // later values, first position; LinkedHashMap keeps the slot on replace
                    byIdentifier.put(node.getIdentifier(), node.toBuilder().position(previous.getPosition()).build());
                    diagnostics.add(Diagnostic.of(IngestionStage.NORMALIZE, node.getIdentifier(),
                            DiagnosticKind.DUPLICATE_IDENTIFIER,
                            String.format("%s record #%d repeats the identifier of record #%d; later values win",
                                    kind.getLabel(), i, previous.getPosition())));
                }
            }

            if ((i + 1) % progressInterval == 0) {
                log.info("  Processed {}/{} {} records...", i + 1, records.size(), kind.getLabel());
            }
        }

        log.info("✅ Normalized {} {} nodes ({} rejected, {} diagnostics)",
                byIdentifier.size(), kind.getLabel(), rejected, diagnostics.size());

        return NormalizationResult.builder()
                .kind(kind)
                .recordsRead(records.size())
                .rejected(rejected)
                .nodes(List.copyOf(byIdentifier.values()))
                .diagnostics(List.copyOf(diagnostics))
                .build();
    }

    private Object valueOf(String identifier, FieldRule rule, Object raw, List<Diagnostic> diagnostics) {
        if (raw == null) {
            return rule.getDefaultValue();
        }

        ValueCoercer.Coercion coercion = ValueCoercer.coerce(rule.getType(), raw);
        if (coercion.problem() != null) {
            diagnostics.add(Diagnostic.of(IngestionStage.NORMALIZE, identifier, DiagnosticKind.COERCION_FAILURE,
                    String.format("%s: %s%s", rule.getName(), coercion.problem(),
                            coercion.isFailed() ? "; using default " + rule.getDefaultValue() : "")));
        }
        if (coercion.isFailed()) {
            return rule.getDefaultValue();
        }

        Object value = coercion.value();
        checkRange(identifier, rule, value, diagnostics);
        return value;
    }

    private void checkRange(String identifier, FieldRule rule, Object value, List<Diagnostic> diagnostics) {
        if (value instanceof Number number) {
            if (!rule.getRange().accepts(number.doubleValue())) {
                diagnostics.add(outOfRange(identifier, rule, number));
            }
        } else if (value instanceof Collection<?> items) {
            for (Object item : items) {
                if (item instanceof Number number && !rule.getRange().accepts(number.doubleValue())) {
                    diagnostics.add(outOfRange(identifier, rule, number));
                    return;
                }
            }
        }
    }

    private static Diagnostic outOfRange(String identifier, FieldRule rule, Number value) {
        String expected = switch (rule.getRange()) {
            case CHANCE -> "[0, 1]";
            case NON_NEGATIVE -> ">= 0";
            case ANY -> "any";
        };
        return Diagnostic.of(IngestionStage.NORMALIZE, identifier, DiagnosticKind.OUT_OF_RANGE,
                String.format("%s = %s is outside %s; kept as-is", rule.getName(), value, expected));
    }

    private List<Ingredient> ingredientsOf(String identifier, String field, Object raw, List<Diagnostic> diagnostics) {
        if (raw == null) {
            return List.of();
        }
        if (!(raw instanceof Collection<?> entries)) {
            diagnostics.add(Diagnostic.of(IngestionStage.NORMALIZE, identifier, DiagnosticKind.MALFORMED_INGREDIENT,
                    field + " is " + ValueCoercer.describe(raw) + ", expected a list"));
            return List.of();
        }

        List<Ingredient> ingredients = new ArrayList<>(entries.size());
        int index = 0;
        for (Object entry : entries) {
            Ingredient ingredient = ingredientOf(identifier, index++, entry, diagnostics);
            if (ingredient != null) {
                ingredients.add(ingredient);
            }
        }
        return List.copyOf(ingredients);
    }

    private Ingredient ingredientOf(String identifier, int index, Object entry, List<Diagnostic> diagnostics) {
        if (!(entry instanceof Map<?, ?> fields)) {
            diagnostics.add(Diagnostic.of(IngestionStage.NORMALIZE, identifier, DiagnosticKind.MALFORMED_INGREDIENT,
                    "ingredient #" + index + " is " + ValueCoercer.describe(entry) + ", expected an object"));
            return null;
        }

        String itemType = identifierOf(fields.get(NodeSchemaRegistry.INGREDIENT_ITEM));
        if (itemType.isEmpty()) {
            diagnostics.add(Diagnostic.of(IngestionStage.NORMALIZE, identifier, DiagnosticKind.MALFORMED_INGREDIENT,
                    "ingredient #" + index + " has no " + NodeSchemaRegistry.INGREDIENT_ITEM + "; skipped"));
            return null;
        }

        FieldRule countRule = FieldRule.count(NodeSchemaRegistry.INGREDIENT_COUNT).withDefault(1L);
        long quantity = ((Number) valueOf(identifier, countRule, fields.get(NodeSchemaRegistry.INGREDIENT_COUNT), diagnostics))
                .longValue();
        return new Ingredient(itemType, quantity);
    }

    private static String identifierOf(Object raw) {
        if (raw instanceof String s) {
            return s.trim();
        }
        if (raw instanceof Number || raw instanceof Boolean) {
            return raw.toString().trim();
        }
        return "";
    }

    private static String describeName(RawRecord record) {
        Object name = record.get("name");
        return name instanceof String s && !s.isBlank() ? " (name: " + s + ")" : "";
    }
}
