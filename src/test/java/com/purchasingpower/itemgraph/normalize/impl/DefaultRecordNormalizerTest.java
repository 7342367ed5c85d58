package com.purchasingpower.itemgraph.normalize.impl;

import com.purchasingpower.itemgraph.configuration.ItemGraphProperties;
import com.purchasingpower.itemgraph.core.Ingredient;
import com.purchasingpower.itemgraph.core.NodeKind;
import com.purchasingpower.itemgraph.core.NormalizedNode;
import com.purchasingpower.itemgraph.core.RawRecord;
import com.purchasingpower.itemgraph.normalize.NodeSchemaRegistry;
import com.purchasingpower.itemgraph.normalize.NormalizationResult;
import com.purchasingpower.itemgraph.normalize.RecordOutcome;
import com.purchasingpower.itemgraph.report.Diagnostic;
import com.purchasingpower.itemgraph.report.DiagnosticKind;
import com.purchasingpower.itemgraph.report.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.purchasingpower.itemgraph.testsupport.ItemFixtures.ingredient;
import static com.purchasingpower.itemgraph.testsupport.ItemFixtures.recipe;
import static com.purchasingpower.itemgraph.testsupport.ItemFixtures.resource;
import static com.purchasingpower.itemgraph.testsupport.ItemFixtures.weapon;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Record Normalizer Tests")
class DefaultRecordNormalizerTest {

    private DefaultRecordNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new DefaultRecordNormalizer(new NodeSchemaRegistry(), new ItemGraphProperties());
    }

    @Test
    @DisplayName("Absent fields take their declared defaults")
    void testDefaultsFilledIn() {
        RecordOutcome outcome = normalizer.normalize(NodeKind.WEAPON, RawRecord.of(Map.of("uniqueName", "W1")), 0);

        NormalizedNode node = outcome.getNode();
        assertNotNull(node);
        assertTrue(outcome.getDiagnostics().isEmpty());
        assertEquals("W1", node.getProperties().get("uniqueName"));
        assertEquals("", node.getProperties().get("name"));
        assertEquals(0.0d, node.getProperties().get("criticalChance"));
        assertEquals(0L, node.getProperties().get("masteryReq"));
        assertEquals(false, node.getProperties().get("sentinel"));
        assertEquals(List.of(), node.getProperties().get("damagePerShot"));
        assertEquals("", node.getCategory());
    }

    @Test
    @DisplayName("Every declared field is present on every node")
    void testEveryDeclaredFieldPresent() {
        NodeSchemaRegistry registry = new NodeSchemaRegistry();
        NormalizedNode node = normalizer.normalize(NodeKind.RESOURCE, resource("R1"), 0).getNode();

        registry.get(NodeKind.RESOURCE).getFields()
                .forEach(rule -> assertTrue(node.getProperties().containsKey(rule.getName()), rule.getName()));
    }

    @Test
    @DisplayName("Recipe output quantity defaults to 1")
    void testRecipeNumDefault() {
        NormalizedNode node = normalizer.normalize(NodeKind.RECIPE, recipe("B1", "W1"), 0).getNode();

        assertEquals(1L, node.getProperties().get("num"));
        assertEquals(1L, node.getLong("num"));
    }

    @Test
    @DisplayName("Record without identifier is rejected with MALFORMED_RECORD")
    void testMissingIdentifierRejected() {
        RecordOutcome outcome = normalizer.normalize(NodeKind.WEAPON, RawRecord.of(Map.of("name", "Braton")), 7);

        assertTrue(outcome.isRejected());
        assertEquals(1, outcome.getDiagnostics().size());
        Diagnostic diagnostic = outcome.getDiagnostics().get(0);
        assertEquals(DiagnosticKind.MALFORMED_RECORD, diagnostic.getKind());
        assertEquals(Severity.ERROR, diagnostic.getSeverity());
        assertEquals("#7", diagnostic.getIdentifier());
        assertTrue(diagnostic.getDetail().contains("Braton"));
    }

    @Test
    @DisplayName("Blank identifier counts as missing")
    void testBlankIdentifierRejected() {
        RecordOutcome outcome = normalizer.normalize(NodeKind.RESOURCE, RawRecord.of(Map.of("uniqueName", "   ")), 0);

        assertTrue(outcome.isRejected());
    }

    @Test
    @DisplayName("Numeric strings are coerced to numbers")
    void testNumericStringCoerced() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("uniqueName", "W1");
        fields.put("masteryReq", "8");
        fields.put("fireRate", "2.5");

        RecordOutcome outcome = normalizer.normalize(NodeKind.WEAPON, RawRecord.of(fields), 0);

        assertTrue(outcome.getDiagnostics().isEmpty());
        assertEquals(8L, outcome.getNode().getProperties().get("masteryReq"));
        assertEquals(2.5d, outcome.getNode().getProperties().get("fireRate"));
    }

    @Test
    @DisplayName("Unconvertible value falls back to default with COERCION_FAILURE warning")
    void testCoercionFailure() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("uniqueName", "W1");
        fields.put("masteryReq", "lots");

        RecordOutcome outcome = normalizer.normalize(NodeKind.WEAPON, RawRecord.of(fields), 0);

        assertFalse(outcome.isRejected());
        assertEquals(0L, outcome.getNode().getProperties().get("masteryReq"));
        assertEquals(1, outcome.getDiagnostics().size());
        assertEquals(DiagnosticKind.COERCION_FAILURE, outcome.getDiagnostics().get(0).getKind());
        assertEquals(Severity.WARNING, outcome.getDiagnostics().get(0).getSeverity());
    }

    @Test
    @DisplayName("Oversized integers fall back to their defaults instead of wrapping")
    void testOversizedIntegersUseDefaults() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("uniqueName", "B1");
        fields.put("resultType", "W1");
        fields.put("buildPrice", 1e20);
        fields.put("ingredients", List.of(Map.of("ItemType", "R1", "ItemCount", new BigInteger("18446744073709551621"))));

        RecordOutcome outcome = normalizer.normalize(NodeKind.RECIPE, RawRecord.of(fields), 0);

        assertEquals(0L, outcome.getNode().getProperties().get("buildPrice"));
        assertEquals(List.of(new Ingredient("R1", 1)), outcome.getNode().getIngredients());
        assertEquals(2, outcome.getDiagnostics().size());
        assertTrue(outcome.getDiagnostics().stream().allMatch(d -> d.getKind() == DiagnosticKind.COERCION_FAILURE
                && d.getDetail().contains("outside the 64-bit range")));
    }

    @Test
    @DisplayName("Out-of-range value is kept and reported")
    void testOutOfRangeKept() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("uniqueName", "W1");
        fields.put("criticalChance", 1.5);

        RecordOutcome outcome = normalizer.normalize(NodeKind.WEAPON, RawRecord.of(fields), 0);

        assertEquals(1.5d, outcome.getNode().getProperties().get("criticalChance"));
        assertEquals(DiagnosticKind.OUT_OF_RANGE, outcome.getDiagnostics().get(0).getKind());
    }

    @Test
    @DisplayName("Ingredients are parsed with ItemCount defaulting to 1")
    void testIngredientsParsed() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("uniqueName", "B1");
        fields.put("resultType", "W1");
        fields.put("ingredients", List.of(ingredient("R1", 5), Map.of("ItemType", "R2")));

        NormalizedNode node = normalizer.normalize(NodeKind.RECIPE, RawRecord.of(fields), 0).getNode();

        assertEquals(List.of(new Ingredient("R1", 5), new Ingredient("R2", 1)), node.getIngredients());
        assertFalse(node.getProperties().containsKey("ingredients"));
    }

    @Test
    @DisplayName("Malformed ingredient entries are skipped and reported individually")
    void testMalformedIngredients() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("uniqueName", "B1");
        fields.put("resultType", "W1");
        fields.put("ingredients", List.of("R1", Map.of("ItemCount", 2), ingredient("R3", 1)));

        RecordOutcome outcome = normalizer.normalize(NodeKind.RECIPE, RawRecord.of(fields), 0);

        assertEquals(List.of(new Ingredient("R3", 1)), outcome.getNode().getIngredients());
        assertEquals(2, outcome.getDiagnostics().size());
        assertTrue(outcome.getDiagnostics().stream().allMatch(d -> d.getKind() == DiagnosticKind.MALFORMED_INGREDIENT));
    }

    @Test
    @DisplayName("Duplicate identifiers: later record wins, first position kept, one warning")
    void testDuplicateIdentifiers() {
        NormalizationResult result = normalizer.normalizeAll(NodeKind.WEAPON, List.of(
                weapon("W1", "Pistols"),
                weapon("W2", "Rifles"),
                weapon("W1", "Shotguns")));

        assertEquals(3, result.getRecordsRead());
        assertEquals(2, result.getNodes().size());
        NormalizedNode first = result.getNodes().get(0);
        assertEquals("W1", first.getIdentifier());
        assertEquals("Shotguns", first.getCategory());
        assertEquals(0, first.getPosition());
        assertEquals(1, result.getNodes().get(1).getPosition());
        assertEquals("W2", result.getNodes().get(1).getIdentifier());

        assertEquals(1, result.getDiagnostics().size());
        assertEquals(DiagnosticKind.DUPLICATE_IDENTIFIER, result.getDiagnostics().get(0).getKind());
        assertEquals("W1", result.getDiagnostics().get(0).getIdentifier());
        assertTrue(result.getDiagnostics().get(0).getDetail().contains("record #2 repeats the identifier of record #0"));
    }

    @Test
    @DisplayName("Rejected records are counted but do not stop the collection")
    void testRejectedRecordsCounted() {
        NormalizationResult result = normalizer.normalizeAll(NodeKind.RESOURCE, List.of(
                resource("R1"),
                RawRecord.of(Map.of()),
                resource("R2")));

        assertEquals(1, result.getRejected());
        assertEquals(List.of("R1", "R2"), result.getNodes().stream().map(NormalizedNode::getIdentifier).toList());
        assertEquals("#1", result.getDiagnostics().get(0).getIdentifier());
    }

    @Test
    @DisplayName("Empty collection normalizes to empty result")
    void testEmptyCollection() {
        NormalizationResult result = normalizer.normalizeAll(NodeKind.RECIPE, List.of());

        assertTrue(result.getNodes().isEmpty());
        assertTrue(result.getDiagnostics().isEmpty());
    }
}
