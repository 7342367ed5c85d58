package com.purchasingpower.itemgraph.pipeline.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.itemgraph.configuration.ItemGraphProperties;
import com.purchasingpower.itemgraph.core.GraphEdge;
import com.purchasingpower.itemgraph.core.NodeKind;
import com.purchasingpower.itemgraph.core.RawRecord;
import com.purchasingpower.itemgraph.core.RelationshipKind;
import com.purchasingpower.itemgraph.exception.IngestionInProgressException;
import com.purchasingpower.itemgraph.normalize.NodeSchemaRegistry;
import com.purchasingpower.itemgraph.normalize.impl.DefaultRecordNormalizer;
import com.purchasingpower.itemgraph.pipeline.IngestionState;
import com.purchasingpower.itemgraph.report.Diagnostic;
import com.purchasingpower.itemgraph.report.DiagnosticKind;
import com.purchasingpower.itemgraph.report.IngestionReport;
import com.purchasingpower.itemgraph.report.IngestionStage;
import com.purchasingpower.itemgraph.report.ReportWriter;
import com.purchasingpower.itemgraph.report.RunStatus;
import com.purchasingpower.itemgraph.resolve.impl.DefaultReferenceResolver;
import com.purchasingpower.itemgraph.source.RecordSource;
import com.purchasingpower.itemgraph.storage.GraphStore;
import com.purchasingpower.itemgraph.storage.impl.InMemoryGraphStore;
import com.purchasingpower.itemgraph.taxonomy.impl.DefaultTaxonomyBuilder;
import com.purchasingpower.itemgraph.testsupport.ItemFixtures;
import com.purchasingpower.itemgraph.upsert.impl.DefaultGraphUpsertCoordinator;
import com.purchasingpower.itemgraph.upsert.impl.FailingGraphStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.purchasingpower.itemgraph.testsupport.ItemFixtures.ingredient;
import static com.purchasingpower.itemgraph.testsupport.ItemFixtures.recipe;
import static com.purchasingpower.itemgraph.testsupport.ItemFixtures.resource;
import static com.purchasingpower.itemgraph.testsupport.ItemFixtures.weapon;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Full pipeline runs against the in-memory store: read, normalize, resolve,
 * taxonomy, reconcile, upsert, report.
 */
@DisplayName("Ingestion Pipeline Tests")
class ItemGraphIngestionPipelineTest {

    private ItemGraphProperties properties;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        properties = new ItemGraphProperties();
        properties.getReport().setOutputPath("");
        properties.getUpsert().setBackoffMs(0);
        executor = Executors.newFixedThreadPool(3);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private ItemGraphIngestionPipeline pipeline(GraphStore store, RecordSource source) {
        return new ItemGraphIngestionPipeline(
                source,
                new DefaultRecordNormalizer(new NodeSchemaRegistry(), properties),
                new DefaultReferenceResolver(),
                new DefaultTaxonomyBuilder(),
                new DefaultGraphUpsertCoordinator(store, properties, executor),
                store,
                new ReportWriter(properties, new ObjectMapper()),
                properties,
                executor);
    }

    private static ItemFixtures.Source scenario() {
        return ItemFixtures.source()
                .weapons(weapon("W1", "Pistols"))
                .resources(resource("R1"))
                .recipes(recipe("B1", "W1", ingredient("R1", 5)));
    }

    private static Set<GraphEdge.Key> edgeKeys(GraphStore store) {
        Set<GraphEdge.Key> keys = new HashSet<>();
        for (RelationshipKind kind : RelationshipKind.values()) {
            store.findEdges(kind).forEach(edge -> keys.add(edge.key()));
        }
        return keys;
    }

    @Test
    @DisplayName("End-to-end: one weapon, resource and recipe give the exact graph and no diagnostics")
    void testEndToEndScenario() {
        InMemoryGraphStore store = new InMemoryGraphStore();

        IngestionReport report = pipeline(store, scenario()).run();

        assertEquals(RunStatus.SUCCEEDED, report.getStatus());
        assertTrue(report.getDiagnostics().isEmpty());
        assertEquals(Map.of("Weapon", 1L, "Resource", 1L, "Recipe", 1L, "Category", 1L), report.getStoreNodeTotals());
        assertEquals(Map.of("BUILDS", 1L, "REQUIRES", 1L, "BELONGS_TO", 1L), report.getStoreEdgeTotals());
        assertTrue(store.findNode(NodeKind.CATEGORY, "Pistols").isPresent());

        GraphEdge builds = store.findEdges(RelationshipKind.BUILDS).get(0);
        assertEquals("B1", builds.getSourceId());
        assertEquals("W1", builds.getTargetId());
        assertEquals(1L, builds.getQuantity());

        GraphEdge requires = store.findEdges(RelationshipKind.REQUIRES).get(0);
        assertEquals("R1", requires.getTargetId());
        assertEquals(5L, requires.getQuantity());

        GraphEdge belongsTo = store.findEdges(RelationshipKind.BELONGS_TO).get(0);
        assertEquals(NodeKind.WEAPON, belongsTo.getSourceKind());
        assertEquals("W1", belongsTo.getSourceId());
        assertEquals("Pistols", belongsTo.getTargetId());
        assertTrue(belongsTo.getProperties().isEmpty());

        assertEquals(1, report.getRecordsRead().get("Weapon"));
        assertEquals(1, report.getNodes().get("Category").getCreated());
    }

    @Test
    @DisplayName("Running twice on identical input leaves an identical graph")
    void testIdempotence() {
        InMemoryGraphStore store = new InMemoryGraphStore();
        ItemFixtures.Source source = scenario();

        pipeline(store, source).run();
        Map<String, Object> weaponAfterFirst = store.findNode(NodeKind.WEAPON, "W1").orElseThrow();
        Set<GraphEdge.Key> edgesAfterFirst = edgeKeys(store);

        IngestionReport second = pipeline(store, source).run();

        assertEquals(RunStatus.SUCCEEDED, second.getStatus());
        assertEquals(0, second.getNodes().get("Weapon").getCreated());
        assertEquals(1, second.getNodes().get("Weapon").getUpdated());
        assertEquals(0, second.getEdgesRemoved());
        assertEquals(weaponAfterFirst, store.findNode(NodeKind.WEAPON, "W1").orElseThrow());
        assertEquals(edgesAfterFirst, edgeKeys(store));
        assertEquals(Map.of("Weapon", 1L, "Resource", 1L, "Recipe", 1L, "Category", 1L), store.countNodes());
    }

    @Test
    @DisplayName("Dangling ingredient is reported and never materialized")
    void testDanglingReferenceNotWritten() {
        InMemoryGraphStore store = new InMemoryGraphStore();
        RecordSource source = ItemFixtures.source()
                .weapons(weapon("W1", "Pistols"))
                .resources(resource("R1"))
                .recipes(recipe("B1", "W1", ingredient("R1", 1), ingredient("/Lotus/Nowhere", 3)));

        IngestionReport report = pipeline(store, source).run();

        assertEquals(RunStatus.SUCCEEDED_WITH_WARNINGS, report.getStatus());
        assertEquals(Map.of("DANGLING_REFERENCE", 1), report.getDiagnosticCounts());
        assertEquals(1, store.findEdges(RelationshipKind.REQUIRES).size());
        assertTrue(store.findNode(NodeKind.RESOURCE, "/Lotus/Nowhere").isEmpty());
    }

    @Test
    @DisplayName("Every stored edge has both endpoints in the store")
    void testReferentialIntegrity() {
        InMemoryGraphStore store = new InMemoryGraphStore();
        RecordSource source = ItemFixtures.source()
                .weapons(weapon("W1", "Pistols"), weapon("W2", " pistols "), weapon("W3", ""))
                .resources(resource("R1"), resource("R2"))
                .recipes(
                        recipe("B1", "W1", ingredient("R1", 2), ingredient("R1", 3)),
                        recipe("B2", "R2", ingredient("W2", 1), ingredient("ghost", 1)),
                        recipe("B3", "missing"));

        IngestionReport report = pipeline(store, source).run();

        for (RelationshipKind kind : RelationshipKind.values()) {
            for (GraphEdge edge : store.findEdges(kind)) {
                assertTrue(store.findNode(edge.getSourceKind(), edge.getSourceId()).isPresent(), edge.key().toString());
                assertTrue(store.findNode(edge.getTargetKind(), edge.getTargetId()).isPresent(), edge.key().toString());
            }
        }
        assertEquals(5L, store.findEdges(RelationshipKind.REQUIRES).stream()
                .filter(e -> e.getSourceId().equals("B1")).findFirst().orElseThrow().getQuantity());
        assertEquals(Map.of("DANGLING_REFERENCE", 2, "MISSING_CATEGORY", 1), report.getDiagnosticCounts());
        assertEquals(Set.of("Pistols"), store.listIdentifiers(NodeKind.CATEGORY));
    }

    @Test
    @DisplayName("Nodes missing from a later export are flagged stale and left in place")
    void testStaleNodesReported() {
        InMemoryGraphStore store = new InMemoryGraphStore();
        pipeline(store, ItemFixtures.source()
                .weapons(weapon("W1", "Pistols"), weapon("W2", "Pistols"))).run();

        IngestionReport second = pipeline(store, ItemFixtures.source()
                .weapons(weapon("W1", "Pistols"))).run();

        assertEquals(RunStatus.SUCCEEDED_WITH_WARNINGS, second.getStatus());
        assertEquals(1, second.getStaleNodes());
        Diagnostic stale = second.getDiagnostics().get(0);
        assertEquals(DiagnosticKind.STALE_NODE, stale.getKind());
        assertEquals(IngestionStage.RECONCILE, stale.getStage());
        assertEquals("W2", stale.getIdentifier());
        assertTrue(store.findNode(NodeKind.WEAPON, "W2").isPresent());
    }

    @Test
    @DisplayName("Category spellings in a different order on the next run keep a single Category")
    void testCategoryIdentityIgnoresInputOrder() {
        InMemoryGraphStore store = new InMemoryGraphStore();
        IngestionReport first = pipeline(store, ItemFixtures.source()
                .weapons(weapon("W1", "pistols"), weapon("W2", "Pistols"))).run();

        IngestionReport second = pipeline(store, ItemFixtures.source()
                .weapons(weapon("W2", "Pistols"), weapon("W1", "pistols"))).run();

        assertEquals(RunStatus.SUCCEEDED, first.getStatus());
        assertEquals(RunStatus.SUCCEEDED, second.getStatus());
        assertEquals(0, second.getStaleNodes());
        assertEquals(Set.of("Pistols"), store.listIdentifiers(NodeKind.CATEGORY));
        assertThat(store.findEdges(RelationshipKind.BELONGS_TO))
                .extracting(GraphEdge::getTargetId)
                .containsOnly("Pistols");
    }

    @Test
    @DisplayName("A stored Category spelling is reused when a new spelling normalizes to it")
    void testStoredCategorySpellingReused() {
        InMemoryGraphStore store = new InMemoryGraphStore();
        pipeline(store, ItemFixtures.source().weapons(weapon("W1", "pistols"))).run();

        IngestionReport second = pipeline(store, ItemFixtures.source().weapons(weapon("W1", " Pistols "))).run();

        assertEquals(RunStatus.SUCCEEDED, second.getStatus());
        assertEquals(Set.of("pistols"), store.listIdentifiers(NodeKind.CATEGORY));
        assertEquals("pistols", store.findEdges(RelationshipKind.BELONGS_TO).get(0).getTargetId());
    }

    @Test
    @DisplayName("Clear-before-run replaces the graph and skips stale detection")
    void testClearBeforeRun() {
        InMemoryGraphStore store = new InMemoryGraphStore();
        pipeline(store, ItemFixtures.source().weapons(weapon("OLD", "Rifles"))).run();

        properties.getStore().setClearBeforeRun(true);
        IngestionReport report = pipeline(store, scenario()).run();

        assertEquals(RunStatus.SUCCEEDED, report.getStatus());
        assertTrue(store.findNode(NodeKind.WEAPON, "OLD").isEmpty());
        assertEquals(Set.of("Pistols"), store.listIdentifiers(NodeKind.CATEGORY));
    }

    @Test
    @DisplayName("Removed ingredient edge disappears on the next run")
    void testEdgesConverge() {
        InMemoryGraphStore store = new InMemoryGraphStore();
        pipeline(store, ItemFixtures.source()
                .resources(resource("R1"), resource("R2"))
                .recipes(recipe("B1", "R1", ingredient("R1", 1), ingredient("R2", 1)))).run();

        IngestionReport second = pipeline(store, ItemFixtures.source()
                .resources(resource("R1"), resource("R2"))
                .recipes(recipe("B1", "R1", ingredient("R1", 1)))).run();

        assertEquals(1, second.getEdgesRemoved());
        assertEquals(List.of("R1"), store.findEdges(RelationshipKind.REQUIRES).stream().map(GraphEdge::getTargetId).toList());
    }

    @Test
    @DisplayName("Store failure ends the run FAILED with stage and batch")
    void testStoreFailure() {
        FailingGraphStore store = new FailingGraphStore("edges:REQUIRES", Integer.MAX_VALUE);

        IngestionReport report = pipeline(store, scenario()).run();

        assertEquals(RunStatus.FAILED, report.getStatus());
        assertEquals(IngestionStage.EDGE_BATCH, report.getFailedStage());
        assertEquals("edges:REQUIRES", report.getFailedBatch());
        assertEquals(1, report.getDiagnosticCounts().get("STORE_COMMIT_FAILURE"));
        assertEquals(1, store.getAttempts());
        assertTrue(store.findNode(NodeKind.WEAPON, "W1").isPresent());
    }

    @Test
    @DisplayName("Unreadable source ends the run FAILED without touching the store")
    void testSourceFailure() {
        InMemoryGraphStore store = new InMemoryGraphStore();
        RecordSource broken = new RecordSource() {
            @Override
            public Map<NodeKind, List<RawRecord>> read() {
                throw new com.purchasingpower.itemgraph.exception.RecordSourceException("data_raw", "Export directory not found");
            }

            @Override
            public String describe() {
                return "broken source";
            }
        };

        IngestionReport report = pipeline(store, broken).run();

        assertEquals(RunStatus.FAILED, report.getStatus());
        assertEquals(IngestionStage.NORMALIZE, report.getFailedStage());
        assertThat(report.getFailureMessage()).contains("not found");
        assertTrue(store.countNodes().isEmpty());
    }

    @Test
    @DisplayName("Interrupt before writing cancels the run with no mutation")
    void testCancelledBeforeWrites() {
        InMemoryGraphStore store = new InMemoryGraphStore();
        ItemGraphIngestionPipeline pipeline = pipeline(store, scenario());

        Thread.currentThread().interrupt();
        IngestionReport report;
        try {
            report = pipeline.run();
        } finally {
            Thread.interrupted();
        }

        assertEquals(RunStatus.CANCELLED, report.getStatus());
        assertTrue(store.countNodes().isEmpty());
        assertEquals(IngestionState.CANCELLED, pipeline.getStatus().getState());
    }

    @Test
    @DisplayName("A second run while one is in flight is rejected")
    void testConcurrentRunRejected() throws Exception {
        InMemoryGraphStore store = new InMemoryGraphStore();
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ItemFixtures.Source fixtures = scenario();

        RecordSource blocking = new RecordSource() {
            @Override
            public Map<NodeKind, List<RawRecord>> read() {
                entered.countDown();
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return fixtures.read();
            }

            @Override
            public String describe() {
                return "blocking source";
            }
        };

        ItemGraphIngestionPipeline pipeline = pipeline(store, blocking);
        ExecutorService runner = Executors.newSingleThreadExecutor();
        try {
            Future<IngestionReport> first = runner.submit(() -> pipeline.run());
            assertTrue(entered.await(10, TimeUnit.SECONDS));

            assertTrue(pipeline.getStatus().isRunning());
            assertThrows(IngestionInProgressException.class, () -> pipeline.run(scenario()));

            release.countDown();
            assertEquals(RunStatus.SUCCEEDED, first.get(10, TimeUnit.SECONDS).getStatus());
            assertFalse(pipeline.getStatus().isRunning());
            assertTrue(pipeline.getLastReport().isPresent());
        } finally {
            runner.shutdownNow();
        }
    }

    @Test
    @DisplayName("Sequential normalization with parallel edge batches gives the same graph")
    void testSequentialNormalization() {
        properties.getNormalizer().setParallel(false);
        properties.getUpsert().setParallelEdgeBatches(true);
        InMemoryGraphStore store = new InMemoryGraphStore();

        IngestionReport report = pipeline(store, scenario()).run();

        assertEquals(RunStatus.SUCCEEDED, report.getStatus());
        assertEquals(Map.of("BUILDS", 1L, "REQUIRES", 1L, "BELONGS_TO", 1L), report.getStoreEdgeTotals());
    }
}
