package com.purchasingpower.itemgraph.storage.impl;

import com.purchasingpower.itemgraph.core.GraphEdge;
import com.purchasingpower.itemgraph.core.NodeKind;
import com.purchasingpower.itemgraph.core.RelationshipKind;
import com.purchasingpower.itemgraph.exception.GraphStoreException;
import com.purchasingpower.itemgraph.storage.GraphStore;
import com.purchasingpower.itemgraph.storage.GraphWriter;
import com.purchasingpower.itemgraph.storage.UpsertOutcome;
import com.purchasingpower.itemgraph.util.ServiceType;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.neo4j.driver.Record;
import org.neo4j.driver.Result;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.Transaction;
import org.neo4j.driver.exceptions.Neo4jException;
import org.neo4j.driver.summary.SummaryCounters;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Neo4j implementation of GraphStore.
 *
 * <p>Write batches use explicit transactions rather than managed ones, so the driver
 * never retries a failed batch on its own. Labels and relationship types come from
 * the {@link NodeKind} and {@link RelationshipKind} enums, never from input data.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "itemgraph.store.type", havingValue = "neo4j", matchIfMissing = true)
public class Neo4jGraphStoreImpl implements GraphStore {

    @Value("${neo4j.uri:bolt://localhost:7687}")
    private String neo4jUri;

    @Value("${neo4j.username:neo4j}")
    private String neo4jUsername;

    @Value("${neo4j.password:password}")
    private String neo4jPassword;

    @Value("${neo4j.database:}")
    private String neo4jDatabase;

    private Driver driver;

    @PostConstruct
    public void init() {
        log.info("Initializing Neo4j GraphStore at: {} (database: {})", neo4jUri,
                neo4jDatabase.isBlank() ? "<default>" : neo4jDatabase);
        driver = GraphDatabase.driver(neo4jUri, AuthTokens.basic(neo4jUsername, neo4jPassword));
    }

    @PreDestroy
    public void close() {
        if (driver != null) {
            driver.close();
            log.info("Neo4j GraphStore connection closed");
        }
    }

    private Session session() {
        return neo4jDatabase.isBlank()
                ? driver.session()
                : driver.session(SessionConfig.forDatabase(neo4jDatabase));
    }

    @Override
    public void verifyConnectivity() {
        try {
            driver.verifyConnectivity();
            log.info("✅ Connected to Neo4j at {}", neo4jUri);
        } catch (Neo4jException e) {
            throw new GraphStoreException("connectivity", "Cannot reach Neo4j at " + neo4jUri + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void ensureConstraints() {
        try (Session session = session()) {
            for (NodeKind kind : NodeKind.values()) {
                String name = kind.getLabel().toLowerCase() + "_" + kind.getKeyProperty().toLowerCase() + "_unique";
                session.run(String.format(
                        "CREATE CONSTRAINT %s IF NOT EXISTS FOR (n:%s) REQUIRE n.%s IS UNIQUE",
                        name, kind.getLabel(), kind.getKeyProperty())).consume();
            }
            log.info("✅ Uniqueness constraints in place for {}", Arrays.toString(NodeKind.values()));
        } catch (Neo4jException e) {
            throw new GraphStoreException("constraints", "Failed to declare constraints: " + e.getMessage(), e);
        }
    }

    @Override
    public ServiceType getServiceType() {
        return ServiceType.NEO4J;
    }

    @Override
    public <T> T write(String batchId, Function<GraphWriter, T> work) {
        try (Session session = session(); Transaction tx = session.beginTransaction()) {
            T result = work.apply(new TransactionWriter(batchId, tx));
            tx.commit();
            return result;
        } catch (GraphStoreException e) {
            throw e;
        } catch (Neo4jException e) {
            throw new GraphStoreException(batchId, "Batch " + batchId + " rolled back: " + e.getMessage(), e);
        }
    }

    @Override
    public void clear() {
        String cypher = "MATCH (n) WHERE " + labelPredicate("n") + " DETACH DELETE n";
        try (Session session = session(); Transaction tx = session.beginTransaction()) {
            SummaryCounters counters = tx.run(cypher).consume().counters();
            tx.commit();
            log.info("✓ Cleared {} nodes and {} relationships", counters.nodesDeleted(), counters.relationshipsDeleted());
        } catch (Neo4jException e) {
            throw new GraphStoreException("clear", "Failed to clear item graph: " + e.getMessage(), e);
        }
    }

    // =========================================================================
    // Reads
    // =========================================================================

    @Override
    public Set<String> listIdentifiers(NodeKind kind) {
        String cypher = String.format("MATCH (n:%s) RETURN n.%s AS id", kind.getLabel(), kind.getKeyProperty());
        return read(cypher, Map.of(), records -> records.stream()
                .map(r -> r.get("id").asString())
                .collect(Collectors.toCollection(LinkedHashSet::new)));
    }

    @Override
    public Optional<Map<String, Object>> findNode(NodeKind kind, String identifier) {
        String cypher = String.format("MATCH (n:%s {%s: $id}) RETURN properties(n) AS props",
                kind.getLabel(), kind.getKeyProperty());
        return read(cypher, Map.of("id", identifier), records -> records.stream()
                .findFirst()
                .map(r -> r.get("props").asMap()));
    }

    @Override
    public List<GraphEdge> findEdges(RelationshipKind kind) {
        String cypher = String.format("""
                MATCH (s)-[r:%s]->(t)
                RETURN labels(s)[0] AS sourceLabel, coalesce(s.uniqueName, s.name) AS sourceId,
                       labels(t)[0] AS targetLabel, coalesce(t.uniqueName, t.name) AS targetId,
                       properties(r) AS props
                """, kind.name());
        return read(cypher, Map.of(), records -> records.stream()
                .map(r -> GraphEdge.builder()
                        .kind(kind)
                        .sourceKind(NodeKind.fromLabel(r.get("sourceLabel").asString()))
                        .sourceId(r.get("sourceId").asString())
                        .targetKind(NodeKind.fromLabel(r.get("targetLabel").asString()))
                        .targetId(r.get("targetId").asString())
                        .properties(r.get("props").asMap())
                        .build())
                .collect(Collectors.toList()));
    }

    @Override
    public Map<String, Long> countNodes() {
        String cypher = "MATCH (n) WHERE " + labelPredicate("n")
                + " RETURN labels(n)[0] AS label, count(*) AS count ORDER BY label";
        return read(cypher, Map.of(), records -> toCounts(records, "label"));
    }

    @Override
    public Map<String, Long> countEdges() {
        String cypher = "MATCH ()-[r]->() WHERE type(r) IN $types RETURN type(r) AS type, count(*) AS count ORDER BY type";
        List<String> types = Arrays.stream(RelationshipKind.values()).map(Enum::name).toList();
        return read(cypher, Map.of("types", types), records -> toCounts(records, "type"));
    }

    private <T> T read(String cypher, Map<String, Object> params, Function<List<Record>, T> mapper) {
        try (Session session = session()) {
            return session.executeRead(tx -> mapper.apply(tx.run(cypher, params).list()));
        } catch (Neo4jException e) {
            throw new GraphStoreException("read", "Query failed: " + e.getMessage(), e);
        }
    }

    private static Map<String, Long> toCounts(List<Record> records, String keyColumn) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (Record record : records) {
            counts.put(record.get(keyColumn).asString(), record.get("count").asLong());
        }
        return counts;
    }

    private static String labelPredicate(String variable) {
        return Arrays.stream(NodeKind.values())
                .map(kind -> variable + ":" + kind.getLabel())
                .collect(Collectors.joining(" OR "));
    }

    /**
     * Writer bound to one open transaction.
     */
    private static final class TransactionWriter implements GraphWriter {
        private final String batchId;
        private final Transaction tx;

        TransactionWriter(String batchId, Transaction tx) {
            this.batchId = batchId;
            this.tx = tx;
        }

        @Override
        public UpsertOutcome upsertNode(NodeKind kind, String identifier, Map<String, Object> properties) {
            String cypher = String.format("""
                    MERGE (n:%s {%s: $id})
                    SET n = $props
                    """, kind.getLabel(), kind.getKeyProperty());

            Map<String, Object> props = new HashMap<>(properties);
            props.put(kind.getKeyProperty(), identifier);

            SummaryCounters counters = tx.run(cypher, Map.of("id", identifier, "props", props)).consume().counters();
            return counters.nodesCreated() > 0 ? UpsertOutcome.CREATED : UpsertOutcome.UPDATED;
        }

        @Override
        public UpsertOutcome upsertEdge(GraphEdge edge) {
            String cypher = String.format("""
                    MATCH (s:%s {%s: $sourceId})
                    MATCH (t:%s {%s: $targetId})
                    MERGE (s)-[r:%s]->(t)
                    SET r = $props
                    RETURN count(r) AS matched
                    """,
                    edge.getSourceKind().getLabel(), edge.getSourceKind().getKeyProperty(),
                    edge.getTargetKind().getLabel(), edge.getTargetKind().getKeyProperty(),
                    edge.getKind().name());

            Result result = tx.run(cypher, Map.of(
                    "sourceId", edge.getSourceId(),
                    "targetId", edge.getTargetId(),
                    "props", edge.getProperties()));
            long matched = result.single().get("matched").asLong();
            if (matched == 0) {
                throw new GraphStoreException(batchId, "Missing endpoint for edge " + edge.key());
            }
            return result.consume().counters().relationshipsCreated() > 0 ? UpsertOutcome.CREATED : UpsertOutcome.UPDATED;
        }

        @Override
        public int pruneEdges(RelationshipKind kind, NodeKind sourceKind, Collection<String> sourceIds,
                              Collection<GraphEdge> keep) {
            Map<String, Set<String>> keepBySource = new HashMap<>();
            for (GraphEdge edge : keep) {
                keepBySource.computeIfAbsent(edge.getSourceId(), id -> new HashSet<>())
                        .add(edge.getTargetKind().getLabel() + ":" + edge.getTargetId());
            }

            List<Map<String, Object>> sources = new ArrayList<>(sourceIds.size());
            for (String sourceId : sourceIds) {
                sources.add(Map.of("id", sourceId, "keep", List.copyOf(keepBySource.getOrDefault(sourceId, Set.of()))));
            }

            String cypher = String.format("""
                    UNWIND $sources AS src
                    MATCH (s:%s {%s: src.id})-[r:%s]->(t)
                    WHERE NOT (labels(t)[0] + ':' + coalesce(t.uniqueName, t.name)) IN src.keep
                    DELETE r
                    """, sourceKind.getLabel(), sourceKind.getKeyProperty(), kind.name());

            return tx.run(cypher, Map.of("sources", sources)).consume().counters().relationshipsDeleted();
        }
    }
}
