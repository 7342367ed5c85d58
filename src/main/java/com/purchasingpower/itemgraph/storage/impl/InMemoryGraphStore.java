package com.purchasingpower.itemgraph.storage.impl;

import com.purchasingpower.itemgraph.core.GraphEdge;
import com.purchasingpower.itemgraph.core.NodeKind;
import com.purchasingpower.itemgraph.core.RelationshipKind;
import com.purchasingpower.itemgraph.exception.GraphStoreException;
import com.purchasingpower.itemgraph.storage.GraphStore;
import com.purchasingpower.itemgraph.storage.GraphWriter;
import com.purchasingpower.itemgraph.storage.UpsertOutcome;
import com.purchasingpower.itemgraph.util.ServiceType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Graph store held in memory, for dry runs and tests.
 *
 * <p>Each batch works on a staged copy that replaces the live state only when the
 * batch completes, so a failing batch leaves no trace. Writes are serialized.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "itemgraph.store.type", havingValue = "in-memory")
public class InMemoryGraphStore implements GraphStore {

    private State state = new State();

    @Override
    public void verifyConnectivity() {
        log.debug("In-memory graph store is always reachable");
    }

    @Override
    public void ensureConstraints() {
        // uniqueness is structural: nodes are keyed by (kind, identifier)
    }

    @Override
    public ServiceType getServiceType() {
        return ServiceType.IN_MEMORY;
    }

    @Override
    public synchronized <T> T write(String batchId, Function<GraphWriter, T> work) {
        State staged = state.copy();
        try {
            T result = work.apply(new StagedWriter(batchId, staged));
            state = staged;
            return result;
        } catch (GraphStoreException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new GraphStoreException(batchId, "Batch " + batchId + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized void clear() {
        state = new State();
    }

    @Override
    public synchronized Set<String> listIdentifiers(NodeKind kind) {
        return new LinkedHashSet<>(state.nodes.get(kind).keySet());
    }

    @Override
    public synchronized Optional<Map<String, Object>> findNode(NodeKind kind, String identifier) {
        return Optional.ofNullable(state.nodes.get(kind).get(identifier));
    }

    @Override
    public synchronized List<GraphEdge> findEdges(RelationshipKind kind) {
        List<GraphEdge> edges = new ArrayList<>();
        state.edges.forEach((key, properties) -> {
            if (key.getKind() == kind) {
                edges.add(toEdge(key, properties));
            }
        });
        return edges;
    }

    @Override
    public synchronized Map<String, Long> countNodes() {
        Map<String, Long> counts = new LinkedHashMap<>();
        state.nodes.forEach((kind, nodes) -> {
            if (!nodes.isEmpty()) {
                counts.put(kind.getLabel(), (long) nodes.size());
            }
        });
        return counts;
    }

    @Override
    public synchronized Map<String, Long> countEdges() {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (GraphEdge.Key key : state.edges.keySet()) {
            counts.merge(key.getKind().name(), 1L, Long::sum);
        }
        return counts;
    }

    private static GraphEdge toEdge(GraphEdge.Key key, Map<String, Object> properties) {
        return GraphEdge.builder()
                .kind(key.getKind())
                .sourceKind(key.getSourceKind())
                .sourceId(key.getSourceId())
                .targetKind(key.getTargetKind())
                .targetId(key.getTargetId())
                .properties(properties)
                .build();
    }

    private static final class State {
        final Map<NodeKind, Map<String, Map<String, Object>>> nodes = new EnumMap<>(NodeKind.class);
        final Map<GraphEdge.Key, Map<String, Object>> edges = new LinkedHashMap<>();

        State() {
            for (NodeKind kind : NodeKind.values()) {
                nodes.put(kind, new LinkedHashMap<>());
            }
        }

        // property maps are immutable, so copying the containers is enough
        State copy() {
            State copy = new State();
            nodes.forEach((kind, byId) -> copy.nodes.get(kind).putAll(byId));
            copy.edges.putAll(edges);
            return copy;
        }
    }

    private static final class StagedWriter implements GraphWriter {
        private final String batchId;
        private final State staged;

        StagedWriter(String batchId, State staged) {
            this.batchId = batchId;
            this.staged = staged;
        }

        @Override
        public UpsertOutcome upsertNode(NodeKind kind, String identifier, Map<String, Object> properties) {
            Map<String, Object> replacement = new LinkedHashMap<>(properties);
            replacement.put(kind.getKeyProperty(), identifier);
            Map<String, Object> previous = staged.nodes.get(kind).put(identifier, Map.copyOf(replacement));
            return previous == null ? UpsertOutcome.CREATED : UpsertOutcome.UPDATED;
        }

        @Override
        public UpsertOutcome upsertEdge(GraphEdge edge) {
            if (!staged.nodes.get(edge.getSourceKind()).containsKey(edge.getSourceId())
                    || !staged.nodes.get(edge.getTargetKind()).containsKey(edge.getTargetId())) {
                throw new GraphStoreException(batchId, "Missing endpoint for edge " + edge.key());
            }
            Map<String, Object> previous = staged.edges.put(edge.key(), Map.copyOf(edge.getProperties()));
            return previous == null ? UpsertOutcome.CREATED : UpsertOutcome.UPDATED;
        }

        @Override
        public int pruneEdges(RelationshipKind kind, NodeKind sourceKind, Collection<String> sourceIds,
                              Collection<GraphEdge> keep) {
            Set<String> sources = new HashSet<>(sourceIds);
            Set<GraphEdge.Key> kept = new HashSet<>();
            for (GraphEdge edge : keep) {
                kept.add(edge.key());
            }

            int removed = 0;
            var iterator = staged.edges.keySet().iterator();
            while (iterator.hasNext()) {
                GraphEdge.Key key = iterator.next();
                if (key.getKind() == kind && key.getSourceKind() == sourceKind
                        && sources.contains(key.getSourceId()) && !kept.contains(key)) {
                    iterator.remove();
                    removed++;
                }
            }
            return removed;
        }
    }
}
