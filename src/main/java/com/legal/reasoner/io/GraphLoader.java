package com.legal.reasoner.io;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.legal.reasoner.api.ConfigException;
import com.legal.reasoner.api.EdgeRef;
import com.legal.reasoner.api.EntityRef;
import com.legal.reasoner.api.FactKey;
import com.legal.reasoner.api.Interval;
import com.legal.reasoner.api.NodeRef;
import com.legal.reasoner.graph.Graph;

import lombok.extern.log4j.Log4j2;

/**
 * Reads the JSON typed-graph exchange format into a {@link Graph} and its
 * initial facts.
 *
 * <p>
 * Each attribute is either a fact or metadata:
 * <ul>
 * <li>keys in the metadata-key set are always metadata;</li>
 * <li>{@code true}/{@code false} become {@code [1,1]}/{@code [0,0]};</li>
 * <li>a number within [0, 1] becomes a point interval;</li>
 * <li>a two-element numeric array becomes {@code [lower, upper]};</li>
 * <li>strings and numbers outside [0, 1] are metadata.</li>
 * </ul>
 * Anything else (nested objects, arrays of another shape, malformed
 * intervals) is rejected with a {@link ConfigException}.
 */
@Log4j2
public final class GraphLoader {
    public static final Set<String> DEFAULT_METADATA_KEYS = Set.of(
            "jurisdiction", "court", "court_level", "year", "treatment", "precedent_weight", "name");

    private final ObjectMapper mapper = new ObjectMapper();
    private final Set<String> metadataKeys;

    public GraphLoader() {
        this(DEFAULT_METADATA_KEYS);
    }

    public GraphLoader(Set<String> metadataKeys) {
        this.metadataKeys = Set.copyOf(metadataKeys);
    }

    public LoadedGraph load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        }
    }

    public LoadedGraph load(InputStream in) throws IOException {
        GraphDefinition def;
        try {
            def = mapper.readValue(in, GraphDefinition.class);
        } catch (JsonProcessingException e) {
            throw new ConfigException("graph", "Malformed graph JSON: " + e.getOriginalMessage(), e);
        }
        return compile(def);
    }

    public LoadedGraph parse(String json) {
        try {
            return compile(mapper.readValue(json, GraphDefinition.class));
        } catch (JsonProcessingException e) {
            throw new ConfigException("graph", "Malformed graph JSON: " + e.getOriginalMessage(), e);
        }
    }

    /** Builds the graph and splits attributes into facts and metadata. */
    public LoadedGraph compile(GraphDefinition def) {
        if (def == null || def.getGraph() == null)
            throw new ConfigException("graph", "Missing 'graph' key");
        GraphDefinition.GraphInfo info = def.getGraph();
        String name = info.getName() != null ? info.getName() : "graph";

        Graph.Builder builder = Graph.builder(name);
        Map<FactKey, Interval> facts = new TreeMap<>();

        List<GraphDefinition.NodeDef> nodes = info.getNodes() != null ? info.getNodes() : List.of();
        for (GraphDefinition.NodeDef nd : nodes) {
            if (nd.getId() == null || nd.getId().isBlank())
                throw new ConfigException("nodes", "Node without id");
            Map<String, Object> meta = new TreeMap<>();
            split(new NodeRef(nd.getId()), nd.getAttributes(), meta, facts);
            try {
                builder.addNode(nd.getId(), meta);
            } catch (IllegalArgumentException e) {
                throw new ConfigException(nd.getId(), e.getMessage(), e);
            }
        }

        List<GraphDefinition.EdgeDef> edges = info.getEdges() != null ? info.getEdges() : List.of();
        for (GraphDefinition.EdgeDef ed : edges) {
            if (ed.getSource() == null || ed.getTarget() == null || ed.getType() == null)
                throw new ConfigException("edges", "Edge requires source, target and type: " + ed);
            EdgeRef ref = new EdgeRef(ed.getSource(), ed.getTarget(), ed.getType());
            Map<String, Object> meta = new TreeMap<>();
            split(ref, ed.getAttributes(), meta, facts);
            try {
                builder.addEdge(ed.getSource(), ed.getTarget(), ed.getType(), meta);
            } catch (IllegalArgumentException e) {
                throw new ConfigException(ref.id(), e.getMessage(), e);
            }
        }

        Graph graph = builder.build();
        log.info("Loaded graph '{}': {} nodes, {} edges, {} initial facts", name, graph.nodeCount(),
                graph.edgeCount(), facts.size());
        return new LoadedGraph(graph, facts);
    }

    private void split(EntityRef entity, Map<String, Object> attributes, Map<String, Object> meta,
            Map<FactKey, Interval> facts) {
        if (attributes == null)
            return;
        for (Map.Entry<String, Object> e : attributes.entrySet()) {
            String key = e.getKey();
            Object v = e.getValue();
            if (v == null)
                continue;
            if (metadataKeys.contains(key) || v instanceof String) {
                meta.put(key, v);
                continue;
            }
            if (v instanceof Boolean b) {
                facts.put(new FactKey(entity, key), b ? Interval.TRUE : Interval.FALSE);
            } else if (v instanceof Number n) {
                double d = n.doubleValue();
                if (d >= 0.0 && d <= 1.0)
                    facts.put(new FactKey(entity, key), Interval.point(d));
                else
                    meta.put(key, v);
            } else if (v instanceof List<?> list) {
                facts.put(new FactKey(entity, key), toInterval(entity, key, list));
            } else {
                throw new ConfigException(entity.id() + "." + key, "Unsupported attribute value: " + v);
            }
        }
    }

    private static Interval toInterval(EntityRef entity, String key, List<?> list) {
        String where = entity.id() + "." + key;
        if (list.size() != 2 || !(list.get(0) instanceof Number lo) || !(list.get(1) instanceof Number hi))
            throw new ConfigException(where, "Interval must be a two-element numeric array, got " + list);
        double l = lo.doubleValue();
        double u = hi.doubleValue();
        if (!Interval.isValid(l, u))
            throw new ConfigException(where, "Interval must satisfy 0 <= lower <= upper <= 1, got " + list);
        return new Interval(l, u);
    }
}
