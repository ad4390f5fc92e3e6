package com.legal.reasoner.graph;

import java.util.*;

import com.legal.reasoner.api.EdgeRef;
import com.legal.reasoner.api.EntityRef;
import com.legal.reasoner.api.NodeRef;

/**
 * Graph: the immutable typed structure facts live on.
 *
 * <p>
 * Nodes and edges are created once, at load time, and never deleted. Unlike a
 * dependency DAG the graph may contain cycles (mutual citation, mutual
 * support); the fixed-point engine does not rely on any traversal order of
 * the graph itself.
 *
 * <h3>Indexing</h3>
 * Adjacency is pre-computed per (node, edge type) in both directions so that
 * clause matching during a step is a map lookup followed by a scan of an
 * already-sorted list. All iteration orders are sorted by entity id, which
 * keeps evaluation independent of insertion order.
 */
public final class Graph {
    private final String name;

    // Sorted by id for stable iteration.
    private final NavigableMap<String, GraphNode> nodes;
    private final NavigableMap<String, GraphEdge> edges;

    // node id -> edge type -> edges, sorted by edge id
    private final Map<String, Map<String, List<EdgeRef>>> outByType;
    private final Map<String, Map<String, List<EdgeRef>>> inByType;

    private Graph(String name, NavigableMap<String, GraphNode> nodes, NavigableMap<String, GraphEdge> edges,
            Map<String, Map<String, List<EdgeRef>>> outByType, Map<String, Map<String, List<EdgeRef>>> inByType) {
        this.name = name;
        this.nodes = nodes;
        this.edges = edges;
        this.outByType = outByType;
        this.inByType = inByType;
    }

    public String name() {
        return name;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public Collection<GraphNode> nodes() {
        return nodes.values();
    }

    public Collection<GraphEdge> edges() {
        return edges.values();
    }

    public GraphNode node(String id) {
        return nodes.get(id);
    }

    public GraphEdge edge(EdgeRef ref) {
        return edges.get(ref.id());
    }

    public boolean contains(EntityRef ref) {
        return ref.isNode() ? nodes.containsKey(ref.id()) : edges.containsKey(ref.id());
    }

    /** Edges of the given type leaving {@code nodeId}, sorted by id. */
    public List<EdgeRef> outEdges(String nodeId, String type) {
        return outByType.getOrDefault(nodeId, Map.of()).getOrDefault(type, List.of());
    }

    /** Edges of the given type entering {@code nodeId}, sorted by id. */
    public List<EdgeRef> inEdges(String nodeId, String type) {
        return inByType.getOrDefault(nodeId, Map.of()).getOrDefault(type, List.of());
    }

    /** All edges of the given type, sorted by id. */
    public List<EdgeRef> edgesOfType(String type) {
        List<EdgeRef> out = new ArrayList<>();
        for (GraphEdge e : edges.values())
            if (e.type().equals(type))
                out.add(e.ref());
        return out;
    }

    /** Metadata attribute of an entity, or null if the entity or key is absent. */
    public Object attribute(EntityRef ref, String key) {
        Map<String, Object> attrs = null;
        if (ref.isNode()) {
            GraphNode n = nodes.get(ref.id());
            if (n != null)
                attrs = n.attributes();
        } else {
            GraphEdge e = edges.get(ref.id());
            if (e != null)
                attrs = e.attributes();
        }
        return attrs == null ? null : attrs.get(key);
    }

    /**
     * Numeric metadata attribute of an entity.
     *
     * @return the value, or null if absent or not numeric.
     */
    public Double numericAttribute(EntityRef ref, String key) {
        Object v = attribute(ref, key);
        if (v instanceof Number n)
            return n.doubleValue();
        if (v instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Builder for constructing the Graph.
     * Rejects duplicate nodes, duplicate edges and dangling endpoints.
     */
    public static final class Builder {
        private final String name;
        private final NavigableMap<String, GraphNode> nodes = new TreeMap<>();
        private final NavigableMap<String, GraphEdge> edges = new TreeMap<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder addNode(String id) {
            return addNode(id, Map.of());
        }

        public Builder addNode(String id, Map<String, Object> attributes) {
            if (nodes.containsKey(id))
                throw new IllegalArgumentException("Duplicate node id: " + id);
            nodes.put(id, new GraphNode(new NodeRef(id), attributes));
            return this;
        }

        public Builder addEdge(String source, String target, String type) {
            return addEdge(source, target, type, Map.of());
        }

        public Builder addEdge(String source, String target, String type, Map<String, Object> attributes) {
            requireNode(source);
            requireNode(target);
            EdgeRef ref = new EdgeRef(source, target, type);
            if (edges.containsKey(ref.id()))
                throw new IllegalArgumentException("Duplicate edge: " + ref.id());
            edges.put(ref.id(), new GraphEdge(ref, attributes));
            return this;
        }

        private void requireNode(String id) {
            if (!nodes.containsKey(id))
                throw new IllegalArgumentException("Unknown node: " + id);
        }

        public Graph build() {
            Map<String, Map<String, List<EdgeRef>>> out = new HashMap<>(nodes.size() * 2);
            Map<String, Map<String, List<EdgeRef>>> in = new HashMap<>(nodes.size() * 2);

            // edges is a TreeMap, so every adjacency list is filled in id order
            for (GraphEdge e : edges.values()) {
                EdgeRef r = e.ref();
                out.computeIfAbsent(r.source(), k -> new HashMap<>())
                        .computeIfAbsent(r.type(), k -> new ArrayList<>()).add(r);
                in.computeIfAbsent(r.target(), k -> new HashMap<>())
                        .computeIfAbsent(r.type(), k -> new ArrayList<>()).add(r);
            }
            freeze(out);
            freeze(in);
            return new Graph(name, Collections.unmodifiableNavigableMap(new TreeMap<>(nodes)),
                    Collections.unmodifiableNavigableMap(new TreeMap<>(edges)), out, in);
        }

        private static void freeze(Map<String, Map<String, List<EdgeRef>>> index) {
            for (Map<String, List<EdgeRef>> byType : index.values())
                byType.replaceAll((type, list) -> List.copyOf(list));
        }
    }
}
