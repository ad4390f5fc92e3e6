package com.legal.reasoner.graph;

import java.util.Map;

import com.legal.reasoner.api.NodeRef;

/**
 * A node of the typed graph with its metadata attributes (values that are not
 * facts, e.g. jurisdiction, court, year).
 */
public record GraphNode(NodeRef ref, Map<String, Object> attributes) {

    public GraphNode {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public String id() {
        return ref.id();
    }
}
