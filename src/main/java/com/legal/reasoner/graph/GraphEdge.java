package com.legal.reasoner.graph;

import java.util.Map;

import com.legal.reasoner.api.EdgeRef;

/** A directed, typed edge with its metadata attributes. */
public record GraphEdge(EdgeRef ref, Map<String, Object> attributes) {

    public GraphEdge {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public String type() {
        return ref.type();
    }
}
