package com.legal.reasoner.api;

/**
 * A directed, typed edge. At most one edge of a given type may connect the
 * same ordered pair of nodes.
 */
public record EdgeRef(String source, String target, String type) implements EntityRef {

    public EdgeRef {
        if (source == null || source.isBlank() || target == null || target.isBlank())
            throw new IllegalArgumentException("Edge endpoints must not be blank");
        if (type == null || type.isBlank())
            throw new IllegalArgumentException("Edge type must not be blank");
    }

    @Override
    public TargetKind kind() {
        return TargetKind.EDGE;
    }

    @Override
    public String id() {
        return source + "->" + target + ":" + type;
    }

    public NodeRef sourceNode() {
        return new NodeRef(source);
    }

    public NodeRef targetNode() {
        return new NodeRef(target);
    }

    @Override
    public String toString() {
        return id();
    }
}
