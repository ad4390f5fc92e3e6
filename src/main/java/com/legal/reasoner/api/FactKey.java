package com.legal.reasoner.api;

/**
 * Identifies a fact slot: one label on one entity. The textual form
 * {@code label(entity)} is the statement used in exports and traces.
 */
public record FactKey(EntityRef entity, String label) implements Comparable<FactKey> {

    public FactKey {
        if (entity == null)
            throw new IllegalArgumentException("Fact entity is null");
        if (label == null || label.isBlank())
            throw new IllegalArgumentException("Fact label must not be blank");
    }

    public static FactKey node(String nodeId, String label) {
        return new FactKey(new NodeRef(nodeId), label);
    }

    public static FactKey edge(String source, String target, String type, String label) {
        return new FactKey(new EdgeRef(source, target, type), label);
    }

    public String statement() {
        return label + "(" + entity.id() + ")";
    }

    @Override
    public int compareTo(FactKey o) {
        int c = entity.compareTo(o.entity);
        return c != 0 ? c : label.compareTo(o.label);
    }

    @Override
    public String toString() {
        return statement();
    }
}
