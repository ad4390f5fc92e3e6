package com.legal.reasoner.api;

/**
 * Reference to a fact-carrying graph entity: either a {@link NodeRef} or an
 * {@link EdgeRef}.
 *
 * Entity references are plain values. They order nodes before edges, then
 * lexicographically by their {@link #id()}, which gives the engine a stable
 * iteration order independent of hash layout.
 */
public interface EntityRef extends Comparable<EntityRef> {

    TargetKind kind();

    /** Stable textual identifier, unique within a graph. */
    String id();

    default boolean isNode() {
        return kind() == TargetKind.NODE;
    }

    /** Returns this reference as an edge, failing if it is a node. */
    default EdgeRef asEdge() {
        if (this instanceof EdgeRef e)
            return e;
        throw new IllegalStateException("Not an edge: " + id());
    }

    @Override
    default int compareTo(EntityRef o) {
        int c = kind().compareTo(o.kind());
        return c != 0 ? c : id().compareTo(o.id());
    }
}
