package com.legal.reasoner.rule;

import com.legal.reasoner.api.ConfigException;
import com.legal.reasoner.api.TargetKind;

/**
 * How a clause reaches its premise facts from the rule's candidate target.
 */
public enum ClausePattern {
    /** The target's own fact. */
    SELF(null, false),
    /** Nodes reached by following outgoing edges of the clause's edge type. */
    OUT_NEIGHBOR(TargetKind.NODE, true),
    /** Nodes reached by following incoming edges of the clause's edge type. */
    IN_NEIGHBOR(TargetKind.NODE, true),
    /** Outgoing edges of the clause's edge type themselves. */
    OUT_EDGE(TargetKind.NODE, true),
    /** Incoming edges of the clause's edge type themselves. */
    IN_EDGE(TargetKind.NODE, true),
    /** Source node of an edge target. */
    EDGE_SOURCE(TargetKind.EDGE, false),
    /** Target node of an edge target. */
    EDGE_TARGET(TargetKind.EDGE, false);

    // null means the pattern applies to both kinds
    private final TargetKind appliesTo;
    private final boolean needsEdgeType;

    ClausePattern(TargetKind appliesTo, boolean needsEdgeType) {
        this.appliesTo = appliesTo;
        this.needsEdgeType = needsEdgeType;
    }

    public boolean appliesTo(TargetKind kind) {
        return appliesTo == null || appliesTo == kind;
    }

    public boolean needsEdgeType() {
        return needsEdgeType;
    }

    public static ClausePattern fromString(String s) {
        if (s == null)
            throw new ConfigException("Clause pattern is missing");
        try {
            return valueOf(s.trim().toUpperCase().replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new ConfigException(s, "Unknown clause pattern", e);
        }
    }
}
