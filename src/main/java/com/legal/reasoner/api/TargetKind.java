package com.legal.reasoner.api;

/** The two kinds of graph entity that can carry facts. */
public enum TargetKind {
    NODE,
    EDGE;

    public static TargetKind fromString(String s) {
        if (s == null)
            throw new IllegalArgumentException("Target kind is null");
        return switch (s.trim().toLowerCase()) {
            case "node" -> NODE;
            case "edge" -> EDGE;
            default -> throw new IllegalArgumentException("Unknown target kind: " + s);
        };
    }
}
