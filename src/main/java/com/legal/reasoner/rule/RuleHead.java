package com.legal.reasoner.rule;

import com.legal.reasoner.api.TargetKind;

/**
 * What a rule derives: a label on nodes, or on edges (optionally restricted to
 * one edge type; null means every edge).
 */
public record RuleHead(String label, TargetKind kind, String edgeType) {

    public static RuleHead node(String label) {
        return new RuleHead(label, TargetKind.NODE, null);
    }

    public static RuleHead edge(String label, String edgeType) {
        return new RuleHead(label, TargetKind.EDGE, edgeType);
    }
}
