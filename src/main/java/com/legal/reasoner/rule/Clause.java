package com.legal.reasoner.rule;

/**
 * One premise selector of a rule body.
 *
 * @param pattern         how premises are reached from the target.
 * @param edgeType        edge type followed by neighbor/edge patterns, else null.
 * @param label           label the premise facts must carry.
 * @param threshold       minimum lower bound for a premise to satisfy the clause.
 * @param quantifier      how many candidates must satisfy the threshold.
 * @param weightAttribute metadata attribute holding each premise's precedent
 *                        weight, or null.
 */
public record Clause(ClausePattern pattern, String edgeType, String label, double threshold,
        Quantifier quantifier, String weightAttribute) {

    public Clause {
        if (quantifier == null)
            quantifier = Quantifier.AT_LEAST_ONE;
    }

    public static Clause self(String label, double threshold) {
        return new Clause(ClausePattern.SELF, null, label, threshold, Quantifier.AT_LEAST_ONE, null);
    }

    public static Clause outNeighbor(String edgeType, String label, double threshold) {
        return new Clause(ClausePattern.OUT_NEIGHBOR, edgeType, label, threshold, Quantifier.AT_LEAST_ONE, null);
    }

    public static Clause inNeighbor(String edgeType, String label, double threshold) {
        return new Clause(ClausePattern.IN_NEIGHBOR, edgeType, label, threshold, Quantifier.AT_LEAST_ONE, null);
    }

    public static Clause outEdge(String edgeType, String label, double threshold) {
        return new Clause(ClausePattern.OUT_EDGE, edgeType, label, threshold, Quantifier.AT_LEAST_ONE, null);
    }

    public static Clause inEdge(String edgeType, String label, double threshold) {
        return new Clause(ClausePattern.IN_EDGE, edgeType, label, threshold, Quantifier.AT_LEAST_ONE, null);
    }

    public static Clause edgeSource(String label, double threshold) {
        return new Clause(ClausePattern.EDGE_SOURCE, null, label, threshold, Quantifier.AT_LEAST_ONE, null);
    }

    public static Clause edgeTarget(String label, double threshold) {
        return new Clause(ClausePattern.EDGE_TARGET, null, label, threshold, Quantifier.AT_LEAST_ONE, null);
    }

    public Clause withQuantifier(Quantifier q) {
        return new Clause(pattern, edgeType, label, threshold, q, weightAttribute);
    }

    public Clause withWeightAttribute(String attribute) {
        return new Clause(pattern, edgeType, label, threshold, quantifier, attribute);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(pattern.name().toLowerCase());
        if (edgeType != null)
            sb.append('[').append(edgeType).append(']');
        sb.append(' ').append(label).append(" >= ").append(threshold);
        if (!quantifier.equals(Quantifier.AT_LEAST_ONE))
            sb.append(" (").append(quantifier).append(')');
        return sb.toString();
    }
}
