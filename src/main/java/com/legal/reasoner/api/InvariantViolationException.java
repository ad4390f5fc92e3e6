package com.legal.reasoner.api;

/**
 * An update would widen a fact, or rewrite history, outside the monotonic
 * narrowing policy. This is a rule-authoring defect: the run stops
 * deterministically so it can be reproduced.
 */
public class InvariantViolationException extends ReasonerException {
    private final FactKey fact;
    private final int timestep;

    public InvariantViolationException(FactKey fact, int timestep, String message) {
        super("Invariant violation on " + fact + " at t=" + timestep + ": " + message);
        this.fact = fact;
        this.timestep = timestep;
    }

    public FactKey fact() {
        return fact;
    }

    public int timestep() {
        return timestep;
    }
}
