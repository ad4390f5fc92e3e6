package com.legal.reasoner.api;

/**
 * An aggregation function received missing or out-of-range premises. Local
 * and non-fatal: the engine treats the rule as not firing for that target
 * and timestep and records the reason in the derivation diagnostics.
 */
public class AggregationInputException extends ReasonerException {

    public AggregationInputException(String message) {
        super(message);
    }
}
