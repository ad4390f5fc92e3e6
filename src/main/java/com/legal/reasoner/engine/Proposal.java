package com.legal.reasoner.engine;

import java.util.List;

import com.legal.reasoner.api.FactKey;
import com.legal.reasoner.api.FactRef;
import com.legal.reasoner.api.Interval;

/**
 * A weighted rule result proposed for one fact at the next timestep.
 *
 * @param premises  the fact versions the aggregation consumed, sorted.
 * @param setStatic freezes the fact once this proposal is applied.
 */
public record Proposal(FactKey key, Interval interval, String ruleId, boolean supersedes, List<FactRef> premises,
        boolean setStatic) {

    public Proposal {
        premises = List.copyOf(premises);
    }

    public Proposal(FactKey key, Interval interval, String ruleId, boolean supersedes, List<FactRef> premises) {
        this(key, interval, ruleId, supersedes, premises, false);
    }
}
