package com.legal.reasoner.engine;

import com.legal.reasoner.api.EntityRef;

/**
 * Diagnostic left behind when an aggregation function rejected its premises
 * for one target. The rule did not fire there; the run continued.
 */
public record SkippedFiring(int timestep, String ruleId, EntityRef target, String reason)
        implements Comparable<SkippedFiring> {

    @Override
    public int compareTo(SkippedFiring o) {
        int c = Integer.compare(timestep, o.timestep);
        if (c != 0)
            return c;
        c = ruleId.compareTo(o.ruleId);
        return c != 0 ? c : target.compareTo(o.target);
    }
}
