package com.legal.reasoner.graph;

import com.legal.reasoner.api.FactRef;
import com.legal.reasoner.api.Interval;

/**
 * A fact matched by a clause: which fact version it is, its interval, and the
 * precedent weight annotated on the entity carrying it (null when the clause
 * names no weight attribute or the entity does not carry one).
 */
public record Premise(FactRef source, Interval interval, Double weight) implements Comparable<Premise> {

    public Premise {
        if (source == null || interval == null)
            throw new IllegalArgumentException("Premise source and interval are required");
    }

    public Premise(FactRef source, Interval interval) {
        this(source, interval, null);
    }

    @Override
    public int compareTo(Premise o) {
        return source.compareTo(o.source);
    }
}
