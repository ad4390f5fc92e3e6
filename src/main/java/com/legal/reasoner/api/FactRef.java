package com.legal.reasoner.api;

/**
 * One version of a fact: the value of {@code key} as it stood at
 * {@code timestep}. Provenance links point at fact references, never at
 * record objects.
 */
public record FactRef(FactKey key, int timestep) implements Comparable<FactRef> {

    @Override
    public int compareTo(FactRef o) {
        int c = key.compareTo(o.key);
        return c != 0 ? c : Integer.compare(timestep, o.timestep);
    }

    @Override
    public String toString() {
        return key.statement() + "@" + timestep;
    }
}
