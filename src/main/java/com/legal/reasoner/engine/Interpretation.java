package com.legal.reasoner.engine;

import java.util.*;

import com.legal.reasoner.api.ConvergenceStatus;
import com.legal.reasoner.api.EntityRef;
import com.legal.reasoner.api.FactKey;
import com.legal.reasoner.api.Interval;
import com.legal.reasoner.api.NodeRef;

/**
 * The terminal result of a run: the complete fact assignment at the final
 * timestep, how the run ended, and (optionally) how every fact came to be.
 *
 * Immutable. The derivation log is handed over by the engine at the end of
 * the run and never appended to again.
 */
public final class Interpretation {
    private final SortedMap<FactKey, Interval> facts;
    private final int timestep;
    private final ConvergenceStatus status;
    private final int steps;
    private final DerivationLog derivations;
    private final List<SkippedFiring> diagnostics;
    private final List<SortedMap<FactKey, Interval>> history;

    Interpretation(SortedMap<FactKey, Interval> facts, int timestep, ConvergenceStatus status, int steps,
            DerivationLog derivations, List<SkippedFiring> diagnostics, List<SortedMap<FactKey, Interval>> history) {
        this.facts = Collections.unmodifiableSortedMap(new TreeMap<>(facts));
        this.timestep = timestep;
        this.status = status;
        this.steps = steps;
        this.derivations = derivations;
        this.diagnostics = List.copyOf(diagnostics);
        this.history = List.copyOf(history);
    }

    /** Fact assignment at {@link #timestep()}, sorted by key. */
    public SortedMap<FactKey, Interval> facts() {
        return facts;
    }

    public Optional<Interval> get(FactKey key) {
        return Optional.ofNullable(facts.get(key));
    }

    public Optional<Interval> get(EntityRef entity, String label) {
        return get(new FactKey(entity, label));
    }

    /** Shorthand for a node fact. */
    public Optional<Interval> node(String nodeId, String label) {
        return get(new NodeRef(nodeId), label);
    }

    public int timestep() {
        return timestep;
    }

    public ConvergenceStatus status() {
        return status;
    }

    public boolean isConverged() {
        return status == ConvergenceStatus.CONVERGED;
    }

    /** Number of steps executed. */
    public int steps() {
        return steps;
    }

    public DerivationLog derivations() {
        return derivations;
    }

    /** Rule firings rejected by their aggregation function, in step then rule order. */
    public List<SkippedFiring> diagnostics() {
        return diagnostics;
    }

    /**
     * Per-timestep fact assignments, index = timestep, when the engine was
     * configured to retain them; otherwise empty.
     */
    public List<SortedMap<FactKey, Interval>> history() {
        return history;
    }

    /**
     * The assignment as initial facts for a follow-up run.
     */
    public Map<FactKey, Interval> toInitialFacts() {
        return new TreeMap<>(facts);
    }

    @Override
    public String toString() {
        return "Interpretation[" + status + ", t=" + timestep + ", facts=" + facts.size() + ", derivations="
                + derivations.size() + "]";
    }
}
