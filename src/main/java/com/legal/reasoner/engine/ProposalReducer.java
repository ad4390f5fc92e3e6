package com.legal.reasoner.engine;

import java.util.Collection;
import java.util.Comparator;
import java.util.SortedMap;
import java.util.TreeMap;

import com.legal.reasoner.api.FactKey;

/**
 * Conflict resolution between proposals for the same fact.
 *
 * The winner is the most conservative proposal: narrowest interval, then
 * lowest upper bound, then lowest lower bound, then smallest rule id. This is
 * a total order, so picking its minimum is commutative and associative and the
 * outcome does not depend on the order rules were evaluated in.
 */
public final class ProposalReducer {

    public static final Comparator<Proposal> MOST_CONSERVATIVE = Comparator
            .comparing(Proposal::interval)
            .thenComparing(Proposal::ruleId);

    private ProposalReducer() {
    }

    /** The more conservative of two proposals for the same fact. */
    public static Proposal pick(Proposal a, Proposal b) {
        if (!a.key().equals(b.key()))
            throw new IllegalArgumentException("Proposals target different facts: " + a.key() + ", " + b.key());
        return MOST_CONSERVATIVE.compare(a, b) <= 0 ? a : b;
    }

    /**
     * Reduces all proposals of one step to a single winner per fact.
     *
     * @return winners keyed and sorted by fact.
     */
    public static SortedMap<FactKey, Proposal> reduce(Collection<Proposal> proposals) {
        SortedMap<FactKey, Proposal> winners = new TreeMap<>();
        for (Proposal p : proposals)
            winners.merge(p.key(), p, ProposalReducer::pick);
        return winners;
    }
}
