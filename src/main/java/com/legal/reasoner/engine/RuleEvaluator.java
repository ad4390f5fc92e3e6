package com.legal.reasoner.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import com.legal.reasoner.api.AggregationInputException;
import com.legal.reasoner.api.EntityRef;
import com.legal.reasoner.api.FactKey;
import com.legal.reasoner.api.FactRef;
import com.legal.reasoner.api.Interval;
import com.legal.reasoner.graph.FactStore;
import com.legal.reasoner.graph.Premise;
import com.legal.reasoner.rule.Clause;
import com.legal.reasoner.rule.Rule;

/**
 * Evaluates one rule against every candidate target at a frozen timestep.
 *
 * Evaluation only reads the store, so any number of evaluators may run
 * against the same timestep concurrently.
 */
final class RuleEvaluator {

    /** Everything one rule produced during one step. */
    record Result(Rule rule, List<Proposal> proposals, List<SkippedFiring> skipped, long durationNanos) {
    }

    private RuleEvaluator() {
    }

    static Result evaluate(Rule rule, FactStore store, int t) {
        long start = System.nanoTime();
        if (!rule.validTime().contains(t))
            return new Result(rule, List.of(), List.of(), System.nanoTime() - start);

        List<Proposal> proposals = new ArrayList<>();
        List<SkippedFiring> skipped = new ArrayList<>();
        for (EntityRef target : store.targets(rule.head())) {
            List<Premise> premises = matchBody(rule, store, target, t);
            if (premises == null)
                continue;

            Optional<Interval> raw;
            try {
                raw = rule.aggregation().aggregate(premises);
            } catch (AggregationInputException e) {
                skipped.add(new SkippedFiring(t, rule.id(), target, e.getMessage()));
                continue;
            }
            if (raw.isEmpty())
                continue;

            Interval scaled = scale(raw.get(), rule.aggregation().floor(), rule.weight());
            List<FactRef> refs = new ArrayList<>(premises.size());
            for (Premise p : premises)
                refs.add(p.source());
            proposals.add(new Proposal(new FactKey(target, rule.head().label()), scaled, rule.id(),
                    rule.supersedes(), refs, rule.setStatic()));
        }
        return new Result(rule, proposals, skipped, System.nanoTime() - start);
    }

    /**
     * Premises of every clause that met its threshold, sorted by source, or null
     * if some clause's quantifier is not satisfied.
     */
    private static List<Premise> matchBody(Rule rule, FactStore store, EntityRef target, int t) {
        List<Premise> all = new ArrayList<>();
        for (Clause clause : rule.body()) {
            List<Premise> candidates = store.matchClause(target, clause, t);
            int satisfied = 0;
            for (Premise p : candidates) {
                if (p.interval().lower() >= clause.threshold()) {
                    all.add(p);
                    satisfied++;
                }
            }
            if (!clause.quantifier().isSatisfied(satisfied, candidates.size()))
                return null;
        }
        Collections.sort(all);
        return all;
    }

    /**
     * Scales a raw aggregation result by the rule weight: the lower bound moves
     * toward the function's floor in proportion to {@code 1 - weight}, and the
     * width is kept.
     */
    static Interval scale(Interval raw, double floor, double weight) {
        if (weight == 1.0)
            return raw;
        double lower = floor + weight * (raw.lower() - floor);
        double upper = lower + raw.width();
        lower = Math.max(0.0, Math.min(1.0, lower));
        upper = Math.max(lower, Math.min(1.0, upper));
        return new Interval(lower, upper);
    }
}
