package com.legal.reasoner.rule;

import java.util.ArrayList;
import java.util.List;

import com.legal.reasoner.fn.AggregationFn;

/**
 * An immutable weighted inference rule.
 *
 * A rule fires for a candidate target at timestep {@code t} when its
 * valid-time window contains {@code t}, every body clause is satisfied, and
 * its aggregation function yields an interval. The weighted result is then
 * proposed for {@code (target, head.label)} at {@code t+1}.
 *
 * @param supersedes when true the rule's result replaces the existing fact
 *                   instead of narrowing it.
 * @param setStatic  when true the fact this rule derives is frozen once the
 *                   rule's result is applied; later proposals for it are
 *                   ignored.
 */
public record Rule(String id, RuleHead head, List<Clause> body, AggregationFn aggregation, double weight,
        ValidTime validTime, boolean supersedes, boolean setStatic) {

    public Rule {
        body = body == null ? List.of() : List.copyOf(body);
        if (validTime == null)
            validTime = ValidTime.ALWAYS;
    }

    /** Returns a copy of this rule with a different weight. */
    public Rule withWeight(double w) {
        return new Rule(id, head, body, aggregation, w, validTime, supersedes, setStatic);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    @Override
    public String toString() {
        return id + ": " + head.label() + "(" + head.kind().name().toLowerCase() + ") <- " + body
                + " ; " + aggregation + " w=" + weight + (setStatic ? " static" : "");
    }

    /** Fluent builder; validation happens when the engine starts. */
    public static final class Builder {
        private final String id;
        private RuleHead head;
        private final List<Clause> body = new ArrayList<>();
        private AggregationFn aggregation;
        private double weight = 1.0;
        private ValidTime validTime = ValidTime.ALWAYS;
        private boolean supersedes;
        private boolean setStatic;

        private Builder(String id) {
            this.id = id;
        }

        public Builder derivesOnNode(String label) {
            this.head = RuleHead.node(label);
            return this;
        }

        public Builder derivesOnEdge(String label, String edgeType) {
            this.head = RuleHead.edge(label, edgeType);
            return this;
        }

        public Builder head(RuleHead head) {
            this.head = head;
            return this;
        }

        public Builder when(Clause clause) {
            body.add(clause);
            return this;
        }

        public Builder aggregate(AggregationFn fn) {
            this.aggregation = fn;
            return this;
        }

        public Builder weight(double w) {
            this.weight = w;
            return this;
        }

        public Builder validBetween(int from, int to) {
            this.validTime = new ValidTime(from, to);
            return this;
        }

        public Builder supersedes(boolean s) {
            this.supersedes = s;
            return this;
        }

        public Builder setStatic(boolean s) {
            this.setStatic = s;
            return this;
        }

        public Rule build() {
            return new Rule(id, head, body, aggregation, weight, validTime, supersedes, setStatic);
        }
    }
}
