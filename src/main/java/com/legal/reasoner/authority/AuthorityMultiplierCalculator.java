package com.legal.reasoner.authority;

import java.util.Objects;

import com.legal.reasoner.rule.Rule;

/**
 * Turns citation signals into a multiplier in [0, 1] that scales a rule's
 * weight before the engine runs.
 *
 * <pre>
 * multiplier = treatment * recency * alignment * courtLevel
 * recency    = max(minMultiplier, 2^(-ageYears / halfLifeYears))
 * </pre>
 *
 * Pure: everything it needs comes through the constructor, and it knows
 * nothing about graphs, facts or the engine.
 */
public final class AuthorityMultiplierCalculator {
    private final AuthorityTables tables;
    private final JurisdictionHierarchy hierarchy;

    public AuthorityMultiplierCalculator(AuthorityTables tables, JurisdictionHierarchy hierarchy) {
        this.tables = Objects.requireNonNull(tables, "tables");
        this.hierarchy = Objects.requireNonNull(hierarchy, "hierarchy");
    }

    public double compute(CitationSignals s) {
        double m = tables.treatmentModifier(s.treatment())
                * recency(s.ageYears())
                * tables.alignmentFactor(hierarchy.alignment(s.sourceJurisdiction(), s.targetJurisdiction()))
                * tables.courtLevelWeight(s.courtLevel());
        return Math.max(0.0, Math.min(1.0, m));
    }

    /** Half-life decay, floored at the configured minimum. */
    public double recency(double ageYears) {
        double decay = Math.exp(-Math.log(2.0) * (Math.max(0.0, ageYears) / tables.halfLifeYears()));
        return Math.max(tables.minRecencyMultiplier(), decay);
    }

    public Alignment alignment(String source, String target) {
        return hierarchy.alignment(source, target);
    }

    /** Returns the rule with its weight multiplied by the citation's multiplier. */
    public Rule scale(Rule rule, CitationSignals s) {
        return rule.withWeight(rule.weight() * compute(s));
    }

    public AuthorityTables tables() {
        return tables;
    }

    public JurisdictionHierarchy hierarchy() {
        return hierarchy;
    }
}
