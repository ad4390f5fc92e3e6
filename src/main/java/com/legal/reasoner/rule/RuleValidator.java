package com.legal.reasoner.rule;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.legal.reasoner.api.ConfigException;
import com.legal.reasoner.api.TargetKind;

/**
 * Fail-fast structural validation of a rule set, run before any evaluation.
 */
public final class RuleValidator {

    private RuleValidator() {
    }

    /**
     * @throws ConfigException on the first malformed rule.
     */
    public static void validate(List<Rule> rules) {
        if (rules == null)
            throw new ConfigException("Rule set is null");
        Set<String> ids = new HashSet<>();
        for (Rule r : rules) {
            if (r == null)
                throw new ConfigException("Rule set contains a null rule");
            validate(r);
            if (!ids.add(r.id()))
                throw new ConfigException(r.id(), "Duplicate rule id");
        }
    }

    public static void validate(Rule r) {
        String id = r.id();
        if (id == null || id.isBlank())
            throw new ConfigException("Rule id must not be blank");
        if (r.head() == null || r.head().label() == null || r.head().label().isBlank())
            throw new ConfigException(id, "Rule head label is missing");
        if (r.head().kind() == null)
            throw new ConfigException(id, "Rule head target kind is missing");
        if (r.head().kind() == TargetKind.NODE && r.head().edgeType() != null)
            throw new ConfigException(id, "Node-headed rule must not name an edge type");
        if (r.aggregation() == null)
            throw new ConfigException(id, "Rule has no aggregation function");
        if (!Double.isFinite(r.weight()) || r.weight() < 0.0 || r.weight() > 1.0)
            throw new ConfigException(id, "Rule weight must be within [0,1], got " + r.weight());
        if (!r.validTime().isWellFormed())
            throw new ConfigException(id, "Malformed valid-time window " + r.validTime());
        if (r.body().isEmpty())
            throw new ConfigException(id, "Rule body is empty");

        for (int i = 0; i < r.body().size(); i++)
            validateClause(id, i, r.head().kind(), r.body().get(i));
    }

    private static void validateClause(String ruleId, int index, TargetKind headKind, Clause c) {
        String where = "clause " + index;
        if (c == null)
            throw new ConfigException(ruleId, where + " is null");
        if (c.pattern() == null)
            throw new ConfigException(ruleId, where + " has no pattern");
        if (c.label() == null || c.label().isBlank())
            throw new ConfigException(ruleId, where + " has no label");
        if (!Double.isFinite(c.threshold()) || c.threshold() < 0.0 || c.threshold() > 1.0)
            throw new ConfigException(ruleId, where + " threshold must be within [0,1], got " + c.threshold());
        if (!c.pattern().appliesTo(headKind))
            throw new ConfigException(ruleId, where + " pattern " + c.pattern() + " cannot match from a "
                    + headKind.name().toLowerCase() + " target");
        if (c.pattern().needsEdgeType() && (c.edgeType() == null || c.edgeType().isBlank()))
            throw new ConfigException(ruleId, where + " pattern " + c.pattern() + " requires an edge type");
        if (!c.pattern().needsEdgeType() && c.edgeType() != null)
            throw new ConfigException(ruleId, where + " pattern " + c.pattern() + " does not take an edge type");
        Quantifier q = c.quantifier();
        if (!Double.isFinite(q.value()) || q.value() <= 0.0
                || (q.mode() == Quantifier.Mode.PERCENT && q.value() > 100.0))
            throw new ConfigException(ruleId, where + " has invalid quantifier " + q);
        if (c.weightAttribute() != null && c.weightAttribute().isBlank())
            throw new ConfigException(ruleId, where + " has a blank weight attribute");
    }
}
