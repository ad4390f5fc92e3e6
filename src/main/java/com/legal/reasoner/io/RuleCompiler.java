package com.legal.reasoner.io;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.legal.reasoner.api.ConfigException;
import com.legal.reasoner.api.TargetKind;
import com.legal.reasoner.fn.AggregationFn;
import com.legal.reasoner.rule.Clause;
import com.legal.reasoner.rule.ClausePattern;
import com.legal.reasoner.rule.Quantifier;
import com.legal.reasoner.rule.Rule;
import com.legal.reasoner.rule.RuleHead;
import com.legal.reasoner.rule.RuleValidator;
import com.legal.reasoner.rule.ValidTime;

import lombok.extern.log4j.Log4j2;

/**
 * Compiles a JSON {@link RuleSetDefinition} into validated {@link Rule}s.
 */
@Log4j2
public final class RuleCompiler {
    private final ObjectMapper mapper = new ObjectMapper();

    public List<Rule> load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        }
    }

    public List<Rule> load(InputStream in) throws IOException {
        try {
            return compile(mapper.readValue(in, RuleSetDefinition.class));
        } catch (JsonProcessingException e) {
            throw new ConfigException("rules", "Malformed rule set JSON: " + e.getOriginalMessage(), e);
        }
    }

    public List<Rule> parse(String json) {
        try {
            return compile(mapper.readValue(json, RuleSetDefinition.class));
        } catch (JsonProcessingException e) {
            throw new ConfigException("rules", "Malformed rule set JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * @throws ConfigException on an unknown aggregation id, clause pattern,
     *                         quantifier or target kind, or any rule the
     *                         validator rejects.
     */
    public List<Rule> compile(RuleSetDefinition def) {
        if (def == null || def.getRules() == null)
            throw new ConfigException("rules", "Missing 'rules' key");
        List<Rule> rules = new ArrayList<>(def.getRules().size());
        for (RuleSetDefinition.RuleDef rd : def.getRules())
            rules.add(compileRule(rd));
        RuleValidator.validate(rules);
        log.info("Compiled rule set '{}': {} rules", def.getName(), rules.size());
        return rules;
    }

    static Rule compileRule(RuleSetDefinition.RuleDef rd) {
        if (rd == null)
            throw new ConfigException("rules", "Null rule definition");
        String id = rd.getId();
        if (rd.getHead() == null)
            throw new ConfigException(id, "Rule has no head");

        RuleHead head = new RuleHead(rd.getHead().getLabel(), parseKind(id, rd.getHead().getKind()),
                rd.getHead().getEdgeType());
        if (rd.getAggregation() == null)
            throw new ConfigException(id, "Rule has no aggregation function");

        List<Clause> body = new ArrayList<>();
        if (rd.getBody() != null) {
            for (RuleSetDefinition.ClauseDef cd : rd.getBody()) {
                if (cd == null)
                    throw new ConfigException(id, "Null clause");
                body.add(new Clause(ClausePattern.fromString(cd.getPattern()), cd.getEdgeType(), cd.getLabel(),
                        cd.getThreshold() != null ? cd.getThreshold() : 0.0,
                        Quantifier.parse(cd.getQuantifier()), cd.getWeightAttribute()));
            }
        }

        ValidTime vt = ValidTime.ALWAYS;
        if (rd.getValidTime() != null) {
            RuleSetDefinition.ValidTimeDef v = rd.getValidTime();
            vt = new ValidTime(v.getFrom(), v.getTo() != null ? v.getTo() : Integer.MAX_VALUE);
        }

        return new Rule(id, head, body, AggregationFn.fromId(rd.getAggregation()),
                rd.getWeight() != null ? rd.getWeight() : 1.0, vt, rd.isSupersedes(),
                rd.isSetStatic());
    }

    private static TargetKind parseKind(String ruleId, String kind) {
        if (kind == null)
            return TargetKind.NODE;
        try {
            return TargetKind.fromString(kind);
        } catch (IllegalArgumentException e) {
            throw new ConfigException(ruleId, "Unknown target kind '" + kind + "'", e);
        }
    }
}
