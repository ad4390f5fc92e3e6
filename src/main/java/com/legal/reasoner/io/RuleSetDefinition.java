package com.legal.reasoner.io;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of a JSON rule set.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class RuleSetDefinition {
    private String name;
    private List<RuleDef> rules;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class RuleDef {
        private String id, aggregation;
        private HeadDef head;
        private List<ClauseDef> body;
        private Double weight;
        private ValidTimeDef validTime;
        private boolean supersedes;
        private boolean setStatic;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class HeadDef {
        private String label, kind, edgeType;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class ClauseDef {
        private String pattern, edgeType, label, quantifier, weightAttribute;
        private Double threshold;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ValidTimeDef {
        private int from;
        private Integer to;
    }
}
