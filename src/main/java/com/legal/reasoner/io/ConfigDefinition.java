package com.legal.reasoner.io;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import lombok.Data;

/**
 * POJO representation of the reasoner configuration file. Keys are
 * snake_case in JSON.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public final class ConfigDefinition {
    private AuthorityDef authority;
    private Map<String, List<String>> hierarchy;
    private Map<String, ProfileDef> redactionProfiles;
    private List<String> metadataKeys;
    private EngineDef engine;

    /** Authority-multiplier tables, keyed by lower-case enum names. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static final class AuthorityDef {
        private Map<String, Double> treatmentModifier;
        private Map<String, Double> jurisdictionAlignment;
        private Map<String, Double> courtLevels;
        private RecencyDef recency;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static final class RecencyDef {
        private Double halfLifeYears;
        private Double minMultiplier;
    }

    /** A redaction profile: sections plus field path to action. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static final class ProfileDef {
        private boolean includeDerivations;
        private boolean includeDiagnostics;
        private Integer truncateLength;
        private Map<String, String> fields;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static final class EngineDef {
        private Integer parallelism;
        private boolean retainSnapshots;
        private Boolean recordDerivations;
    }
}
