package com.legal.reasoner.io;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.function.Function;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.legal.reasoner.api.ConfigException;
import com.legal.reasoner.authority.Alignment;
import com.legal.reasoner.authority.AuthorityTables;
import com.legal.reasoner.authority.CourtLevel;
import com.legal.reasoner.authority.JurisdictionHierarchy;
import com.legal.reasoner.authority.Treatment;
import com.legal.reasoner.engine.EngineConfig;
import com.legal.reasoner.export.RedactionAction;
import com.legal.reasoner.export.RedactionProfile;

import lombok.extern.log4j.Log4j2;

/**
 * Loads and validates {@link ReasonerConfig}.
 *
 * Validation is fail-fast: a missing section, an unknown enum key, a value
 * out of range or an unknown redaction action is a {@link ConfigException}.
 * Nothing is silently defaulted except the optional {@code engine} and
 * {@code metadata_keys} sections.
 */
@Log4j2
public final class ConfigLoader {
    public static final String DEFAULTS_RESOURCE = "reasoner-defaults.json";

    private final ObjectMapper mapper = new ObjectMapper();

    /** The configuration shipped on the classpath. */
    public ReasonerConfig loadDefaults() {
        try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null)
                throw new ConfigException(DEFAULTS_RESOURCE, "Default configuration not found on classpath");
            return load(in);
        } catch (IOException e) {
            throw new ConfigException(DEFAULTS_RESOURCE, "Failed to read default configuration", e);
        }
    }

    public ReasonerConfig load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        }
    }

    public ReasonerConfig load(InputStream in) throws IOException {
        try {
            return compile(mapper.readValue(in, ConfigDefinition.class));
        } catch (JsonProcessingException e) {
            throw new ConfigException("config", "Malformed configuration JSON: " + e.getOriginalMessage(), e);
        }
    }

    public ReasonerConfig parse(String json) {
        try {
            return compile(mapper.readValue(json, ConfigDefinition.class));
        } catch (JsonProcessingException e) {
            throw new ConfigException("config", "Malformed configuration JSON: " + e.getOriginalMessage(), e);
        }
    }

    public ReasonerConfig compile(ConfigDefinition def) {
        if (def == null)
            throw new ConfigException("config", "Configuration is empty");

        AuthorityTables tables = authority(def.getAuthority());
        JurisdictionHierarchy hierarchy = def.getHierarchy() != null
                ? new JurisdictionHierarchy(def.getHierarchy())
                : JurisdictionHierarchy.EMPTY;
        Map<String, RedactionProfile> profiles = profiles(def.getRedactionProfiles());
        Set<String> metadataKeys = def.getMetadataKeys() != null
                ? new TreeSet<>(def.getMetadataKeys())
                : GraphLoader.DEFAULT_METADATA_KEYS;
        EngineConfig engine = engine(def.getEngine());

        log.info("Configuration loaded: profiles={}, jurisdictions={}, parallelism={}", profiles.keySet(),
                hierarchy.parents().size(), engine.parallelism());
        return new ReasonerConfig(tables, hierarchy, profiles, metadataKeys, engine);
    }

    private static AuthorityTables authority(ConfigDefinition.AuthorityDef a) {
        if (a == null)
            throw new ConfigException("authority", "Section is missing");
        ConfigDefinition.RecencyDef r = a.getRecency();
        if (r == null || r.getHalfLifeYears() == null || r.getMinMultiplier() == null)
            throw new ConfigException("authority.recency", "half_life_years and min_multiplier are required");
        return new AuthorityTables(
                table("authority.treatment_modifier", a.getTreatmentModifier(), Treatment.class,
                        Treatment::fromString),
                table("authority.jurisdiction_alignment", a.getJurisdictionAlignment(), Alignment.class,
                        Alignment::fromString),
                table("authority.court_levels", a.getCourtLevels(), CourtLevel.class, CourtLevel::fromString),
                r.getHalfLifeYears(), r.getMinMultiplier());
    }

    private static <E extends Enum<E>> Map<E, Double> table(String name, Map<String, Double> raw, Class<E> type,
            Function<String, E> parser) {
        if (raw == null)
            throw new ConfigException(name, "Table is missing");
        Map<E, Double> out = new EnumMap<>(type);
        for (Map.Entry<String, Double> e : raw.entrySet()) {
            E key = parser.apply(e.getKey());
            if (e.getValue() == null)
                throw new ConfigException(name + "." + e.getKey(), "Table entry has no value");
            if (out.put(key, e.getValue()) != null)
                throw new ConfigException(name + "." + e.getKey(), "Duplicate table entry");
        }
        return out;
    }

    private static Map<String, RedactionProfile> profiles(Map<String, ConfigDefinition.ProfileDef> raw) {
        if (raw == null || raw.isEmpty())
            throw new ConfigException("redaction_profiles", "At least one redaction profile is required");
        Map<String, RedactionProfile> out = new TreeMap<>();
        for (Map.Entry<String, ConfigDefinition.ProfileDef> e : raw.entrySet()) {
            String name = e.getKey();
            ConfigDefinition.ProfileDef p = e.getValue();
            if (p == null)
                throw new ConfigException("redaction_profiles." + name, "Profile is empty");
            Map<String, RedactionAction> fields = new TreeMap<>();
            if (p.getFields() != null)
                for (Map.Entry<String, String> f : p.getFields().entrySet())
                    fields.put(f.getKey(), RedactionAction.fromString(f.getValue()));
            int truncate = p.getTruncateLength() != null ? p.getTruncateLength()
                    : RedactionProfile.DEFAULT_TRUNCATE_LENGTH;
            if (name.equals(RedactionProfile.DEFAULT.name()) && (p.isIncludeDerivations() || p.isIncludeDiagnostics()))
                throw new ConfigException("redaction_profiles." + name, "The default profile must export facts only");
            out.put(name, new RedactionProfile(name, p.isIncludeDerivations(), p.isIncludeDiagnostics(), fields,
                    truncate));
        }
        if (!out.containsKey(RedactionProfile.DEFAULT.name()))
            throw new ConfigException("redaction_profiles." + RedactionProfile.DEFAULT.name(),
                    "A default profile is required");
        return out;
    }

    private static EngineConfig engine(ConfigDefinition.EngineDef e) {
        if (e == null)
            return EngineConfig.DEFAULT;
        int parallelism = e.getParallelism() != null ? e.getParallelism() : 1;
        if (parallelism < 1)
            throw new ConfigException("engine.parallelism", "Must be >= 1, got " + parallelism);
        return new EngineConfig(parallelism, e.isRetainSnapshots(),
                e.getRecordDerivations() == null || e.getRecordDerivations());
    }
}
