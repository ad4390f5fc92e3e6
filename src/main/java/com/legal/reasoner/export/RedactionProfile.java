package com.legal.reasoner.export;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import com.legal.reasoner.api.ConfigException;

/**
 * A named export policy: which sections are emitted and how individual
 * fields are redacted.
 *
 * Field paths are dotted, section first, e.g. {@code facts.entity} or
 * {@code derivations.premises}. Only paths listed in {@link #FIELD_PATHS} are
 * accepted.
 */
public record RedactionProfile(String name, boolean includeDerivations, boolean includeDiagnostics,
        Map<String, RedactionAction> fields, int truncateLength) {

    public static final Set<String> FIELD_PATHS = Set.of(
            "facts.statement", "facts.entity", "facts.kind", "facts.label", "facts.lower", "facts.upper",
            "derivations.id", "derivations.statement", "derivations.timestep", "derivations.ruleId",
            "derivations.lower", "derivations.upper", "derivations.previousLower", "derivations.previousUpper",
            "derivations.premises",
            "diagnostics.timestep", "diagnostics.ruleId", "diagnostics.target", "diagnostics.reason");

    public static final int DEFAULT_TRUNCATE_LENGTH = 8;

    /** Facts only. */
    public static final RedactionProfile DEFAULT = new RedactionProfile("default", false, false, Map.of(),
            DEFAULT_TRUNCATE_LENGTH);

    /** Facts, derivations and diagnostics, unredacted. */
    public static final RedactionProfile AUDIT = new RedactionProfile("audit", true, true, Map.of(),
            DEFAULT_TRUNCATE_LENGTH);

    public RedactionProfile {
        if (name == null || name.isBlank())
            throw new ConfigException("Redaction profile name is blank");
        if (truncateLength < 1)
            throw new ConfigException(name, "truncate_length must be >= 1, got " + truncateLength);
        Map<String, RedactionAction> copy = new TreeMap<>();
        if (fields != null) {
            for (Map.Entry<String, RedactionAction> e : fields.entrySet()) {
                if (!FIELD_PATHS.contains(e.getKey()))
                    throw new ConfigException(name + "." + e.getKey(), "Unknown field path in redaction profile");
                if (e.getValue() == null)
                    throw new ConfigException(name + "." + e.getKey(), "Redaction action is missing");
                copy.put(e.getKey(), e.getValue());
            }
        }
        fields = Collections.unmodifiableMap(copy);
    }

    /** Action for a field path, or null to emit it as is. */
    public RedactionAction actionFor(String path) {
        return fields.get(path);
    }
}
