package com.legal.reasoner.export;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.*;
import java.util.function.UnaryOperator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.legal.reasoner.api.FactKey;
import com.legal.reasoner.api.FactRef;
import com.legal.reasoner.api.Interval;
import com.legal.reasoner.api.ProfileNotFoundException;
import com.legal.reasoner.api.ReasonerException;
import com.legal.reasoner.engine.DerivationRecord;
import com.legal.reasoner.engine.Interpretation;
import com.legal.reasoner.engine.SkippedFiring;

/**
 * Serializes a terminal {@link Interpretation} to JSON under a named
 * {@link RedactionProfile}.
 *
 * <p>
 * Output is deterministic: object keys are sorted, facts are emitted in fact
 * key order, derivations in record order and diagnostics in step then rule
 * order. The same Interpretation always exports to the same bytes.
 *
 * <p>
 * Sections a profile does not include are absent from the document, not
 * emitted empty.
 */
public final class InterpretationExporter {
    private final Map<String, RedactionProfile> profiles;
    private final ObjectMapper mapper;

    public InterpretationExporter(Map<String, RedactionProfile> profiles) {
        this.profiles = Collections.unmodifiableMap(new TreeMap<>(profiles));
        this.mapper = new ObjectMapper()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    }

    /** Exporter knowing only the built-in {@code default} and {@code audit} profiles. */
    public static InterpretationExporter withBuiltins() {
        Map<String, RedactionProfile> p = new TreeMap<>();
        p.put(RedactionProfile.DEFAULT.name(), RedactionProfile.DEFAULT);
        p.put(RedactionProfile.AUDIT.name(), RedactionProfile.AUDIT);
        return new InterpretationExporter(p);
    }

    public Set<String> profileNames() {
        return profiles.keySet();
    }

    /**
     * @throws ProfileNotFoundException if no profile has that name; nothing is
     *                                  emitted.
     */
    public String export(Interpretation interpretation, String profileName) {
        RedactionProfile profile = profiles.get(profileName);
        if (profile == null)
            throw new ProfileNotFoundException(profileName);
        try {
            return mapper.writeValueAsString(toDocument(interpretation, profile));
        } catch (JsonProcessingException e) {
            throw new ReasonerException("Failed to serialize interpretation under profile " + profileName, e);
        }
    }

    /** The export document as plain maps and lists, before serialization. */
    Map<String, Object> toDocument(Interpretation in, RedactionProfile profile) {
        Map<String, Object> doc = new TreeMap<>();
        doc.put("profile", profile.name());
        doc.put("status", in.status().name());
        doc.put("timestep", in.timestep());

        List<Object> facts = new ArrayList<>(in.facts().size());
        for (Map.Entry<FactKey, Interval> e : in.facts().entrySet()) {
            FactKey k = e.getKey();
            Map<String, Object> f = new TreeMap<>();
            put(f, profile, "facts", "statement", k.statement());
            put(f, profile, "facts", "entity", k.entity().id());
            put(f, profile, "facts", "kind", k.entity().kind().name().toLowerCase());
            put(f, profile, "facts", "label", k.label());
            put(f, profile, "facts", "lower", e.getValue().lower());
            put(f, profile, "facts", "upper", e.getValue().upper());
            facts.add(f);
        }
        doc.put("facts", facts);

        if (profile.includeDerivations()) {
            List<Object> derivations = new ArrayList<>(in.derivations().size());
            for (DerivationRecord r : in.derivations().records()) {
                Map<String, Object> d = new TreeMap<>();
                put(d, profile, "derivations", "id", r.id());
                put(d, profile, "derivations", "statement", r.fact().statement());
                put(d, profile, "derivations", "timestep", r.timestep());
                put(d, profile, "derivations", "ruleId", r.ruleId());
                put(d, profile, "derivations", "lower", r.interval().lower());
                put(d, profile, "derivations", "upper", r.interval().upper());
                if (r.previous() != null) {
                    put(d, profile, "derivations", "previousLower", r.previous().lower());
                    put(d, profile, "derivations", "previousUpper", r.previous().upper());
                }
                List<String> premises = new ArrayList<>(r.premises().size());
                for (FactRef p : r.premises())
                    premises.add(p.toString());
                put(d, profile, "derivations", "premises", premises);
                derivations.add(d);
            }
            doc.put("derivations", derivations);
        }

        if (profile.includeDiagnostics()) {
            List<Object> diagnostics = new ArrayList<>(in.diagnostics().size());
            for (SkippedFiring s : in.diagnostics()) {
                Map<String, Object> d = new TreeMap<>();
                put(d, profile, "diagnostics", "timestep", s.timestep());
                put(d, profile, "diagnostics", "ruleId", s.ruleId());
                put(d, profile, "diagnostics", "target", s.target().id());
                put(d, profile, "diagnostics", "reason", s.reason());
                diagnostics.add(d);
            }
            doc.put("diagnostics", diagnostics);
        }
        return doc;
    }

    private static void put(Map<String, Object> out, RedactionProfile profile, String section, String field,
            Object value) {
        RedactionAction action = profile.actionFor(section + "." + field);
        if (action == null) {
            out.put(field, value);
            return;
        }
        switch (action) {
            case DROP -> {
            }
            case HASH -> out.put(field, redact(value, InterpretationExporter::sha256Hex));
            case TRUNCATE -> out.put(field, redact(value, v -> truncate(v, profile.truncateLength())));
        }
    }

    /** Applies a string redaction to a scalar, or element-wise to a list. */
    private static Object redact(Object value, UnaryOperator<String> fn) {
        if (value instanceof List<?> list) {
            List<String> out = new ArrayList<>(list.size());
            for (Object o : list)
                out.add(fn.apply(String.valueOf(o)));
            return out;
        }
        return fn.apply(String.valueOf(value));
    }

    static String truncate(String s, int length) {
        return s.length() <= length ? s : s.substring(0, length);
    }

    /** Lower-case hex SHA-256 of the UTF-8 bytes of {@code s}. */
    public static String sha256Hex(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(s.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
