package com.legal.reasoner.authority;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import com.legal.reasoner.api.ConfigException;

/**
 * The numeric tables behind {@link AuthorityMultiplierCalculator}.
 *
 * Every table must cover every key of its enum. A missing or out-of-range
 * entry is rejected at construction time; nothing is defaulted.
 */
public final class AuthorityTables {
    private final Map<Treatment, Double> treatmentModifiers;
    private final Map<Alignment, Double> alignmentFactors;
    private final Map<CourtLevel, Double> courtLevelWeights;
    private final double halfLifeYears;
    private final double minRecencyMultiplier;

    public AuthorityTables(Map<Treatment, Double> treatmentModifiers, Map<Alignment, Double> alignmentFactors,
            Map<CourtLevel, Double> courtLevelWeights, double halfLifeYears, double minRecencyMultiplier) {
        this.treatmentModifiers = complete("treatment_modifier", Treatment.class, treatmentModifiers);
        this.alignmentFactors = complete("jurisdiction_alignment", Alignment.class, alignmentFactors);
        this.courtLevelWeights = complete("court_levels", CourtLevel.class, courtLevelWeights);
        if (!Double.isFinite(halfLifeYears) || halfLifeYears <= 0.0)
            throw new ConfigException("recency.half_life_years", "Half-life must be > 0, got " + halfLifeYears);
        if (!Double.isFinite(minRecencyMultiplier) || minRecencyMultiplier < 0.0 || minRecencyMultiplier > 1.0)
            throw new ConfigException("recency.min_multiplier",
                    "Minimum multiplier must be within [0,1], got " + minRecencyMultiplier);
        this.halfLifeYears = halfLifeYears;
        this.minRecencyMultiplier = minRecencyMultiplier;
    }

    /**
     * Stock tables: half-life 10 years floored at 0.5, alignment
     * 1.0/0.9/0.85/0.75, highest court 1.0 down to trial court 0.78.
     */
    public static AuthorityTables defaults() {
        Map<Treatment, Double> t = new EnumMap<>(Treatment.class);
        t.put(Treatment.FOLLOWED, 1.0);
        t.put(Treatment.AFFIRMED, 1.0);
        t.put(Treatment.NEUTRAL, 1.0);
        t.put(Treatment.DISTINGUISHED, 0.85);
        t.put(Treatment.QUESTIONED, 0.7);
        t.put(Treatment.LIMITED, 0.65);
        t.put(Treatment.CRITICIZED, 0.6);
        t.put(Treatment.OVERRULED, 0.1);

        Map<Alignment, Double> a = new EnumMap<>(Alignment.class);
        a.put(Alignment.EXACT, 1.0);
        a.put(Alignment.ANCESTOR, 0.9);
        a.put(Alignment.SIBLING, 0.85);
        a.put(Alignment.FOREIGN, 0.75);

        Map<CourtLevel, Double> c = new EnumMap<>(CourtLevel.class);
        c.put(CourtLevel.HIGHEST, 1.0);
        c.put(CourtLevel.INTERMEDIATE_APPELLATE, 0.9);
        c.put(CourtLevel.TRIAL, 0.78);
        c.put(CourtLevel.ADMINISTRATIVE, 0.7);

        return new AuthorityTables(t, a, c, 10.0, 0.5);
    }

    private static <E extends Enum<E>> Map<E, Double> complete(String table, Class<E> type, Map<E, Double> in) {
        if (in == null)
            throw new ConfigException(table, "Table is missing");
        Map<E, Double> out = new EnumMap<>(type);
        for (E k : type.getEnumConstants()) {
            Double v = in.get(k);
            if (v == null)
                throw new ConfigException(table + "." + k.name().toLowerCase(), "Table entry is missing");
            if (!Double.isFinite(v) || v < 0.0 || v > 1.0)
                throw new ConfigException(table + "." + k.name().toLowerCase(),
                        "Table entry must be within [0,1], got " + v);
            out.put(k, v);
        }
        return Collections.unmodifiableMap(out);
    }

    public double treatmentModifier(Treatment t) {
        return treatmentModifiers.get(t);
    }

    public double alignmentFactor(Alignment a) {
        return alignmentFactors.get(a);
    }

    public double courtLevelWeight(CourtLevel c) {
        return courtLevelWeights.get(c);
    }

    public double halfLifeYears() {
        return halfLifeYears;
    }

    public double minRecencyMultiplier() {
        return minRecencyMultiplier;
    }

    public Map<Treatment, Double> treatmentModifiers() {
        return treatmentModifiers;
    }

    public Map<Alignment, Double> alignmentFactors() {
        return alignmentFactors;
    }

    public Map<CourtLevel, Double> courtLevelWeights() {
        return courtLevelWeights;
    }
}
