package com.legal.reasoner.authority;

import java.time.Duration;

/**
 * Everything known about one citation that bears on its authority.
 *
 * @param age                time elapsed since the cited decision.
 * @param sourceJurisdiction jurisdiction of the citing decision, may be blank.
 * @param targetJurisdiction jurisdiction of the cited decision, may be blank.
 */
public record CitationSignals(Treatment treatment, Duration age, String sourceJurisdiction,
        String targetJurisdiction, CourtLevel courtLevel) {

    public CitationSignals {
        if (treatment == null || courtLevel == null)
            throw new IllegalArgumentException("Treatment and court level are required");
        if (age == null || age.isNegative())
            throw new IllegalArgumentException("Citation age must be non-negative, got " + age);
    }

    /** Age expressed in (Julian) years. */
    public double ageYears() {
        return age.toSeconds() / (365.25 * 86_400.0);
    }

    public static CitationSignals of(Treatment treatment, int ageYears, String source, String target,
            CourtLevel level) {
        return new CitationSignals(treatment, Duration.ofSeconds(Math.round(ageYears * 365.25 * 86_400.0)), source,
                target, level);
    }
}
