package com.legal.reasoner.fn;

import java.util.List;
import java.util.Optional;

import com.legal.reasoner.api.AggregationInputException;
import com.legal.reasoner.api.ConfigException;
import com.legal.reasoner.api.Interval;
import com.legal.reasoner.graph.Premise;

/**
 * The closed catalogue of annotation functions that map a rule's matched
 * premises to the confidence interval of the derived fact.
 *
 * Every constant carries its rule-facing identifier, the confidence floor it
 * guarantees (used when scaling by rule weight) and a pure kernel. Kernels
 * return null when the rule legitimately does not fire (e.g. a burden of proof
 * that the evidence cannot meet) and throw {@link AggregationInputException}
 * when their input is unusable.
 *
 * Premises arrive sorted by fact reference, so floating-point sums are
 * accumulated in the same order on every run.
 */
public enum AggregationFn {

    // --- Burden of proof ---
    LEGAL_BURDEN_CIVIL_051("legal_burden_civil_051", 0.51, p -> burden(p, 0.51)),
    LEGAL_BURDEN_CLEAR_075("legal_burden_clear_075", 0.75, p -> burden(p, 0.75)),
    LEGAL_BURDEN_CRIMINAL_090("legal_burden_criminal_090", 0.90, p -> burden(p, 0.90)),

    // --- Conservative and precedent-weighted ---
    LEGAL_CONSERVATIVE_MIN("legal_conservative_min", 0.0, AggregationFn::componentwiseMin),
    PRECEDENT_WEIGHTED("precedent_weighted", 0.0, AggregationFn::precedentWeighted),

    // --- General purpose ---
    AVERAGE("average", 0.0, p -> bounded(meanLower(p), meanUpper(p))),
    AVERAGE_LOWER("average_lower", 0.0, p -> bounded(meanLower(p), maxUpper(p))),
    MAXIMUM("maximum", 0.0, p -> bounded(maxLower(p), maxUpper(p))),
    MINIMUM("minimum", 0.0, AggregationFn::componentwiseMin),

    // --- Statutory interpretation styles ---
    TEXTUALISM_ALPHA("textualism_alpha", 0.0, p -> {
        double l = meanLower(p);
        double u = meanUpper(p);
        return bounded(l, l + (u - l) * 0.95);
    }),
    PURPOSIVISM_ALPHA("purposivism_alpha", 0.0, p -> {
        double l = meanLower(p);
        double u = meanUpper(p);
        return bounded(l, Math.min(1.0, l + (u - l) * 1.05));
    }),
    LENITY_ALPHA("lenity_alpha", 0.0, p -> bounded(meanLower(p) * 0.95, meanUpper(p)));

    /** Pure aggregation kernel over a non-empty, sorted premise list. */
    @FunctionalInterface
    interface Kernel {
        Interval compute(List<Premise> premises);
    }

    private final String id;
    private final double floor;
    private final Kernel kernel;

    AggregationFn(String id, double floor, Kernel kernel) {
        this.id = id;
        this.floor = floor;
        this.kernel = kernel;
    }

    /** The identifier rules use to select this function. */
    public String id() {
        return id;
    }

    /** The lowest lower bound this function ever derives. */
    public double floor() {
        return floor;
    }

    /**
     * Aggregates the matched premises.
     *
     * @param premises premises from every satisfied clause, sorted by source.
     * @return the derived interval, or empty if the rule does not fire.
     * @throws AggregationInputException if premises are missing.
     */
    public Optional<Interval> aggregate(List<Premise> premises) {
        if (premises == null || premises.isEmpty())
            throw new AggregationInputException(id + ": no premises");
        return Optional.ofNullable(kernel.compute(premises));
    }

    /**
     * Resolves a rule-facing identifier.
     *
     * @throws ConfigException if no function has that identifier.
     */
    public static AggregationFn fromId(String id) {
        if (id != null) {
            String key = id.trim();
            for (AggregationFn fn : values())
                if (fn.id.equalsIgnoreCase(key) || fn.name().equalsIgnoreCase(key))
                    return fn;
        }
        throw new ConfigException(id, "Unknown aggregation function");
    }

    @Override
    public String toString() {
        return id;
    }

    // ---------------------------------------------------------------------

    private static Interval burden(List<Premise> p, double floor) {
        double lower = Math.max(floor, minLower(p));
        double upper = Math.min(1.0, maxUpper(p));
        // Evidence capped below the standard of proof: the burden is not met.
        if (lower > upper)
            return null;
        return bounded(lower, upper);
    }

    private static Interval componentwiseMin(List<Premise> p) {
        return bounded(minLower(p), minUpper(p));
    }

    private static Interval precedentWeighted(List<Premise> p) {
        double max = 0.0;
        for (Premise premise : p) {
            Double w = premise.weight();
            if (w == null)
                throw new AggregationInputException("precedent_weighted: missing precedent weight on "
                        + premise.source());
            if (!Double.isFinite(w) || w < 0.0)
                throw new AggregationInputException("precedent_weighted: invalid precedent weight " + w
                        + " on " + premise.source());
            max = Math.max(max, w);
        }
        if (max <= 0.0)
            throw new AggregationInputException("precedent_weighted: precedent weights sum to zero");

        // Scaled by the largest weight so the sum stays finite.
        double total = 0.0;
        for (Premise premise : p)
            total += premise.weight() / max;

        double lower = 0.0;
        double upper = 0.0;
        for (Premise premise : p) {
            double w = premise.weight() / max / total;
            lower += w * premise.interval().lower();
            upper += w * premise.interval().upper();
        }
        return bounded(lower, upper);
    }

    private static double minLower(List<Premise> p) {
        double m = Double.POSITIVE_INFINITY;
        for (Premise x : p)
            m = Math.min(m, x.interval().lower());
        return m;
    }

    private static double minUpper(List<Premise> p) {
        double m = Double.POSITIVE_INFINITY;
        for (Premise x : p)
            m = Math.min(m, x.interval().upper());
        return m;
    }

    private static double maxLower(List<Premise> p) {
        double m = Double.NEGATIVE_INFINITY;
        for (Premise x : p)
            m = Math.max(m, x.interval().lower());
        return m;
    }

    private static double maxUpper(List<Premise> p) {
        double m = Double.NEGATIVE_INFINITY;
        for (Premise x : p)
            m = Math.max(m, x.interval().upper());
        return m;
    }

    private static double meanLower(List<Premise> p) {
        double s = 0.0;
        for (Premise x : p)
            s += x.interval().lower();
        return s / p.size();
    }

    private static double meanUpper(List<Premise> p) {
        double s = 0.0;
        for (Premise x : p)
            s += x.interval().upper();
        return s / p.size();
    }

    /** Clamps rounding residue back into [0, 1]. */
    static Interval bounded(double lower, double upper) {
        double l = Math.max(0.0, Math.min(1.0, lower));
        double u = Math.max(0.0, Math.min(1.0, upper));
        if (l > u)
            throw new AggregationInputException("aggregation produced an empty interval [" + lower + ", "
                    + upper + "]");
        return new Interval(l, u);
    }
}
