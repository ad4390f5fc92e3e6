package com.legal.reasoner.api;

/**
 * A closed confidence interval {@code [lower, upper]} with
 * {@code 0 <= lower <= upper <= 1}.
 *
 * Intervals are partially ordered by inclusion. A fact may only ever be
 * narrowed (replaced by a contained interval) during a run, unless a rule
 * explicitly supersedes it.
 *
 * Equality is bitwise on both bounds so that two runs producing the same
 * doubles compare equal and serialize identically.
 */
public record Interval(double lower, double upper) implements Comparable<Interval> {

    /** The uninformative interval [0, 1]. */
    public static final Interval UNKNOWN = new Interval(0.0, 1.0);

    public static final Interval TRUE = new Interval(1.0, 1.0);

    public static final Interval FALSE = new Interval(0.0, 0.0);

    public Interval {
        if (!Double.isFinite(lower) || !Double.isFinite(upper))
            throw new IllegalArgumentException("Interval bounds must be finite: [" + lower + ", " + upper + "]");
        if (lower < 0.0 || upper > 1.0 || lower > upper)
            throw new IllegalArgumentException("Interval must satisfy 0 <= lower <= upper <= 1: ["
                    + lower + ", " + upper + "]");
        // Canonicalize -0.0 so equality and serialization stay bitwise stable
        lower = lower + 0.0;
        upper = upper + 0.0;
    }

    public static Interval of(double lower, double upper) {
        return new Interval(lower, upper);
    }

    /** A point fact, {@code lower == upper}. */
    public static Interval point(double value) {
        return new Interval(value, value);
    }

    /**
     * Returns true if {@code [lower, upper]} would be a well-formed interval.
     */
    public static boolean isValid(double lower, double upper) {
        return Double.isFinite(lower) && Double.isFinite(upper)
                && lower >= 0.0 && upper <= 1.0 && lower <= upper;
    }

    public boolean isPoint() {
        return lower == upper;
    }

    public double width() {
        return upper - lower;
    }

    /** True if {@code other} lies entirely within this interval. */
    public boolean contains(Interval other) {
        return lower <= other.lower && other.upper <= upper;
    }

    /**
     * Intersection of the two intervals.
     *
     * @return the intersection, or {@code null} if the intervals are disjoint.
     */
    public Interval intersect(Interval other) {
        double l = Math.max(lower, other.lower);
        double u = Math.min(upper, other.upper);
        if (l > u)
            return null;
        return new Interval(l, u);
    }

    /**
     * Most-conservative ordering used for conflict resolution: narrowest first,
     * then lowest upper bound, then lowest lower bound. Total over distinct
     * intervals.
     */
    @Override
    public int compareTo(Interval o) {
        int c = Double.compare(width(), o.width());
        if (c != 0)
            return c;
        c = Double.compare(upper, o.upper);
        if (c != 0)
            return c;
        return Double.compare(lower, o.lower);
    }

    @Override
    public String toString() {
        return "[" + lower + "," + upper + "]";
    }
}
