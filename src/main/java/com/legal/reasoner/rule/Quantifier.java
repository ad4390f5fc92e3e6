package com.legal.reasoner.rule;

import com.legal.reasoner.api.ConfigException;

/**
 * How many of a clause's candidate premises must meet its threshold.
 *
 * Counting modes follow the usual annotated-logic threshold semantics:
 * {@code NUMBER} compares the satisfied count directly, {@code PERCENT}
 * compares {@code 100 * satisfied / candidates}. Either way a clause with no
 * satisfied premise never matches.
 */
public record Quantifier(Mode mode, double value) {

    public enum Mode {
        NUMBER,
        PERCENT
    }

    public static final Quantifier AT_LEAST_ONE = new Quantifier(Mode.NUMBER, 1);

    public static final Quantifier ALL = new Quantifier(Mode.PERCENT, 100);

    public static Quantifier atLeast(int n) {
        return new Quantifier(Mode.NUMBER, n);
    }

    public static Quantifier percent(double p) {
        return new Quantifier(Mode.PERCENT, p);
    }

    public boolean isSatisfied(int satisfied, int candidates) {
        if (satisfied <= 0)
            return false;
        if (mode == Mode.NUMBER)
            return satisfied >= value;
        if (candidates == 0)
            return false;
        return 100.0 * satisfied / candidates >= value;
    }

    /** Parses {@code "at_least_one"}, {@code "all"}, {@code "number:N"} or {@code "percent:P"}. */
    public static Quantifier parse(String s) {
        if (s == null || s.isBlank())
            return AT_LEAST_ONE;
        String v = s.trim().toLowerCase();
        if (v.equals("at_least_one") || v.equals("any"))
            return AT_LEAST_ONE;
        if (v.equals("all"))
            return ALL;
        int colon = v.indexOf(':');
        if (colon > 0) {
            String mode = v.substring(0, colon);
            try {
                double n = Double.parseDouble(v.substring(colon + 1));
                if (mode.equals("number"))
                    return new Quantifier(Mode.NUMBER, n);
                if (mode.equals("percent"))
                    return new Quantifier(Mode.PERCENT, n);
            } catch (NumberFormatException e) {
                throw new ConfigException(s, "Malformed quantifier", e);
            }
        }
        throw new ConfigException(s, "Malformed quantifier");
    }

    @Override
    public String toString() {
        return mode == Mode.NUMBER ? "number:" + value : "percent:" + value;
    }
}
