package com.legal.reasoner.rule;

/**
 * Inclusive window of timesteps during which a rule may fire.
 */
public record ValidTime(int from, int to) {

    public static final ValidTime ALWAYS = new ValidTime(0, Integer.MAX_VALUE);

    public boolean contains(int t) {
        return t >= from && t <= to;
    }

    public boolean isWellFormed() {
        return from >= 0 && from <= to;
    }

    @Override
    public String toString() {
        return this.equals(ALWAYS) ? "always" : "[" + from + "," + to + "]";
    }
}
