package com.legal.reasoner.api;

/**
 * Observability interface for monitoring a fixed-point run.
 *
 * Implementations can be registered with the FixedPointEngine to receive
 * callbacks during evaluation. This is the primary mechanism for:
 *
 * - Profiling: Measuring how long each step and each rule takes.
 * - Debugging: Tracing which rules fired, and which were rejected, per step.
 * - Metrics: Counting proposals and changed facts per step.
 *
 * Threading:
 * When rules are evaluated in parallel, {@link #onRuleEvaluated} and
 * {@link #onRuleSkipped} are still delivered on the engine's calling thread,
 * after the step's proposals have been merged, in rule order. Implementations
 * do not need to be thread-safe.
 */
public interface ReasoningListener {

    /**
     * Called once after validation succeeded and initial facts were loaded.
     *
     * @param ruleCount    number of rules in the run.
     * @param initialFacts number of timestep-0 facts.
     * @param tmax         step budget.
     */
    void onRunStart(int ruleCount, int initialFacts, int tmax);

    /**
     * Called immediately before rules are evaluated against timestep {@code t}.
     */
    void onStepStart(int t);

    /**
     * Called after a rule has been evaluated against every candidate target.
     *
     * @param t             timestep the rule read from.
     * @param ruleId        the rule.
     * @param proposals     number of facts the rule proposed for {@code t+1}.
     * @param durationNanos wall time spent evaluating the rule.
     */
    void onRuleEvaluated(int t, String ruleId, int proposals, long durationNanos);

    /**
     * Called when an aggregation function rejected its premises for one target.
     * The rule simply does not fire there.
     */
    void onRuleSkipped(int t, String ruleId, EntityRef target, String reason);

    /**
     * Called after proposals for timestep {@code t+1} have been applied.
     *
     * @param t       timestep the step read from.
     * @param changed number of facts whose interval changed at {@code t+1}.
     */
    void onStepEnd(int t, int changed);

    /**
     * Called when the run reached a terminal state.
     *
     * @param status the outcome.
     * @param steps  number of steps executed.
     */
    void onRunEnd(ConvergenceStatus status, int steps);
}
