package com.legal.reasoner.util;

import java.util.Map;
import java.util.TreeMap;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.legal.reasoner.api.ConvergenceStatus;
import com.legal.reasoner.api.EntityRef;
import com.legal.reasoner.api.ReasoningListener;

/**
 * A listener that tracks what a run did and how long it took.
 *
 * <p>
 * Captures:
 * <ul>
 * <li><b>Latency:</b> Min, Max, Average time per step (in nanoseconds).</li>
 * <li><b>Work:</b> Proposals per rule, facts changed per run.</li>
 * <li><b>Rejections:</b> Skipped firings per rule, logged through a
 * rate limiter so a misconfigured rule cannot flood the log.</li>
 * </ul>
 *
 * Statistics accumulate across runs until {@link #reset()}. Runs on several
 * threads may share one instance; step timing is tracked per thread.
 */
public final class RunStatsListener implements ReasoningListener {
    private static final Logger log = LogManager.getLogger(RunStatsListener.class);

    private final ErrorRateLimiter skipLimiter = new ErrorRateLimiter(log, Level.WARN, 1000);
    private final Map<String, Long> proposalsByRule = new TreeMap<>();
    private final Map<String, Long> skipsByRule = new TreeMap<>();

    private final ThreadLocal<long[]> stepStartNanos = ThreadLocal.withInitial(() -> new long[1]);
    private long totalSteps, totalStepNanos;
    private long minStepNanos = Long.MAX_VALUE, maxStepNanos = Long.MIN_VALUE;
    private long totalChanged;
    private long runs;
    private ConvergenceStatus lastStatus;

    @Override
    public synchronized void onRunStart(int ruleCount, int initialFacts, int tmax) {
        runs++;
    }

    @Override
    public void onStepStart(int t) {
        stepStartNanos.get()[0] = System.nanoTime();
    }

    @Override
    public synchronized void onRuleEvaluated(int t, String ruleId, int proposals, long durationNanos) {
        proposalsByRule.merge(ruleId, (long) proposals, Long::sum);
    }

    @Override
    public synchronized void onRuleSkipped(int t, String ruleId, EntityRef target, String reason) {
        skipsByRule.merge(ruleId, 1L, Long::sum);
        skipLimiter.log(String.format("Rule '%s' did not fire on %s at t=%d: %s", ruleId, target.id(), t, reason),
                null);
    }

    @Override
    public void onStepEnd(int t, int changed) {
        long lastStepNanos = System.nanoTime() - stepStartNanos.get()[0];
        record(lastStepNanos, changed);
    }

    private synchronized void record(long lastStepNanos, int changed) {
        totalSteps++;
        totalStepNanos += lastStepNanos;
        totalChanged += changed;
        if (lastStepNanos < minStepNanos)
            minStepNanos = lastStepNanos;
        if (lastStepNanos > maxStepNanos)
            maxStepNanos = lastStepNanos;
    }

    @Override
    public synchronized void onRunEnd(ConvergenceStatus status, int steps) {
        lastStatus = status;
    }

    public synchronized long runs() {
        return runs;
    }

    public synchronized long totalSteps() {
        return totalSteps;
    }

    public synchronized long totalChanged() {
        return totalChanged;
    }

    public synchronized ConvergenceStatus lastStatus() {
        return lastStatus;
    }

    public synchronized long proposals(String ruleId) {
        return proposalsByRule.getOrDefault(ruleId, 0L);
    }

    public synchronized long skips(String ruleId) {
        return skipsByRule.getOrDefault(ruleId, 0L);
    }

    public synchronized long totalSkips() {
        long n = 0;
        for (long v : skipsByRule.values())
            n += v;
        return n;
    }

    public synchronized double avgStepNanos() {
        return totalSteps > 0 ? (double) totalStepNanos / totalSteps : 0;
    }

    public synchronized long minStepNanos() {
        return minStepNanos == Long.MAX_VALUE ? 0 : minStepNanos;
    }

    public synchronized long maxStepNanos() {
        return maxStepNanos == Long.MIN_VALUE ? 0 : maxStepNanos;
    }

    public synchronized void reset() {
        proposalsByRule.clear();
        skipsByRule.clear();
        totalSteps = 0;
        totalStepNanos = 0;
        totalChanged = 0;
        runs = 0;
        minStepNanos = Long.MAX_VALUE;
        maxStepNanos = Long.MIN_VALUE;
        lastStatus = null;
    }

    public synchronized String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-24s | %10s | %10s | %10s | %10s%n", "Metric", "Value", "Avg (us)", "Min (us)",
                "Max (us)"));
        sb.append("----------------------------------------------------------------------------\n");
        sb.append(String.format("%-24s | %10d | %10.2f | %10.2f | %10.2f%n", "Steps", totalSteps,
                avgStepNanos() / 1000.0, minStepNanos() / 1000.0, maxStepNanos() / 1000.0));
        sb.append(String.format("%-24s | %10d |%n", "Facts changed", totalChanged));
        for (Map.Entry<String, Long> e : proposalsByRule.entrySet())
            sb.append(String.format("%-24s | %10d | skipped %d%n", "rule " + e.getKey(), e.getValue(),
                    skips(e.getKey())));
        return sb.toString();
    }
}
