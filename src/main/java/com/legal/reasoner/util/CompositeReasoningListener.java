package com.legal.reasoner.util;

import java.util.Arrays;

import com.legal.reasoner.api.ConvergenceStatus;
import com.legal.reasoner.api.EntityRef;
import com.legal.reasoner.api.ReasoningListener;

/**
 * Fans engine callbacks out to several {@link ReasoningListener}s, in
 * registration order.
 */
public class CompositeReasoningListener implements ReasoningListener {
    private volatile ReasoningListener[] listeners = new ReasoningListener[0];

    public synchronized CompositeReasoningListener add(ReasoningListener listener) {
        ReasoningListener[] old = listeners;
        ReasoningListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
        return this;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onRunStart(int ruleCount, int initialFacts, int tmax) {
        for (ReasoningListener l : listeners)
            l.onRunStart(ruleCount, initialFacts, tmax);
    }

    @Override
    public void onStepStart(int t) {
        for (ReasoningListener l : listeners)
            l.onStepStart(t);
    }

    @Override
    public void onRuleEvaluated(int t, String ruleId, int proposals, long durationNanos) {
        for (ReasoningListener l : listeners)
            l.onRuleEvaluated(t, ruleId, proposals, durationNanos);
    }

    @Override
    public void onRuleSkipped(int t, String ruleId, EntityRef target, String reason) {
        for (ReasoningListener l : listeners)
            l.onRuleSkipped(t, ruleId, target, reason);
    }

    @Override
    public void onStepEnd(int t, int changed) {
        for (ReasoningListener l : listeners)
            l.onStepEnd(t, changed);
    }

    @Override
    public void onRunEnd(ConvergenceStatus status, int steps) {
        for (ReasoningListener l : listeners)
            l.onRunEnd(status, steps);
    }
}
