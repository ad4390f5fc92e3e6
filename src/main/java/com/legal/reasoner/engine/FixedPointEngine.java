package com.legal.reasoner.engine;

import java.util.*;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.legal.reasoner.api.ConfigException;
import com.legal.reasoner.api.ConvergenceStatus;
import com.legal.reasoner.api.FactKey;
import com.legal.reasoner.api.Interval;
import com.legal.reasoner.api.ReasonerException;
import com.legal.reasoner.api.ReasoningListener;
import com.legal.reasoner.graph.FactStore;
import com.legal.reasoner.graph.Graph;
import com.legal.reasoner.rule.Rule;
import com.legal.reasoner.rule.RuleValidator;

/**
 * The engine that drives a rule set to a fixed point over a graph of facts.
 *
 * Unlike a dependency-ordered recomputation, rules here may support each other
 * cyclically, so the engine iterates whole steps until nothing changes or the
 * step budget runs out.
 *
 * Algorithm Details:
 *
 * 1. Init: Validate the step budget, the rules and the initial facts. Any
 * malformed input fails here with a ConfigException, before a single rule is
 * evaluated. Initial facts are written at timestep 0.
 *
 * 2. Evaluate: Every rule reads the frozen assignment at timestep t. Writes
 * for t+1 are not visible yet, so no rule observes a partial update from the
 * same step, and rule order cannot matter.
 *
 * 3. Reduce: All proposals of the step are reduced to one winner per fact by
 * the most-conservative total order (see {@link ProposalReducer}).
 *
 * 4. Apply: The winner is intersected with the current value and written at
 * t+1. A winner from a superseding rule replaces the value instead. A disjoint
 * intersection is handed to the store as-is, which rejects it as an invariant
 * violation and fails the run.
 *
 * 5. Record: Every changed fact gets an append-only derivation record.
 *
 * Static facts:
 * Once a winner from a rule marked {@code setStatic} has been applied, its
 * fact is frozen for the rest of the run and later winners for it are dropped.
 *
 * Termination:
 * A step that changes nothing ends the run as CONVERGED. A step that changed
 * something and reached {@code t+1 == tmax} ends it as EXHAUSTED, which is a
 * normal outcome, not an error.
 *
 * Parallelism:
 * With {@code parallelism > 1} the rules of a step are evaluated on a worker
 * pool owned by the run. Results are merged in rule order before reduction, so
 * the Interpretation is identical to the sequential one.
 */
public final class FixedPointEngine {
    private static final Logger log = LogManager.getLogger(FixedPointEngine.class);

    private final EngineConfig config;
    private ReasoningListener listener;

    public FixedPointEngine() {
        this(EngineConfig.DEFAULT);
    }

    public FixedPointEngine(EngineConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public void setListener(ReasoningListener listener) {
        this.listener = listener;
    }

    public EngineConfig config() {
        return config;
    }

    /**
     * Runs the rules to a fixed point.
     *
     * @param graph        the structure facts live on.
     * @param initialFacts timestep-0 facts.
     * @param rules        rules with their weights already adjusted.
     * @param tmax         step budget, at least 1.
     * @return the terminal Interpretation, CONVERGED or EXHAUSTED.
     * @throws ConfigException             if any input is malformed.
     * @throws com.legal.reasoner.api.InvariantViolationException if an update
     *                                     would widen a fact.
     */
    public Interpretation run(Graph graph, Map<FactKey, Interval> initialFacts, List<Rule> rules, int tmax) {
        if (graph == null)
            throw new ConfigException("Graph is null");
        if (tmax < 1)
            throw new ConfigException("tmax", "Step budget must be >= 1, got " + tmax);
        RuleValidator.validate(rules);

        // Stable evaluation order, so listeners and logs read the same on every run
        List<Rule> ordered = new ArrayList<>(rules);
        ordered.sort(Comparator.comparing(Rule::id));

        FactStore store = load(graph, initialFacts);
        final ReasoningListener l = this.listener;
        final boolean hasListener = l != null;

        log.info("Run start: graph={}, nodes={}, edges={}, rules={}, facts={}, tmax={}", graph.name(),
                graph.nodeCount(), graph.edgeCount(), ordered.size(), store.factCount(), tmax);
        if (hasListener)
            l.onRunStart(ordered.size(), store.factCount(), tmax);

        DerivationLog derivations = new DerivationLog();
        Set<FactKey> staticFacts = new TreeSet<>();
        List<SkippedFiring> diagnostics = new ArrayList<>();
        List<SortedMap<FactKey, Interval>> history = new ArrayList<>();
        if (config.retainSnapshots())
            history.add(Collections.unmodifiableSortedMap(store.snapshot(0)));

        ExecutorService pool = config.parallelism() > 1 ? newPool(config.parallelism()) : null;
        ConvergenceStatus status;
        int t = 0;
        try {
            while (true) {
                if (hasListener)
                    l.onStepStart(t);

                List<RuleEvaluator.Result> results = evaluateAll(ordered, store, t, pool);

                List<Proposal> proposals = new ArrayList<>();
                for (RuleEvaluator.Result r : results) {
                    proposals.addAll(r.proposals());
                    diagnostics.addAll(r.skipped());
                    if (hasListener) {
                        l.onRuleEvaluated(t, r.rule().id(), r.proposals().size(), r.durationNanos());
                        for (SkippedFiring s : r.skipped())
                            l.onRuleSkipped(t, s.ruleId(), s.target(), s.reason());
                    }
                    for (SkippedFiring s : r.skipped())
                        log.debug("Rule {} skipped on {} at t={}: {}", s.ruleId(), s.target().id(), t, s.reason());
                }

                int changed = apply(store, ProposalReducer.reduce(proposals), t, derivations, staticFacts);

                if (config.retainSnapshots())
                    history.add(Collections.unmodifiableSortedMap(store.snapshot(t + 1)));
                if (hasListener)
                    l.onStepEnd(t, changed);
                log.debug("Step t={}: proposals={}, changed={}", t, proposals.size(), changed);

                t++;
                if (changed == 0) {
                    status = ConvergenceStatus.CONVERGED;
                    break;
                }
                if (t >= tmax) {
                    status = ConvergenceStatus.EXHAUSTED;
                    break;
                }
            }
        } finally {
            if (pool != null)
                pool.shutdownNow();
        }

        Collections.sort(diagnostics);
        if (hasListener)
            l.onRunEnd(status, t);
        log.info("Run end: status={}, steps={}, derivations={}, skipped={}", status, t, derivations.size(),
                diagnostics.size());
        return new Interpretation(store.snapshot(t), t, status, t, derivations, diagnostics, history);
    }

    private static FactStore load(Graph graph, Map<FactKey, Interval> initialFacts) {
        FactStore store = new FactStore(graph);
        if (initialFacts == null)
            return store;
        for (Map.Entry<FactKey, Interval> e : new TreeMap<>(initialFacts).entrySet()) {
            FactKey key = e.getKey();
            if (!graph.contains(key.entity()))
                throw new ConfigException(key.statement(), "Initial fact references an unknown entity");
            if (e.getValue() == null)
                throw new ConfigException(key.statement(), "Initial fact has no interval");
            store.setFact(key, 0, e.getValue(), false);
        }
        return store;
    }

    /**
     * Applies the step's winners at {@code t+1}, in fact order.
     *
     * @return number of facts whose value changed.
     */
    private int apply(FactStore store, SortedMap<FactKey, Proposal> winners, int t, DerivationLog derivations,
            Set<FactKey> staticFacts) {
        int changed = 0;
        for (Proposal p : winners.values()) {
            if (staticFacts.contains(p.key())) {
                log.debug("Static fact {} kept at t={}, ignoring rule {}", p.key().statement(), t + 1, p.ruleId());
                continue;
            }
            Interval current = store.getFact(p.key(), t).orElse(null);
            Interval next;
            if (current == null || p.supersedes()) {
                next = p.interval();
            } else {
                Interval meet = current.intersect(p.interval());
                // Disjoint: let the store reject the widening with full context
                next = meet != null ? meet : p.interval();
            }
            if (store.setFact(p.key(), t + 1, next, p.supersedes())) {
                changed++;
                if (config.recordDerivations())
                    derivations.append(p, t + 1, next, current);
            }
            if (p.setStatic())
                staticFacts.add(p.key());
        }
        return changed;
    }

    private static List<RuleEvaluator.Result> evaluateAll(List<Rule> rules, FactStore store, int t,
            ExecutorService pool) {
        List<RuleEvaluator.Result> results = new ArrayList<>(rules.size());
        if (pool == null) {
            for (Rule r : rules)
                results.add(RuleEvaluator.evaluate(r, store, t));
            return results;
        }

        List<Future<RuleEvaluator.Result>> futures = new ArrayList<>(rules.size());
        for (Rule r : rules)
            futures.add(pool.submit(() -> RuleEvaluator.evaluate(r, store, t)));
        // Collected in rule order regardless of completion order
        for (Future<RuleEvaluator.Result> f : futures) {
            try {
                results.add(f.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ReasonerException("Interrupted while evaluating rules at t=" + t, e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException re)
                    throw re;
                throw new ReasonerException("Rule evaluation failed at t=" + t, cause);
            }
        }
        return results;
    }

    private static ExecutorService newPool(int threads) {
        AtomicInteger seq = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread th = new Thread(r, "reasoner-worker-" + seq.incrementAndGet());
            th.setDaemon(true);
            return th;
        });
    }
}
