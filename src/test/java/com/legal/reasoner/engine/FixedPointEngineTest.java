package com.legal.reasoner.engine;

import java.util.*;

import org.junit.Test;

import com.legal.reasoner.api.ConfigException;
import com.legal.reasoner.api.ConvergenceStatus;
import com.legal.reasoner.api.EntityRef;
import com.legal.reasoner.api.FactKey;
import com.legal.reasoner.api.FactRef;
import com.legal.reasoner.api.Interval;
import com.legal.reasoner.api.InvariantViolationException;
import com.legal.reasoner.api.ReasoningListener;
import com.legal.reasoner.fn.AggregationFn;
import com.legal.reasoner.graph.Graph;
import com.legal.reasoner.rule.Clause;
import com.legal.reasoner.rule.Quantifier;
import com.legal.reasoner.rule.Rule;

import static org.junit.Assert.*;

public class FixedPointEngineTest {

    private static final double EPS = 1e-9;

    private static Graph claimGraph() {
        return Graph.builder("claims").addNode("claim").build();
    }

    private static Rule liable() {
        return Rule.builder("liable")
                .derivesOnNode("liable")
                .when(Clause.self("evidence", 0.6))
                .aggregate(AggregationFn.LEGAL_BURDEN_CIVIL_051)
                .build();
    }

    /** Two nodes supporting each other, each anchored at TRUE. */
    private static Graph supportCycle() {
        return Graph.builder("cycle")
                .addNode("A")
                .addNode("B")
                .addEdge("A", "B", "supports")
                .addEdge("B", "A", "supports")
                .build();
    }

    private static Map<FactKey, Interval> supportFacts() {
        Map<FactKey, Interval> facts = new HashMap<>();
        for (String n : List.of("A", "B")) {
            facts.put(FactKey.node(n, "p"), Interval.UNKNOWN);
            facts.put(FactKey.node(n, "anchor"), Interval.TRUE);
        }
        return facts;
    }

    private static Rule mutualSupport() {
        return Rule.builder("support")
                .derivesOnNode("p")
                .when(Clause.inNeighbor("supports", "p", 0.0))
                .when(Clause.self("anchor", 0.0))
                .aggregate(AggregationFn.AVERAGE)
                .build();
    }

    @Test
    public void testEvidenceBelowThresholdDerivesNothing() {
        Interpretation result = new FixedPointEngine().run(claimGraph(),
                Map.of(FactKey.node("claim", "evidence"), Interval.point(0.55)), List.of(liable()), 10);

        assertEquals(ConvergenceStatus.CONVERGED, result.status());
        assertEquals(1, result.steps());
        assertFalse(result.node("claim", "liable").isPresent());
        assertTrue(result.derivations().isEmpty());
    }

    @Test
    public void testEvidenceAboveThresholdDerivesLiability() {
        FactKey evidence = FactKey.node("claim", "evidence");
        Interpretation result = new FixedPointEngine().run(claimGraph(),
                Map.of(evidence, Interval.of(0.62, 0.70)), List.of(liable()), 10);

        assertEquals(ConvergenceStatus.CONVERGED, result.status());
        assertEquals(2, result.steps());
        assertEquals(2, result.timestep());
        assertEquals(Interval.of(0.62, 0.70), result.node("claim", "liable").get());

        assertEquals(1, result.derivations().size());
        DerivationRecord r = result.derivations().get(0);
        assertEquals("liable", r.ruleId());
        assertEquals(1, r.timestep());
        assertNull(r.previous());
        assertEquals(List.of(new FactRef(evidence, 0)), r.premises());
    }

    @Test
    public void testCyclicSupportExhaustsBudget() {
        Interpretation result = new FixedPointEngine().run(supportCycle(), supportFacts(), List.of(mutualSupport()), 5);

        assertEquals(ConvergenceStatus.EXHAUSTED, result.status());
        assertFalse(result.isConverged());
        assertEquals(5, result.steps());
        assertEquals(Interval.of(0.96875, 1.0), result.node("A", "p").get());
        assertEquals(Interval.of(0.96875, 1.0), result.node("B", "p").get());
    }

    @Test
    public void testRetainedHistoryNarrowsMonotonically() {
        FixedPointEngine engine = new FixedPointEngine(EngineConfig.DEFAULT.withRetainSnapshots(true));
        Interpretation result = engine.run(supportCycle(), supportFacts(), List.of(mutualSupport()), 5);

        List<SortedMap<FactKey, Interval>> history = result.history();
        assertEquals(6, history.size());
        assertEquals(result.facts(), history.get(5));
        for (int t = 1; t < history.size(); t++) {
            for (Map.Entry<FactKey, Interval> e : history.get(t - 1).entrySet())
                assertTrue(e.getKey() + "@" + t, e.getValue().contains(history.get(t).get(e.getKey())));
        }
        assertEquals(Interval.of(0.5, 1.0), history.get(1).get(FactKey.node("A", "p")));
    }

    @Test
    public void testHistoryEmptyUnlessRetained() {
        Interpretation result = new FixedPointEngine().run(supportCycle(), supportFacts(), List.of(mutualSupport()), 3);
        assertTrue(result.history().isEmpty());
    }

    @Test
    public void testMostConservativeProposalWins() {
        Interpretation result = runConflict(new FixedPointEngine());

        assertEquals(Interval.of(0.7, 0.8), result.node("x", "out").get());
        assertEquals(ConvergenceStatus.CONVERGED, result.status());
        assertEquals(2, result.steps());
        List<DerivationRecord> records = result.derivations().forFact(FactKey.node("x", "out"));
        assertEquals(1, records.size());
        assertEquals("r2", records.get(0).ruleId());
    }

    private static Interpretation runConflict(FixedPointEngine engine) {
        Graph g = Graph.builder("conflict").addNode("x").build();
        Map<FactKey, Interval> facts = Map.of(
                FactKey.node("x", "a"), Interval.of(0.6, 0.9),
                FactKey.node("x", "b"), Interval.of(0.7, 0.8));
        List<Rule> rules = List.of(
                Rule.builder("r1").derivesOnNode("out").when(Clause.self("a", 0.0)).aggregate(AggregationFn.AVERAGE)
                        .build(),
                Rule.builder("r2").derivesOnNode("out").when(Clause.self("b", 0.0)).aggregate(AggregationFn.AVERAGE)
                        .build());
        return engine.run(g, facts, rules, 10);
    }

    @Test
    public void testRerunFromResultIsFixedPoint() {
        Interpretation first = runConflict(new FixedPointEngine());
        Graph g = Graph.builder("conflict").addNode("x").build();
        List<Rule> rules = List.of(
                Rule.builder("r1").derivesOnNode("out").when(Clause.self("a", 0.0)).aggregate(AggregationFn.AVERAGE)
                        .build(),
                Rule.builder("r2").derivesOnNode("out").when(Clause.self("b", 0.0)).aggregate(AggregationFn.AVERAGE)
                        .build());

        Interpretation second = new FixedPointEngine().run(g, first.toInitialFacts(), rules, 10);

        assertEquals(ConvergenceStatus.CONVERGED, second.status());
        assertEquals(1, second.steps());
        assertTrue(second.derivations().isEmpty());
        assertEquals(first.facts(), second.facts());
    }

    @Test
    public void testDisjointUpdateIsInvariantViolation() {
        Graph g = Graph.builder("g").addNode("x").build();
        Map<FactKey, Interval> facts = Map.of(
                FactKey.node("x", "p"), Interval.of(0.1, 0.2),
                FactKey.node("x", "evidence"), Interval.of(0.8, 0.9));
        Rule rule = Rule.builder("flip").derivesOnNode("p").when(Clause.self("evidence", 0.0))
                .aggregate(AggregationFn.AVERAGE).build();
        try {
            new FixedPointEngine().run(g, facts, List.of(rule), 10);
            fail("Expected InvariantViolationException");
        } catch (InvariantViolationException e) {
            assertEquals(FactKey.node("x", "p"), e.fact());
            assertEquals(1, e.timestep());
        }
    }

    @Test
    public void testSupersedingRuleReplacesFact() {
        Graph g = Graph.builder("g").addNode("x").build();
        Map<FactKey, Interval> facts = Map.of(
                FactKey.node("x", "p"), Interval.of(0.1, 0.2),
                FactKey.node("x", "evidence"), Interval.of(0.8, 0.9));
        Rule rule = Rule.builder("overrule").derivesOnNode("p").when(Clause.self("evidence", 0.0))
                .aggregate(AggregationFn.AVERAGE).supersedes(true).build();

        Interpretation result = new FixedPointEngine().run(g, facts, List.of(rule), 10);

        assertEquals(Interval.of(0.8, 0.9), result.node("x", "p").get());
        assertEquals(ConvergenceStatus.CONVERGED, result.status());
        DerivationRecord r = result.derivations().get(0);
        assertEquals(Interval.of(0.1, 0.2), r.previous());
        assertEquals(Interval.of(0.8, 0.9), r.interval());
    }

    @Test
    public void testStaticFactIsFrozenAfterFirstApply() {
        Rule frozen = Rule.builder("support")
                .derivesOnNode("p")
                .when(Clause.inNeighbor("supports", "p", 0.0))
                .when(Clause.self("anchor", 0.0))
                .aggregate(AggregationFn.AVERAGE)
                .setStatic(true)
                .build();

        Interpretation result = new FixedPointEngine().run(supportCycle(), supportFacts(), List.of(frozen), 5);

        assertEquals(ConvergenceStatus.CONVERGED, result.status());
        assertEquals(2, result.steps());
        assertEquals(Interval.of(0.5, 1.0), result.node("A", "p").get());
        assertEquals(Interval.of(0.5, 1.0), result.node("B", "p").get());
        assertEquals(2, result.derivations().size());
    }

    @Test
    public void testStaticFactIgnoresLaterNarrowerRule() {
        Rule frozen = Rule.builder("support")
                .derivesOnNode("p")
                .when(Clause.inNeighbor("supports", "p", 0.0))
                .when(Clause.self("anchor", 0.0))
                .aggregate(AggregationFn.AVERAGE)
                .setStatic(true)
                .build();
        Rule late = Rule.builder("late")
                .derivesOnNode("p")
                .when(Clause.self("anchor", 0.0))
                .aggregate(AggregationFn.AVERAGE)
                .validBetween(1, 10)
                .build();

        Interpretation result = new FixedPointEngine().run(supportCycle(), supportFacts(), List.of(frozen, late), 5);

        assertEquals(ConvergenceStatus.CONVERGED, result.status());
        assertEquals(Interval.of(0.5, 1.0), result.node("A", "p").get());
        for (DerivationRecord r : result.derivations().records())
            assertEquals("support", r.ruleId());

        // Same rules without the static flag: the late rule narrows the fact
        Interpretation open = new FixedPointEngine().run(supportCycle(), supportFacts(),
                List.of(mutualSupport(), late), 5);
        assertEquals(Interval.TRUE, open.node("A", "p").get());
    }

    @Test
    public void testRuleWeightPullsLowerBoundTowardFloor() {
        Rule weighted = Rule.builder("liable").derivesOnNode("liable")
                .when(Clause.self("evidence", 0.6))
                .aggregate(AggregationFn.LEGAL_BURDEN_CIVIL_051)
                .weight(0.5)
                .build();
        Interpretation result = new FixedPointEngine().run(claimGraph(),
                Map.of(FactKey.node("claim", "evidence"), Interval.of(0.9, 1.0)), List.of(weighted), 10);

        Interval liable = result.node("claim", "liable").get();
        assertEquals(0.705, liable.lower(), EPS);
        assertEquals(0.805, liable.upper(), EPS);
    }

    @Test
    public void testScaleKeepsWidthAndClamps() {
        Interval raw = Interval.of(0.2, 0.9);
        assertSame(raw, RuleEvaluator.scale(raw, 0.0, 1.0));
        Interval scaled = RuleEvaluator.scale(raw, 0.0, 0.5);
        assertEquals(0.1, scaled.lower(), EPS);
        assertEquals(0.8, scaled.upper(), EPS);
        Interval floored = RuleEvaluator.scale(raw, 0.0, 0.0);
        assertEquals(0.0, floored.lower(), EPS);
        assertEquals(0.7, floored.upper(), EPS);
        Interval clamped = RuleEvaluator.scale(Interval.of(0.1, 0.9), 0.51, 0.5);
        assertEquals(1.0, clamped.upper(), EPS);
    }

    @Test
    public void testMissingPrecedentWeightIsSkippedNotFatal() {
        Rule rule = Rule.builder("precedent").derivesOnNode("holding")
                .when(Clause.self("evidence", 0.0).withWeightAttribute("precedent_weight"))
                .aggregate(AggregationFn.PRECEDENT_WEIGHTED)
                .build();
        Interpretation result = new FixedPointEngine().run(claimGraph(),
                Map.of(FactKey.node("claim", "evidence"), Interval.of(0.6, 0.8)), List.of(rule), 10);

        assertEquals(ConvergenceStatus.CONVERGED, result.status());
        assertEquals(1, result.steps());
        assertFalse(result.node("claim", "holding").isPresent());
        assertEquals(1, result.diagnostics().size());
        SkippedFiring s = result.diagnostics().get(0);
        assertEquals("precedent", s.ruleId());
        assertEquals(0, s.timestep());
        assertEquals("claim", s.target().id());
        assertTrue(s.reason(), s.reason().contains("missing precedent weight"));
    }

    private static Graph citations() {
        return Graph.builder("citations")
                .addNode("c1")
                .addNode("c2")
                .addNode("t")
                .addEdge("c1", "t", "cites")
                .addEdge("c2", "t", "cites")
                .build();
    }

    private static Map<FactKey, Interval> citationFacts() {
        return Map.of(
                FactKey.node("c1", "evidence"), Interval.of(0.8, 0.9),
                FactKey.node("c2", "evidence"), Interval.of(0.3, 0.4));
    }

    @Test
    public void testQuantifierAllRequiresEveryNeighbor() {
        Rule rule = Rule.builder("all").derivesOnNode("supported")
                .when(Clause.inNeighbor("cites", "evidence", 0.5).withQuantifier(Quantifier.ALL))
                .aggregate(AggregationFn.AVERAGE).build();
        Interpretation result = new FixedPointEngine().run(citations(), citationFacts(), List.of(rule), 10);
        assertFalse(result.node("t", "supported").isPresent());
    }

    @Test
    public void testQuantifierAtLeastOneUsesOnlySatisfiedPremises() {
        Rule rule = Rule.builder("any").derivesOnNode("supported")
                .when(Clause.inNeighbor("cites", "evidence", 0.5).withQuantifier(Quantifier.atLeast(1)))
                .aggregate(AggregationFn.AVERAGE).build();
        Interpretation result = new FixedPointEngine().run(citations(), citationFacts(), List.of(rule), 10);

        assertEquals(Interval.of(0.8, 0.9), result.node("t", "supported").get());
        assertFalse(result.node("c1", "supported").isPresent());
        DerivationRecord r = result.derivations().forFact(FactKey.node("t", "supported")).get(0);
        assertEquals(List.of(new FactRef(FactKey.node("c1", "evidence"), 0)), r.premises());
    }

    @Test
    public void testEdgeHeadedRule() {
        Graph g = Graph.builder("g")
                .addNode("a")
                .addNode("b")
                .addEdge("a", "b", "cites")
                .addEdge("b", "a", "distinguishes")
                .build();
        Map<FactKey, Interval> facts = Map.of(
                FactKey.node("a", "authoritative"), Interval.of(0.8, 0.9),
                FactKey.node("b", "relevant"), Interval.of(0.6, 0.7));
        Rule rule = Rule.builder("binding").derivesOnEdge("binding", "cites")
                .when(Clause.edgeSource("authoritative", 0.5))
                .when(Clause.edgeTarget("relevant", 0.5))
                .aggregate(AggregationFn.MINIMUM).build();

        Interpretation result = new FixedPointEngine().run(g, facts, List.of(rule), 10);

        assertEquals(Interval.of(0.6, 0.7), result.get(FactKey.edge("a", "b", "cites", "binding")).get());
        assertFalse(result.get(FactKey.edge("b", "a", "distinguishes", "binding")).isPresent());
    }

    @Test
    public void testValidTimeWindow() {
        Rule flag = Rule.builder("flag").derivesOnNode("flag")
                .when(Clause.self("anchor", 0.0))
                .aggregate(AggregationFn.AVERAGE)
                .validBetween(3, 3)
                .build();
        FixedPointEngine engine = new FixedPointEngine(EngineConfig.DEFAULT.withRetainSnapshots(true));
        Interpretation result = engine.run(supportCycle(), supportFacts(), List.of(mutualSupport(), flag), 10);

        FactKey key = FactKey.node("A", "flag");
        assertFalse(result.history().get(3).containsKey(key));
        assertEquals(Interval.TRUE, result.history().get(4).get(key));
        assertEquals(4, result.derivations().forFact(key).get(0).timestep());
    }

    @Test
    public void testConvergesBeforeLaterWindowOpens() {
        Rule flag = Rule.builder("flag").derivesOnNode("flag")
                .when(Clause.self("anchor", 0.0))
                .aggregate(AggregationFn.AVERAGE)
                .validBetween(3, 3)
                .build();
        Interpretation result = new FixedPointEngine().run(supportCycle(), supportFacts(), List.of(flag), 10);

        assertEquals(ConvergenceStatus.CONVERGED, result.status());
        assertEquals(1, result.steps());
        assertFalse(result.node("A", "flag").isPresent());
    }

    @Test
    public void testParallelEvaluationIsDeterministic() {
        Graph g = Graph.builder("mixed")
                .addNode("A")
                .addNode("B")
                .addNode("x")
                .addEdge("A", "B", "supports")
                .addEdge("B", "A", "supports")
                .build();
        Map<FactKey, Interval> facts = new HashMap<>(supportFacts());
        facts.put(FactKey.node("x", "a"), Interval.of(0.6, 0.9));
        facts.put(FactKey.node("x", "b"), Interval.of(0.7, 0.8));
        List<Rule> rules = new ArrayList<>(List.of(mutualSupport(),
                Rule.builder("r1").derivesOnNode("out").when(Clause.self("a", 0.0)).aggregate(AggregationFn.AVERAGE)
                        .build(),
                Rule.builder("r2").derivesOnNode("out").when(Clause.self("b", 0.0)).aggregate(AggregationFn.AVERAGE)
                        .build(),
                Rule.builder("r3").derivesOnNode("out").when(Clause.self("anchor", 0.0))
                        .aggregate(AggregationFn.MAXIMUM).build()));

        Interpretation sequential = new FixedPointEngine().run(g, facts, rules, 8);

        Collections.shuffle(rules, new Random(42));
        Interpretation parallel = new FixedPointEngine(EngineConfig.DEFAULT.withParallelism(4)).run(g, facts, rules, 8);

        assertEquals(sequential.facts(), parallel.facts());
        assertEquals(sequential.derivations().records(), parallel.derivations().records());
        assertEquals(sequential.status(), parallel.status());
        assertEquals(sequential.steps(), parallel.steps());
    }

    @Test
    public void testDerivationsCanBeDisabled() {
        FixedPointEngine engine = new FixedPointEngine(EngineConfig.DEFAULT.withRecordDerivations(false));
        Interpretation result = engine.run(claimGraph(),
                Map.of(FactKey.node("claim", "evidence"), Interval.of(0.62, 0.70)), List.of(liable()), 10);
        assertTrue(result.node("claim", "liable").isPresent());
        assertTrue(result.derivations().isEmpty());
    }

    @Test
    public void testListenerCallbacks() {
        List<String> events = new ArrayList<>();
        FixedPointEngine engine = new FixedPointEngine();
        engine.setListener(new ReasoningListener() {
            @Override
            public void onRunStart(int ruleCount, int initialFacts, int tmax) {
                events.add("start " + ruleCount + " " + initialFacts + " " + tmax);
            }

            @Override
            public void onStepStart(int t) {
                events.add("step " + t);
            }

            @Override
            public void onRuleEvaluated(int t, String ruleId, int proposals, long durationNanos) {
                events.add("rule " + ruleId + " " + proposals);
            }

            @Override
            public void onRuleSkipped(int t, String ruleId, EntityRef target, String reason) {
                events.add("skip " + ruleId);
            }

            @Override
            public void onStepEnd(int t, int changed) {
                events.add("end " + t + " " + changed);
            }

            @Override
            public void onRunEnd(ConvergenceStatus status, int steps) {
                events.add(status + " " + steps);
            }
        });

        engine.run(claimGraph(), Map.of(FactKey.node("claim", "evidence"), Interval.of(0.62, 0.70)),
                List.of(liable()), 10);

        assertEquals(List.of(
                "start 1 1 10",
                "step 0", "rule liable 1", "end 0 1",
                "step 1", "rule liable 1", "end 1 0",
                "CONVERGED 2"), events);
    }

    @Test(expected = ConfigException.class)
    public void testZeroBudgetRejected() {
        new FixedPointEngine().run(claimGraph(), Map.of(), List.of(liable()), 0);
    }

    @Test(expected = ConfigException.class)
    public void testNullGraphRejected() {
        new FixedPointEngine().run(null, Map.of(), List.of(liable()), 5);
    }

    @Test(expected = ConfigException.class)
    public void testInitialFactOnUnknownEntityRejected() {
        new FixedPointEngine().run(claimGraph(), Map.of(FactKey.node("ghost", "evidence"), Interval.TRUE),
                List.of(liable()), 5);
    }

    @Test(expected = ConfigException.class)
    public void testDuplicateRuleIdsRejected() {
        new FixedPointEngine().run(claimGraph(), Map.of(), List.of(liable(), liable()), 5);
    }

    @Test
    public void testEmptyRuleSetConvergesImmediately() {
        Interpretation result = new FixedPointEngine().run(claimGraph(),
                Map.of(FactKey.node("claim", "evidence"), Interval.TRUE), List.of(), 5);
        assertEquals(ConvergenceStatus.CONVERGED, result.status());
        assertEquals(1, result.steps());
        assertEquals(Interval.TRUE, result.node("claim", "evidence").get());
    }
}
