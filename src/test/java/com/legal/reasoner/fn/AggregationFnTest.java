package com.legal.reasoner.fn;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.junit.Test;

import com.legal.reasoner.api.AggregationInputException;
import com.legal.reasoner.api.ConfigException;
import com.legal.reasoner.api.FactKey;
import com.legal.reasoner.api.FactRef;
import com.legal.reasoner.api.Interval;
import com.legal.reasoner.graph.Premise;

import static org.junit.Assert.*;

public class AggregationFnTest {
    private static final double EPS = 1e-12;

    private static List<Premise> premises(Interval... intervals) {
        List<Premise> out = new ArrayList<>();
        for (int i = 0; i < intervals.length; i++)
            out.add(new Premise(new FactRef(FactKey.node("n" + i, "p"), 0), intervals[i]));
        return out;
    }

    private static Premise weighted(String node, Interval interval, Double weight) {
        return new Premise(new FactRef(FactKey.node(node, "p"), 0), interval, weight);
    }

    @Test
    public void testConservativeMin() {
        Optional<Interval> r = AggregationFn.LEGAL_CONSERVATIVE_MIN
                .aggregate(premises(Interval.of(0.9, 0.95), Interval.of(0.4, 0.6)));
        assertEquals(Interval.of(0.4, 0.6), r.get());
    }

    @Test
    public void testCivilBurdenKeepsIntervalAboveFloor() {
        Optional<Interval> r = AggregationFn.LEGAL_BURDEN_CIVIL_051.aggregate(premises(Interval.of(0.62, 0.70)));
        assertEquals(Interval.of(0.62, 0.70), r.get());
    }

    @Test
    public void testBurdenLiftsLowerBoundToFloor() {
        Interval r = AggregationFn.LEGAL_BURDEN_CIVIL_051.aggregate(premises(Interval.of(0.3, 0.9))).get();
        assertEquals(0.51, r.lower(), 0.0);
        assertEquals(0.9, r.upper(), 0.0);
    }

    @Test
    public void testBurdenNotMetDoesNotFire() {
        assertFalse(AggregationFn.LEGAL_BURDEN_CIVIL_051.aggregate(premises(Interval.of(0.2, 0.4))).isPresent());
        assertFalse(AggregationFn.LEGAL_BURDEN_CLEAR_075.aggregate(premises(Interval.of(0.6, 0.7))).isPresent());
    }

    @Test
    public void testCriminalBurdenUsesWeakestLowerAndStrongestUpper() {
        Interval r = AggregationFn.LEGAL_BURDEN_CRIMINAL_090
                .aggregate(premises(Interval.of(0.95, 0.97), Interval.of(0.92, 1.0))).get();
        assertEquals(Interval.of(0.92, 1.0), r);
    }

    @Test
    public void testPrecedentWeighted() {
        List<Premise> p = List.of(
                weighted("a", Interval.of(0.2, 0.4), 1.0),
                weighted("b", Interval.of(0.8, 1.0), 3.0));
        Interval r = AggregationFn.PRECEDENT_WEIGHTED.aggregate(p).get();
        assertEquals(0.65, r.lower(), EPS);
        assertEquals(0.85, r.upper(), EPS);
    }

    @Test
    public void testPrecedentWeightedIgnoresWeightScale() {
        List<Premise> small = List.of(
                weighted("a", Interval.of(0.2, 0.4), 0.1),
                weighted("b", Interval.of(0.8, 1.0), 0.1));
        Interval r = AggregationFn.PRECEDENT_WEIGHTED.aggregate(small).get();
        assertEquals(0.5, r.lower(), EPS);
        assertEquals(0.7, r.upper(), EPS);
    }

    @Test
    public void testPrecedentWeightedHugeWeightsDoNotOverflow() {
        Interval r = AggregationFn.PRECEDENT_WEIGHTED.aggregate(List.of(
                weighted("a", Interval.of(0.8, 0.9), 1e308),
                weighted("b", Interval.of(0.8, 0.9), 1e308))).get();
        assertEquals(0.8, r.lower(), EPS);
        assertEquals(0.9, r.upper(), EPS);

        Interval mixed = AggregationFn.PRECEDENT_WEIGHTED.aggregate(List.of(
                weighted("a", Interval.of(0.2, 0.4), 1.5e308),
                weighted("b", Interval.of(0.8, 1.0), 1.5e308),
                weighted("c", Interval.of(0.8, 1.0), 1.5e308),
                weighted("d", Interval.of(0.8, 1.0), 1.5e308))).get();
        assertEquals(0.65, mixed.lower(), EPS);
        assertEquals(0.85, mixed.upper(), EPS);
    }

    @Test(expected = AggregationInputException.class)
    public void testPrecedentWeightedMissingWeightFailsClosed() {
        AggregationFn.PRECEDENT_WEIGHTED.aggregate(List.of(
                weighted("a", Interval.of(0.2, 0.4), 1.0),
                weighted("b", Interval.of(0.8, 1.0), null)));
    }

    @Test(expected = AggregationInputException.class)
    public void testPrecedentWeightedNegativeWeightFailsClosed() {
        AggregationFn.PRECEDENT_WEIGHTED.aggregate(List.of(weighted("a", Interval.of(0.2, 0.4), -1.0)));
    }

    @Test(expected = AggregationInputException.class)
    public void testPrecedentWeightedZeroSumFailsClosed() {
        AggregationFn.PRECEDENT_WEIGHTED.aggregate(List.of(
                weighted("a", Interval.of(0.2, 0.4), 0.0),
                weighted("b", Interval.of(0.8, 1.0), 0.0)));
    }

    @Test(expected = AggregationInputException.class)
    public void testEmptyPremisesRejected() {
        AggregationFn.AVERAGE.aggregate(List.of());
    }

    @Test
    public void testGeneralPurposeFunctions() {
        List<Premise> p = premises(Interval.of(0.2, 0.6), Interval.of(0.4, 1.0));
        assertEquals(0.3, AggregationFn.AVERAGE.aggregate(p).get().lower(), EPS);
        assertEquals(0.8, AggregationFn.AVERAGE.aggregate(p).get().upper(), EPS);
        assertEquals(0.3, AggregationFn.AVERAGE_LOWER.aggregate(p).get().lower(), EPS);
        assertEquals(1.0, AggregationFn.AVERAGE_LOWER.aggregate(p).get().upper(), 0.0);
        assertEquals(Interval.of(0.4, 1.0), AggregationFn.MAXIMUM.aggregate(p).get());
        assertEquals(Interval.of(0.2, 0.6), AggregationFn.MINIMUM.aggregate(p).get());
    }

    @Test
    public void testInterpretationStyles() {
        List<Premise> p = premises(Interval.of(0.4, 0.8));
        Interval text = AggregationFn.TEXTUALISM_ALPHA.aggregate(p).get();
        assertEquals(0.4, text.lower(), EPS);
        assertEquals(0.78, text.upper(), EPS);

        Interval purpose = AggregationFn.PURPOSIVISM_ALPHA.aggregate(p).get();
        assertEquals(0.82, purpose.upper(), EPS);

        Interval lenity = AggregationFn.LENITY_ALPHA.aggregate(p).get();
        assertEquals(0.38, lenity.lower(), EPS);
        assertEquals(0.8, lenity.upper(), EPS);
    }

    @Test
    public void testPurposivismCappedAtOne() {
        Interval r = AggregationFn.PURPOSIVISM_ALPHA.aggregate(premises(Interval.of(0.0, 1.0))).get();
        assertEquals(1.0, r.upper(), 0.0);
    }

    @Test
    public void testFloors() {
        assertEquals(0.51, AggregationFn.LEGAL_BURDEN_CIVIL_051.floor(), 0.0);
        assertEquals(0.75, AggregationFn.LEGAL_BURDEN_CLEAR_075.floor(), 0.0);
        assertEquals(0.90, AggregationFn.LEGAL_BURDEN_CRIMINAL_090.floor(), 0.0);
        assertEquals(0.0, AggregationFn.AVERAGE.floor(), 0.0);
    }

    @Test
    public void testFromId() {
        assertSame(AggregationFn.LEGAL_CONSERVATIVE_MIN, AggregationFn.fromId("legal_conservative_min"));
        assertSame(AggregationFn.AVERAGE, AggregationFn.fromId(" AVERAGE "));
        assertEquals("precedent_weighted", AggregationFn.PRECEDENT_WEIGHTED.id());
    }

    @Test(expected = ConfigException.class)
    public void testUnknownIdRejected() {
        AggregationFn.fromId("majority_vote");
    }
}
