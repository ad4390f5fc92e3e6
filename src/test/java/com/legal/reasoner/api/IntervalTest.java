package com.legal.reasoner.api;

import org.junit.Test;

import static org.junit.Assert.*;

public class IntervalTest {

    @Test
    public void testConstructionAndAccessors() {
        Interval i = Interval.of(0.2, 0.5);
        assertEquals(0.2, i.lower(), 0.0);
        assertEquals(0.5, i.upper(), 0.0);
        assertFalse(i.isPoint());
        assertTrue(Interval.point(0.3).isPoint());
        assertEquals("[0.2,0.5]", i.toString());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testLowerAboveUpperRejected() {
        new Interval(0.6, 0.5);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeLowerRejected() {
        new Interval(-0.1, 0.5);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUpperAboveOneRejected() {
        new Interval(0.1, 1.01);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNaNRejected() {
        new Interval(Double.NaN, 0.5);
    }

    @Test
    public void testNegativeZeroIsCanonical() {
        assertEquals(Interval.point(0.0), Interval.point(-0.0));
        assertEquals(Interval.FALSE, new Interval(-0.0, 0.0));
    }

    @Test
    public void testIsValid() {
        assertTrue(Interval.isValid(0.0, 1.0));
        assertFalse(Interval.isValid(0.5, 0.4));
        assertFalse(Interval.isValid(0.5, Double.POSITIVE_INFINITY));
    }

    @Test
    public void testContains() {
        Interval outer = Interval.of(0.2, 0.8);
        assertTrue(outer.contains(Interval.of(0.3, 0.7)));
        assertTrue(outer.contains(outer));
        assertFalse(outer.contains(Interval.of(0.1, 0.7)));
        assertTrue(Interval.UNKNOWN.contains(Interval.TRUE));
    }

    @Test
    public void testIntersect() {
        assertEquals(Interval.of(0.4, 0.6), Interval.of(0.2, 0.6).intersect(Interval.of(0.4, 0.9)));
        assertEquals(Interval.point(0.5), Interval.of(0.2, 0.5).intersect(Interval.of(0.5, 0.9)));
    }

    @Test
    public void testDisjointIntersectIsNull() {
        assertNull(Interval.of(0.0, 0.3).intersect(Interval.of(0.5, 1.0)));
    }

    @Test
    public void testMostConservativeOrdering() {
        // narrower first
        assertTrue(Interval.of(0.4, 0.5).compareTo(Interval.of(0.2, 0.9)) < 0);
        // same width: lower upper first
        assertTrue(Interval.of(0.1, 0.3).compareTo(Interval.of(0.6, 0.8)) < 0);
        assertEquals(0, Interval.of(0.25, 0.75).compareTo(Interval.of(0.25, 0.75)));
    }
}
