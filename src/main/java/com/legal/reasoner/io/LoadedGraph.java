package com.legal.reasoner.io;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import com.legal.reasoner.api.FactKey;
import com.legal.reasoner.api.Interval;
import com.legal.reasoner.graph.Graph;

/**
 * A parsed graph together with the timestep-0 facts its attributes carried.
 */
public record LoadedGraph(Graph graph, Map<FactKey, Interval> initialFacts) {

    public LoadedGraph {
        initialFacts = Collections.unmodifiableMap(new TreeMap<>(initialFacts));
    }
}
