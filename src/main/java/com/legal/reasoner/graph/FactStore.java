package com.legal.reasoner.graph;

import java.util.*;

import com.legal.reasoner.api.EdgeRef;
import com.legal.reasoner.api.EntityRef;
import com.legal.reasoner.api.FactKey;
import com.legal.reasoner.api.FactRef;
import com.legal.reasoner.api.Interval;
import com.legal.reasoner.api.InvariantViolationException;
import com.legal.reasoner.rule.Clause;
import com.legal.reasoner.rule.RuleHead;

/**
 * FactStore: the versioned, per-run fact table over one {@link Graph}.
 *
 * <p>
 * Every (entity, label) slot keeps an append-only list of versions, one per
 * timestep at which its interval changed. A read at timestep {@code t} sees the
 * latest version at or before {@code t}; writes for {@code t+1} are therefore
 * invisible to readers of {@code t}, which is what lets a whole step read a
 * frozen interpretation while the next one is being assembled.
 *
 * <h3>Monotonicity</h3>
 * {@link #setFact} only accepts an interval contained in the current one,
 * unless the write is an explicit replacement. Versions are never rewritten at
 * an earlier timestep.
 *
 * <p>
 * A store is owned by exactly one run. Concurrent reads are safe while no
 * write is in progress; writes are not synchronized.
 */
public final class FactStore {
    private final Graph graph;
    private final NavigableMap<FactKey, History> facts = new TreeMap<>();

    public FactStore(Graph graph) {
        this.graph = graph;
    }

    public Graph graph() {
        return graph;
    }

    /**
     * Value of a fact as of timestep {@code t}.
     */
    public Optional<Interval> getFact(EntityRef entity, String label, int t) {
        return getFact(new FactKey(entity, label), t);
    }

    public Optional<Interval> getFact(FactKey key, int t) {
        History h = facts.get(key);
        if (h == null)
            return Optional.empty();
        int i = h.indexAt(t);
        return i < 0 ? Optional.empty() : Optional.of(h.values.get(i));
    }

    /**
     * The version of a fact visible at timestep {@code t}, as a reference.
     */
    public Optional<FactRef> versionAt(FactKey key, int t) {
        History h = facts.get(key);
        if (h == null)
            return Optional.empty();
        int i = h.indexAt(t);
        return i < 0 ? Optional.empty() : Optional.of(new FactRef(key, h.timesteps.get(i)));
    }

    /**
     * Writes a narrowing update.
     *
     * @throws InvariantViolationException if the interval widens the current
     *                                     value or {@code t} is in the past.
     */
    public void setFact(EntityRef entity, String label, int t, Interval interval) {
        setFact(new FactKey(entity, label), t, interval, false);
    }

    /**
     * Writes a fact version at timestep {@code t}.
     *
     * @param replace true for an explicit replacement (rule supersession), which
     *                may move the interval anywhere inside [0, 1].
     * @return true if the visible value changed.
     * @throws InvariantViolationException if the update breaks monotonicity.
     * @throws IllegalArgumentException    if the entity is not in the graph.
     */
    public boolean setFact(FactKey key, int t, Interval interval, boolean replace) {
        if (interval == null)
            throw new IllegalArgumentException("Interval is null for " + key);
        if (t < 0)
            throw new IllegalArgumentException("Negative timestep " + t + " for " + key);
        if (!graph.contains(key.entity()))
            throw new IllegalArgumentException("Unknown entity: " + key.entity().id());

        History h = facts.get(key);
        if (h == null) {
            h = new History();
            facts.put(key, h);
            h.append(t, interval);
            return true;
        }

        int last = h.timesteps.size() - 1;
        int lastT = h.timesteps.get(last);
        Interval current = h.values.get(last);
        if (t < lastT)
            throw new InvariantViolationException(key, t,
                    "fact history is append-only, latest version is at t=" + lastT);
        if (!replace && !current.contains(interval))
            throw new InvariantViolationException(key, t,
                    "update " + interval + " is not contained in current value " + current);
        if (current.equals(interval))
            return false;

        if (t == lastT)
            h.values.set(last, interval);
        else
            h.append(t, interval);
        return true;
    }

    /**
     * Candidate premises for one clause relative to a target entity, as of
     * timestep {@code t}, sorted by source. Only entities carrying the clause
     * label are candidates; thresholds are applied by the caller.
     */
    public List<Premise> matchClause(EntityRef target, Clause clause, int t) {
        List<Premise> out = new ArrayList<>();
        switch (clause.pattern()) {
            case SELF -> addPremise(out, target, null, clause, t);
            case OUT_NEIGHBOR -> {
                for (EdgeRef e : graph.outEdges(target.id(), clause.edgeType()))
                    addPremise(out, e.targetNode(), e, clause, t);
            }
            case IN_NEIGHBOR -> {
                for (EdgeRef e : graph.inEdges(target.id(), clause.edgeType()))
                    addPremise(out, e.sourceNode(), e, clause, t);
            }
            case OUT_EDGE -> {
                for (EdgeRef e : graph.outEdges(target.id(), clause.edgeType()))
                    addPremise(out, e, null, clause, t);
            }
            case IN_EDGE -> {
                for (EdgeRef e : graph.inEdges(target.id(), clause.edgeType()))
                    addPremise(out, e, null, clause, t);
            }
            case EDGE_SOURCE -> addPremise(out, target.asEdge().sourceNode(), target, clause, t);
            case EDGE_TARGET -> addPremise(out, target.asEdge().targetNode(), target, clause, t);
        }
        Collections.sort(out);
        return out;
    }

    /**
     * Adds the premise on {@code entity} if it carries the clause label. The
     * precedent weight is read from the connecting entity (the traversed edge)
     * first, then from the premise entity.
     */
    private void addPremise(List<Premise> out, EntityRef entity, EntityRef via, Clause clause, int t) {
        FactKey key = new FactKey(entity, clause.label());
        History h = facts.get(key);
        if (h == null)
            return;
        int i = h.indexAt(t);
        if (i < 0)
            return;
        Double weight = null;
        if (clause.weightAttribute() != null) {
            if (via != null)
                weight = graph.numericAttribute(via, clause.weightAttribute());
            if (weight == null)
                weight = graph.numericAttribute(entity, clause.weightAttribute());
        }
        out.add(new Premise(new FactRef(key, h.timesteps.get(i)), h.values.get(i), weight));
    }

    /** Candidate targets for a rule head, sorted by id. */
    public List<EntityRef> targets(RuleHead head) {
        List<EntityRef> out = new ArrayList<>();
        switch (head.kind()) {
            case NODE -> {
                for (GraphNode n : graph.nodes())
                    out.add(n.ref());
            }
            case EDGE -> {
                for (GraphEdge e : graph.edges())
                    if (head.edgeType() == null || head.edgeType().equals(e.type()))
                        out.add(e.ref());
            }
        }
        return out;
    }

    /** The full fact assignment as of timestep {@code t}, sorted by key. */
    public SortedMap<FactKey, Interval> snapshot(int t) {
        SortedMap<FactKey, Interval> out = new TreeMap<>();
        for (Map.Entry<FactKey, History> e : facts.entrySet()) {
            int i = e.getValue().indexAt(t);
            if (i >= 0)
                out.put(e.getKey(), e.getValue().values.get(i));
        }
        return out;
    }

    /** All versions of a fact, oldest first. */
    public List<FactRef> versions(FactKey key) {
        History h = facts.get(key);
        if (h == null)
            return List.of();
        List<FactRef> out = new ArrayList<>(h.timesteps.size());
        for (int ts : h.timesteps)
            out.add(new FactRef(key, ts));
        return out;
    }

    public int factCount() {
        return facts.size();
    }

    /** Version list for one slot. Timesteps are strictly increasing. */
    private static final class History {
        final List<Integer> timesteps = new ArrayList<>(4);
        final List<Interval> values = new ArrayList<>(4);

        void append(int t, Interval v) {
            timesteps.add(t);
            values.add(v);
        }

        /** Index of the latest version at or before {@code t}, or -1. */
        int indexAt(int t) {
            int lo = 0, hi = timesteps.size() - 1, found = -1;
            while (lo <= hi) {
                int mid = (lo + hi) >>> 1;
                if (timesteps.get(mid) <= t) {
                    found = mid;
                    lo = mid + 1;
                } else {
                    hi = mid - 1;
                }
            }
            return found;
        }
    }
}
