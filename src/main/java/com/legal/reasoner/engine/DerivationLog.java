package com.legal.reasoner.engine;

import java.util.*;

import com.legal.reasoner.api.FactKey;
import com.legal.reasoner.api.FactRef;
import com.legal.reasoner.api.Interval;

/**
 * Append-only arena of {@link DerivationRecord}s.
 *
 * Records are addressed by their position ({@link DerivationRecord#id()}) and
 * indexed by the fact version they produced. Nothing is ever overwritten: a
 * later narrowing of the same fact gets its own record on top of the earlier
 * one.
 */
public final class DerivationLog {
    private final List<DerivationRecord> records = new ArrayList<>();
    private final Map<FactRef, Integer> byRef = new HashMap<>();
    private final Map<FactKey, List<Integer>> byKey = new TreeMap<>();

    /**
     * Appends a record for a fact version.
     *
     * @throws IllegalStateException if the version already has a record.
     */
    DerivationRecord append(Proposal winner, int timestep, Interval applied, Interval previous) {
        FactRef ref = new FactRef(winner.key(), timestep);
        if (byRef.containsKey(ref))
            throw new IllegalStateException("Derivation already recorded for " + ref);
        DerivationRecord r = new DerivationRecord(records.size(), winner.key(), timestep, winner.ruleId(), applied,
                previous, winner.premises());
        records.add(r);
        byRef.put(ref, r.id());
        byKey.computeIfAbsent(r.fact(), k -> new ArrayList<>()).add(r.id());
        return r;
    }

    public DerivationRecord get(int id) {
        return records.get(id);
    }

    /** The record that produced a fact version, if the version was derived. */
    public Optional<DerivationRecord> producing(FactRef ref) {
        Integer id = byRef.get(ref);
        return id == null ? Optional.empty() : Optional.of(records.get(id));
    }

    /** Every record for one fact, oldest first. */
    public List<DerivationRecord> forFact(FactKey key) {
        List<Integer> ids = byKey.get(key);
        if (ids == null)
            return List.of();
        List<DerivationRecord> out = new ArrayList<>(ids.size());
        for (int id : ids)
            out.add(records.get(id));
        return out;
    }

    public List<DerivationRecord> records() {
        return Collections.unmodifiableList(records);
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
