package com.legal.reasoner.engine;

import java.util.List;

import com.legal.reasoner.api.FactKey;
import com.legal.reasoner.api.FactRef;
import com.legal.reasoner.api.Interval;

/**
 * One derivation event: rule {@code ruleId} changed {@code fact} to
 * {@code interval} at {@code timestep}, from {@code previous} (null for a new
 * label), using {@code premises}.
 *
 * Premises are fact references, not records, so cyclic support never creates
 * object cycles.
 */
public record DerivationRecord(int id, FactKey fact, int timestep, String ruleId, Interval interval,
        Interval previous, List<FactRef> premises) {

    public DerivationRecord {
        premises = List.copyOf(premises);
    }

    /** The fact version this record produced. */
    public FactRef ref() {
        return new FactRef(fact, timestep);
    }
}
