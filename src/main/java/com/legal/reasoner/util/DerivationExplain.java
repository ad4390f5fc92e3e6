package com.legal.reasoner.util;

import java.util.*;

import com.legal.reasoner.api.FactKey;
import com.legal.reasoner.api.FactRef;
import com.legal.reasoner.api.Interval;
import com.legal.reasoner.engine.DerivationLog;
import com.legal.reasoner.engine.DerivationRecord;
import com.legal.reasoner.engine.Interpretation;

/**
 * Diagnostic utility for answering "why does this fact hold?".
 *
 * <p>
 * Walks the derivation records of an {@link Interpretation} back to the
 * timestep-0 facts. Records reference premises by fact version, so the walk
 * needs no object graph; repeated versions are printed once and referenced
 * afterwards.
 *
 * <p>
 * <b>Usage:</b> debugging and audit tooling. Do <b>not</b> use on the hot
 * path (allocates strings, iterates the whole log).
 */
public final class DerivationExplain {
    private final Interpretation interpretation;
    private final DerivationLog log;

    public DerivationExplain(Interpretation interpretation) {
        this.interpretation = interpretation;
        this.log = interpretation.derivations();
    }

    /**
     * Explains the final value of a fact as an indented provenance tree.
     */
    public String why(FactKey key) {
        StringBuilder sb = new StringBuilder(256);
        Interval value = interpretation.facts().get(key);
        if (value == null)
            return sb.append(key.statement()).append(" does not hold\n").toString();

        List<DerivationRecord> records = log.forFact(key);
        if (records.isEmpty())
            return sb.append(key.statement()).append(" = ").append(value).append(" (given)\n").toString();

        DerivationRecord last = records.get(records.size() - 1);
        walk(last.ref(), 0, new HashSet<>(), sb);
        return sb.toString();
    }

    private void walk(FactRef ref, int depth, Set<FactRef> seen, StringBuilder sb) {
        indent(sb, depth);
        if (depth > 0)
            sb.append("<- ");
        sb.append(ref);
        Optional<DerivationRecord> rec = log.producing(ref);
        if (rec.isEmpty()) {
            sb.append(" (given)\n");
            return;
        }
        DerivationRecord r = rec.get();
        sb.append(" = ").append(r.interval()).append(" by ").append(r.ruleId());
        if (r.previous() != null)
            sb.append(", narrowed from ").append(r.previous());
        if (!seen.add(ref)) {
            sb.append(" (see above)\n");
            return;
        }
        sb.append('\n');
        for (FactRef p : r.premises())
            walk(p, depth + 1, seen, sb);
    }

    private static void indent(StringBuilder sb, int depth) {
        for (int i = 0; i < depth; i++)
            sb.append("  ");
    }

    /**
     * Dumps every final fact with its derivation count.
     */
    public String dumpFacts() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Interpretation (").append(interpretation.facts().size()).append(" facts, t=")
                .append(interpretation.timestep()).append(", ").append(interpretation.status()).append("):\n");
        for (Map.Entry<FactKey, Interval> e : interpretation.facts().entrySet()) {
            sb.append("  ").append(e.getKey().statement()).append(" = ").append(e.getValue());
            int n = log.forFact(e.getKey()).size();
            if (n > 0)
                sb.append("  (").append(n).append(n == 1 ? " derivation)" : " derivations)");
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid JS diagram of fact-to-fact support, one edge per
     * (premise, conclusion, rule).
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph LR;\n");

        SortedSet<FactKey> facts = new TreeSet<>();
        SortedSet<String> edges = new TreeSet<>();
        for (DerivationRecord r : log.records()) {
            facts.add(r.fact());
            for (FactRef p : r.premises()) {
                facts.add(p.key());
                edges.add("  " + sanitize(p.key().statement()) + " -- \"" + r.ruleId() + "\" --> "
                        + sanitize(r.fact().statement()) + ";\n");
            }
        }

        // 1. Declare facts with their final values
        for (FactKey k : facts) {
            Interval v = interpretation.facts().get(k);
            sb.append("  ").append(sanitize(k.statement())).append("[\"").append(k.statement());
            if (v != null)
                sb.append("<br/>").append(String.format(Locale.ROOT, "[%.4f, %.4f]", v.lower(), v.upper()));
            sb.append("\"];\n");
        }
        // 2. Then the support edges
        for (String e : edges)
            sb.append(e);
        return sb.toString();
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9_]", "_");
    }
}
