package com.legal.reasoner.authority;

import java.util.*;

import com.legal.reasoner.api.ConfigException;

/**
 * Parent links between jurisdictions, e.g. {@code US-CA -> US}. A
 * jurisdiction may have several parents; cycles are tolerated.
 */
public final class JurisdictionHierarchy {
    public static final JurisdictionHierarchy EMPTY = new JurisdictionHierarchy(Map.of());

    private final Map<String, List<String>> parents;

    public JurisdictionHierarchy(Map<String, List<String>> parents) {
        if (parents == null)
            throw new ConfigException("hierarchy", "Jurisdiction hierarchy is missing");
        Map<String, List<String>> copy = new TreeMap<>();
        for (Map.Entry<String, List<String>> e : parents.entrySet()) {
            if (e.getKey() == null || e.getKey().isBlank())
                throw new ConfigException("hierarchy", "Blank jurisdiction in hierarchy");
            List<String> ps = e.getValue() == null ? List.of() : e.getValue();
            for (String p : ps)
                if (p == null || p.isBlank())
                    throw new ConfigException("hierarchy." + e.getKey(), "Blank parent jurisdiction");
            copy.put(e.getKey().trim(), List.copyOf(ps));
        }
        this.parents = Collections.unmodifiableMap(copy);
    }

    /**
     * The jurisdiction followed by all its ancestors, breadth first, without
     * duplicates. Empty for a blank jurisdiction.
     */
    public List<String> lineage(String jurisdiction) {
        List<String> out = new ArrayList<>();
        if (jurisdiction == null || jurisdiction.isBlank())
            return out;
        Set<String> seen = new HashSet<>();
        Deque<String> frontier = new ArrayDeque<>();
        frontier.add(jurisdiction.trim());
        while (!frontier.isEmpty()) {
            String cur = frontier.poll();
            if (!seen.add(cur))
                continue;
            out.add(cur);
            for (String p : parents.getOrDefault(cur, List.of()))
                if (!seen.contains(p))
                    frontier.add(p.trim());
        }
        return out;
    }

    /**
     * Classifies a citation from {@code source} to {@code target}. If either
     * side is unknown (blank) the citation is treated as exact.
     */
    public Alignment alignment(String source, String target) {
        if (source == null || source.isBlank() || target == null || target.isBlank())
            return Alignment.EXACT;
        String s = source.trim();
        String d = target.trim();
        if (s.equals(d))
            return Alignment.EXACT;

        List<String> srcLine = lineage(s);
        List<String> dstLine = lineage(d);
        List<String> srcAncestors = srcLine.subList(1, srcLine.size());
        List<String> dstAncestors = dstLine.subList(1, dstLine.size());
        if (srcAncestors.contains(d) || dstAncestors.contains(s))
            return Alignment.ANCESTOR;
        for (String a : srcAncestors)
            if (dstAncestors.contains(a))
                return Alignment.SIBLING;
        return Alignment.FOREIGN;
    }

    public Map<String, List<String>> parents() {
        return parents;
    }
}
