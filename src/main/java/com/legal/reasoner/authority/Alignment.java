package com.legal.reasoner.authority;

import com.legal.reasoner.api.ConfigException;

/**
 * Relationship between the citing and the cited jurisdiction, strongest first.
 */
public enum Alignment {
    /** Same jurisdiction. */
    EXACT,
    /** One jurisdiction is an ancestor of the other. */
    ANCESTOR,
    /** Distinct jurisdictions sharing a common ancestor. */
    SIBLING,
    /** No relationship. */
    FOREIGN;

    public static Alignment fromString(String s) {
        if (s == null || s.isBlank())
            throw new ConfigException("Alignment is missing");
        try {
            return valueOf(s.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new ConfigException(s, "Unknown jurisdiction alignment", e);
        }
    }
}
