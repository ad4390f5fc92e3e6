package com.legal.reasoner.export;

import com.legal.reasoner.api.ConfigException;

/** What a redaction profile does to one exported field. */
public enum RedactionAction {
    /** Remove the field. */
    DROP,
    /** Replace the value with its SHA-256 hex digest. */
    HASH,
    /** Keep only the first {@code truncateLength} characters. */
    TRUNCATE;

    public static RedactionAction fromString(String s) {
        if (s == null || s.isBlank())
            throw new ConfigException("Redaction action is missing");
        try {
            return valueOf(s.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new ConfigException(s, "Unknown redaction action", e);
        }
    }
}
