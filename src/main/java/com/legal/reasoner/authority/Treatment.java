package com.legal.reasoner.authority;

import com.legal.reasoner.api.ConfigException;

/** How a later decision treated the cited authority. */
public enum Treatment {
    FOLLOWED,
    AFFIRMED,
    NEUTRAL,
    DISTINGUISHED,
    QUESTIONED,
    LIMITED,
    CRITICIZED,
    OVERRULED;

    /** Parses a configuration or metadata key, e.g. {@code "overruled"}. */
    public static Treatment fromString(String s) {
        if (s == null || s.isBlank())
            throw new ConfigException("Treatment is missing");
        try {
            return valueOf(s.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new ConfigException(s, "Unknown treatment", e);
        }
    }
}
