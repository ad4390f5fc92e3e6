package com.legal.reasoner.authority;

import com.legal.reasoner.api.ConfigException;

/** Rank of the court that issued the cited authority. */
public enum CourtLevel {
    HIGHEST,
    INTERMEDIATE_APPELLATE,
    TRIAL,
    ADMINISTRATIVE;

    public static CourtLevel fromString(String s) {
        if (s == null || s.isBlank())
            throw new ConfigException("Court level is missing");
        try {
            return valueOf(s.trim().toUpperCase().replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new ConfigException(s, "Unknown court level", e);
        }
    }
}
