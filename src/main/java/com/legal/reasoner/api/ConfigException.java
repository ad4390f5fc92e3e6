package com.legal.reasoner.api;

/**
 * Malformed or unknown configuration: aggregation id, clause, rule, weight
 * table or redaction profile. Always raised before any evaluation starts.
 */
public class ConfigException extends ReasonerException {
    private final String key;

    public ConfigException(String message) {
        this(null, message);
    }

    public ConfigException(String key, String message) {
        super(key == null ? message : message + " (key=" + key + ")");
        this.key = key;
    }

    public ConfigException(String key, String message, Throwable cause) {
        super(key == null ? message : message + " (key=" + key + ")", cause);
        this.key = key;
    }

    /** The offending configuration key or rule id, or null if not applicable. */
    public String key() {
        return key;
    }
}
