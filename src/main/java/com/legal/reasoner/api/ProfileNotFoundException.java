package com.legal.reasoner.api;

/** Export was requested under a redaction profile that is not registered. */
public class ProfileNotFoundException extends ReasonerException {
    private final String profile;

    public ProfileNotFoundException(String profile) {
        super("Unknown redaction profile: " + profile);
        this.profile = profile;
    }

    public String profile() {
        return profile;
    }
}
