package com.legal.reasoner.io;

import java.util.Map;
import java.util.Set;

import com.legal.reasoner.authority.AuthorityTables;
import com.legal.reasoner.authority.JurisdictionHierarchy;
import com.legal.reasoner.engine.EngineConfig;
import com.legal.reasoner.export.RedactionProfile;

/**
 * Fully validated configuration, ready to be passed into the calculator,
 * engine, loader and exporter constructors.
 */
public record ReasonerConfig(AuthorityTables authority, JurisdictionHierarchy hierarchy,
        Map<String, RedactionProfile> profiles, Set<String> metadataKeys, EngineConfig engine) {

    public ReasonerConfig {
        profiles = Map.copyOf(profiles);
        metadataKeys = Set.copyOf(metadataKeys);
    }
}
