/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.api.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fully merged configuration of a leaf profile.
 *
 * @param profileId        leaf profile id
 * @param name             leaf display name
 * @param description      leaf description
 * @param metadata         leaf metadata
 * @param inheritanceChain profile ids, root first, leaf last
 * @param thresholds       thresholds of the whole chain merged root to leaf
 * @param rules            rules deduplicated by id, closest definition wins
 * @param ruleSources      rule id to the id of the profile that supplied it
 * @param warnings         non-fatal threshold validation findings
 */
public record ResolvedProfile(
        String profileId,
        String name,
        String description,
        ProfileMetadata metadata,
        List<String> inheritanceChain,
        ThresholdTree.Node thresholds,
        List<Rule> rules,
        Map<String, String> ruleSources,
        List<String> warnings) {

    public ResolvedProfile {
        inheritanceChain = List.copyOf(inheritanceChain);
        rules = List.copyOf(rules);
        ruleSources = Collections.unmodifiableMap(new LinkedHashMap<>(ruleSources));
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        metadata = metadata == null ? ProfileMetadata.EMPTY : metadata;
    }

    public Optional<Rule> rule(String ruleId) {
        return rules.stream().filter(r -> r.id().equals(ruleId)).findFirst();
    }

    /**
     * Whether {@code profileId} appears anywhere in this profile's chain.
     */
    public boolean inheritsFrom(String profileId) {
        return inheritanceChain.contains(profileId);
    }

    /**
     * Plain nested-map form of the whole resolved configuration.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("profileId", profileId);
        map.put("name", name);
        if (description != null) {
            map.put("description", description);
        }
        map.put("inheritanceChain", inheritanceChain);
        map.put("thresholds", thresholds.toPlain());
        List<Map<String, Object>> ruleMaps = new ArrayList<>(rules.size());
        for (Rule rule : rules) {
            Map<String, Object> ruleMap = rule.toMap();
            ruleMap.put("sourceProfile", ruleSources.get(rule.id()));
            ruleMaps.add(ruleMap);
        }
        map.put("anomalyRules", ruleMaps);
        return map;
    }
}
