/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.compiler;

import com.sentinel.enginehealth.api.model.Profile;
import com.sentinel.enginehealth.api.model.Rule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deduplicates rules of an inheritance chain by rule id.
 *
 * <p>Profiles are applied root first. A rule with an id seen before replaces the
 * earlier rule entirely and keeps its position; new ids are appended.
 */
final class RuleMerger {

    private final Map<String, Rule> rules = new LinkedHashMap<>();
    private final Map<String, String> sources = new LinkedHashMap<>();

    void apply(Profile profile) {
        for (Rule rule : profile.rules()) {
            rules.put(rule.id(), rule);
            sources.put(rule.id(), profile.id());
        }
    }

    List<Rule> rules() {
        return Collections.unmodifiableList(new ArrayList<>(rules.values()));
    }

    Map<String, String> sources() {
        return Collections.unmodifiableMap(sources);
    }
}
