/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.api.model;

import java.util.List;
import java.util.Objects;

/**
 * A named, inheritable bundle of thresholds and rules, as kept by the profile store.
 *
 * @param id          unique id, lowercase letters, digits and dashes
 * @param name        display name
 * @param parentId    parent profile id, {@code null} for the root
 * @param description free text
 * @param metadata    fleet-segment descriptors
 * @param thresholds  threshold overrides defined at this level
 * @param rules       rules defined at this level
 */
public record Profile(
        String id,
        String name,
        String parentId,
        String description,
        ProfileMetadata metadata,
        ThresholdTree.Node thresholds,
        List<Rule> rules) {

    public Profile {
        Objects.requireNonNull(id, "id");
        metadata = metadata == null ? ProfileMetadata.EMPTY : metadata;
        thresholds = thresholds == null ? ThresholdTree.Node.empty() : thresholds;
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    public static Profile of(String id, String parentId, ThresholdTree.Node thresholds, List<Rule> rules) {
        return new Profile(id, id, parentId, null, ProfileMetadata.EMPTY, thresholds, rules);
    }

    public boolean isRoot() {
        return parentId == null;
    }
}
