/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.compiler.analysis;

import com.sentinel.enginehealth.api.model.ResolvedProfile;
import com.sentinel.enginehealth.api.model.Rule;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Compares two resolved profiles threshold by threshold and rule by rule.
 */
public class ProfileComparator {

    /**
     * A threshold leaf whose value differs. A side without the path holds {@code null}.
     */
    public record ThresholdDifference(String path, Object left, Object right) {
    }

    public record ProfileComparison(
            String leftProfileId,
            String rightProfileId,
            List<ThresholdDifference> thresholdDifferences,
            List<String> rulesOnlyInLeft,
            List<String> rulesOnlyInRight,
            List<String> changedRules) {

        public boolean isIdentical() {
            return thresholdDifferences.isEmpty() && rulesOnlyInLeft.isEmpty()
                    && rulesOnlyInRight.isEmpty() && changedRules.isEmpty();
        }

        public String describe() {
            return String.format("%s vs %s: %d threshold difference(s), %d/%d exclusive rule(s), %d changed rule(s)",
                    leftProfileId, rightProfileId, thresholdDifferences.size(),
                    rulesOnlyInLeft.size(), rulesOnlyInRight.size(), changedRules.size());
        }
    }

    public ProfileComparison compare(ResolvedProfile left, ResolvedProfile right) {
        Map<String, Object> leftLeaves = ThresholdPaths.flatten(left.thresholds());
        Map<String, Object> rightLeaves = ThresholdPaths.flatten(right.thresholds());

        Set<String> paths = new TreeSet<>(leftLeaves.keySet());
        paths.addAll(rightLeaves.keySet());
        List<ThresholdDifference> differences = new ArrayList<>();
        for (String path : paths) {
            Object l = leftLeaves.get(path);
            Object r = rightLeaves.get(path);
            if (!Objects.equals(l, r)) {
                differences.add(new ThresholdDifference(path, l, r));
            }
        }

        Map<String, Rule> leftRules = byId(left.rules());
        Map<String, Rule> rightRules = byId(right.rules());
        List<String> onlyLeft = new ArrayList<>();
        List<String> changed = new ArrayList<>();
        for (Map.Entry<String, Rule> entry : leftRules.entrySet()) {
            Rule other = rightRules.get(entry.getKey());
            if (other == null) {
                onlyLeft.add(entry.getKey());
            } else if (!other.equals(entry.getValue())) {
                changed.add(entry.getKey());
            }
        }
        List<String> onlyRight = rightRules.keySet().stream()
                .filter(id -> !leftRules.containsKey(id))
                .sorted()
                .collect(Collectors.toList());

        return new ProfileComparison(left.profileId(), right.profileId(), differences,
                onlyLeft, onlyRight, changed);
    }

    private static Map<String, Rule> byId(List<Rule> rules) {
        return rules.stream().collect(Collectors.toMap(Rule::id, Function.identity(),
                (a, b) -> b, java.util.TreeMap::new));
    }
}
