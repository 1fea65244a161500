/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.compiler;

import com.sentinel.enginehealth.api.model.ThresholdTree;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deep merge of threshold trees.
 *
 * <p>Where both sides hold a node the merge recurses; anywhere else the override
 * wins outright, so lists and scalars are replaced wholesale. Keys present only in
 * the base are always kept. Trees never contain {@code null}, which means an
 * override can never erase a base value. Recursion follows the structure of the
 * override tree and therefore terminates.
 */
public final class ThresholdMerger {

    private ThresholdMerger() {
    }

    public static ThresholdTree.Node merge(ThresholdTree.Node base, ThresholdTree.Node override) {
        if (override.isEmpty()) {
            return base;
        }
        if (base.isEmpty()) {
            return override;
        }
        Map<String, ThresholdTree> merged = new LinkedHashMap<>(base.children());
        override.children().forEach((key, overrideChild) -> {
            ThresholdTree baseChild = merged.get(key);
            if (baseChild instanceof ThresholdTree.Node baseNode
                    && overrideChild instanceof ThresholdTree.Node overrideNode) {
                merged.put(key, merge(baseNode, overrideNode));
            } else {
                merged.put(key, overrideChild);
            }
        });
        return new ThresholdTree.Node(merged);
    }

    /**
     * Folds trees left to right, the last one winning.
     */
    public static ThresholdTree.Node mergeAll(List<ThresholdTree.Node> rootFirst) {
        ThresholdTree.Node result = ThresholdTree.Node.empty();
        for (ThresholdTree.Node tree : rootFirst) {
            result = merge(result, tree);
        }
        return result;
    }
}
