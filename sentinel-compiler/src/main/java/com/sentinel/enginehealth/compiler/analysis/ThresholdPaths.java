package com.sentinel.enginehealth.compiler.analysis;

import com.sentinel.enginehealth.api.model.ThresholdTree;

import java.util.Map;
import java.util.TreeMap;

/**
 * Flattens a threshold tree into dotted leaf paths.
 */
final class ThresholdPaths {

    private ThresholdPaths() {
    }

    static Map<String, Object> flatten(ThresholdTree.Node tree) {
        Map<String, Object> leaves = new TreeMap<>();
        collect("", tree, leaves);
        return leaves;
    }

    private static void collect(String prefix, ThresholdTree.Node node, Map<String, Object> leaves) {
        node.children().forEach((key, child) -> {
            String path = prefix.isEmpty() ? key : prefix + "." + key;
            if (child instanceof ThresholdTree.Node nested) {
                collect(path, nested, leaves);
            } else {
                leaves.put(path, child.toPlain());
            }
        });
    }
}
