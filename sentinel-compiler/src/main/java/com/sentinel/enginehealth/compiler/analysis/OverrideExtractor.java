package com.sentinel.enginehealth.compiler.analysis;

import com.sentinel.enginehealth.api.model.ThresholdTree;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Computes the smallest override tree that turns a base tree into an edited one.
 *
 * <p>Merging the result onto the base reproduces every value of the edited tree.
 * Keys removed in the edited tree are not represented, since an override cannot erase.
 */
public class OverrideExtractor {

    public ThresholdTree.Node extract(ThresholdTree.Node base, ThresholdTree.Node edited) {
        Map<String, ThresholdTree> overrides = new LinkedHashMap<>();
        edited.children().forEach((key, editedChild) -> {
            ThresholdTree baseChild = base == null ? null : base.children().get(key);
            if (editedChild instanceof ThresholdTree.Node editedNode) {
                ThresholdTree.Node nestedBase = baseChild instanceof ThresholdTree.Node n ? n : null;
                ThresholdTree.Node nested = extract(nestedBase, editedNode);
                if (!nested.isEmpty()) {
                    overrides.put(key, nested);
                }
            } else if (!Objects.equals(baseChild, editedChild)) {
                overrides.put(key, editedChild);
            }
        });
        return new ThresholdTree.Node(overrides);
    }
}
