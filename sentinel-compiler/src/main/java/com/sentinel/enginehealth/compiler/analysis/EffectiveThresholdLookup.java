package com.sentinel.enginehealth.compiler.analysis;

import com.sentinel.enginehealth.api.IProfileStore;
import com.sentinel.enginehealth.api.model.Profile;
import com.sentinel.enginehealth.api.model.ThresholdTree;
import com.sentinel.enginehealth.compiler.ProfileResolver;
import com.sentinel.enginehealth.compiler.ThresholdMerger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Answers "which value applies to this path, and which profile set it".
 */
public class EffectiveThresholdLookup {

    /**
     * @param path            dotted threshold path
     * @param value           merged value in plain form (a map for a subtree)
     * @param sourceProfileId closest profile in the chain that defines the path
     */
    public record EffectiveThreshold(String path, Object value, String sourceProfileId) {
    }

    private final IProfileStore store;

    public EffectiveThresholdLookup(IProfileStore store) {
        this.store = store;
    }

    public Optional<EffectiveThreshold> lookup(String leafProfileId, String path) {
        List<Profile> leafFirst = ProfileResolver.ancestorChain(leafProfileId, store);
        String source = null;
        for (Profile profile : leafFirst) {
            if (profile.thresholds().find(path).isPresent()) {
                source = profile.id();
                break;
            }
        }
        if (source == null) {
            return Optional.empty();
        }
        List<Profile> rootFirst = new ArrayList<>(leafFirst);
        Collections.reverse(rootFirst);
        ThresholdTree.Node merged = ThresholdMerger.mergeAll(rootFirst.stream().map(Profile::thresholds).toList());
        String sourceId = source;
        return merged.find(path).map(tree -> new EffectiveThreshold(path, tree.toPlain(), sourceId));
    }
}
