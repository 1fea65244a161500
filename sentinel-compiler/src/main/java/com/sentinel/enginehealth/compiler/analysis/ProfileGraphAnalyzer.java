package com.sentinel.enginehealth.compiler.analysis;

import com.sentinel.enginehealth.api.IProfileStore;
import com.sentinel.enginehealth.api.model.Profile;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Checks that the profiles of a store form a single-rooted forest.
 */
public class ProfileGraphAnalyzer {

    public record GraphReport(
            List<String> roots,
            Map<String, String> danglingParents,
            List<List<String>> cycles) {

        /**
         * True when there is exactly one root, no dangling parent and no cycle.
         */
        public boolean isHealthy() {
            return roots.size() == 1 && danglingParents.isEmpty() && cycles.isEmpty();
        }
    }

    public GraphReport analyze(IProfileStore store) {
        Map<String, Profile> profiles = new LinkedHashMap<>();
        for (String id : store.listProfileIds()) {
            store.getProfile(id).ifPresent(p -> profiles.put(id, p));
        }

        List<String> roots = new ArrayList<>();
        Map<String, String> dangling = new TreeMap<>();
        for (Profile profile : profiles.values()) {
            if (profile.isRoot()) {
                roots.add(profile.id());
            } else if (!profiles.containsKey(profile.parentId())) {
                dangling.put(profile.id(), profile.parentId());
            }
        }

        List<List<String>> cycles = new ArrayList<>();
        Set<String> settled = new LinkedHashSet<>();
        for (String start : profiles.keySet()) {
            findCycle(start, profiles, settled).ifPresent(cycles::add);
        }
        return new GraphReport(roots, dangling, cycles);
    }

    private Optional<List<String>> findCycle(String start, Map<String, Profile> profiles, Set<String> settled) {
        List<String> path = new ArrayList<>();
        String current = start;
        while (current != null && profiles.containsKey(current) && !settled.contains(current)) {
            int seen = path.indexOf(current);
            if (seen >= 0) {
                List<String> cycle = new ArrayList<>(path.subList(seen, path.size()));
                cycle.add(current);
                settled.addAll(path);
                return Optional.of(cycle);
            }
            path.add(current);
            current = profiles.get(current).parentId();
        }
        settled.addAll(path);
        return Optional.empty();
    }
}
