package com.sentinel.enginehealth.compiler;

import com.sentinel.enginehealth.api.model.Profile;
import com.sentinel.enginehealth.api.model.Rule;
import com.sentinel.enginehealth.api.model.Severity;
import com.sentinel.enginehealth.api.model.ThresholdTree;
import com.sentinel.enginehealth.compiler.store.InMemoryProfileStore;

import java.util.List;
import java.util.Map;

/**
 * Shared fixture: global-defaults <- family-x <- size-y.
 */
public final class TestProfiles {

    private TestProfiles() {
    }

    public static Profile globalDefaults() {
        return Profile.of("global-defaults", null,
                ThresholdTree.fromMap(Map.of(
                        "oilPressure", Map.of("warning", Map.of("min", 20)),
                        "battery", Map.of("warning", Map.of("min", 12.0, "max", 15.0)))),
                List.of(
                        Rule.builder("low-oil")
                                .name("Low Oil Pressure")
                                .severity(Severity.WARNING)
                                .condition("OILP_press", "<", 20)
                                .triggerPersistenceSec(2)
                                .build(),
                        Rule.builder("low-battery")
                                .name("Low Battery")
                                .condition("Vbat", "<", 11.5)
                                .build()));
    }

    public static Profile familyX() {
        return Profile.of("family-x", "global-defaults",
                ThresholdTree.fromMap(Map.of("oilPressure", Map.of("critical", Map.of("min", 10)))),
                List.of(Rule.builder("low-oil")
                        .name("Low Oil Pressure (family X)")
                        .severity(Severity.CRITICAL)
                        .condition("OILP_press", "<", 10)
                        .build()));
    }

    public static Profile sizeY() {
        return Profile.of("size-y", "family-x",
                ThresholdTree.fromMap(Map.of("coolantTemp", Map.of("warning", Map.of("max", 220)))),
                List.of(Rule.builder("hot-coolant")
                        .condition("ECT", ">", 220)
                        .build()));
    }

    public static InMemoryProfileStore store() {
        return InMemoryProfileStore.of(globalDefaults(), familyX(), sizeY());
    }
}
