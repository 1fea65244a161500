package com.sentinel.enginehealth.compiler.analysis;

import com.sentinel.enginehealth.api.model.Profile;
import com.sentinel.enginehealth.api.model.ResolvedProfile;
import com.sentinel.enginehealth.api.model.Rule;
import com.sentinel.enginehealth.api.model.ThresholdTree;
import com.sentinel.enginehealth.compiler.ProfileResolver;
import com.sentinel.enginehealth.compiler.TestProfiles;
import com.sentinel.enginehealth.compiler.store.InMemoryProfileStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ProfileComparatorTest {

    private final ProfileResolver resolver = new ProfileResolver();
    private final ProfileComparator comparator = new ProfileComparator();

    @Test
    @DisplayName("Should report a profile as identical to itself")
    void shouldBeIdenticalToItself() {
        ResolvedProfile resolved = resolver.resolve("size-y", TestProfiles.store());

        assertThat(comparator.compare(resolved, resolved).isIdentical()).isTrue();
    }

    @Test
    @DisplayName("Should list threshold and rule differences between siblings")
    void shouldCompareSiblings() {
        // Given
        InMemoryProfileStore store = InMemoryProfileStore.of(
                TestProfiles.globalDefaults(),
                Profile.of("left", "global-defaults",
                        ThresholdTree.fromMap(Map.of("oilPressure", Map.of("warning", Map.of("min", 25)))),
                        List.of(Rule.builder("only-left").condition("rpm", ">", 3000).build())),
                Profile.of("right", "global-defaults",
                        ThresholdTree.fromMap(Map.of("coolantTemp", Map.of("warning", Map.of("max", 210)))),
                        List.of(Rule.builder("low-oil").condition("OILP_press", "<", 5).build())));

        // When
        ProfileComparator.ProfileComparison comparison = comparator.compare(
                resolver.resolve("left", store), resolver.resolve("right", store));

        // Then
        assertThat(comparison.thresholdDifferences()).containsExactly(
                new ProfileComparator.ThresholdDifference("coolantTemp.warning.max", null, 210.0),
                new ProfileComparator.ThresholdDifference("oilPressure.warning.min", 25.0, 20.0));
        assertThat(comparison.rulesOnlyInLeft()).containsExactly("only-left");
        assertThat(comparison.rulesOnlyInRight()).isEmpty();
        assertThat(comparison.changedRules()).containsExactly("low-oil");
        assertThat(comparison.describe()).startsWith("left vs right: 2 threshold difference(s)");
    }
}
