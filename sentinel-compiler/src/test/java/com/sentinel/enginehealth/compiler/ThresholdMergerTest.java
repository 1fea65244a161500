package com.sentinel.enginehealth.compiler;

import com.sentinel.enginehealth.api.model.ThresholdTree;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ThresholdMergerTest {

    @Test
    @DisplayName("Should recurse into nodes present on both sides")
    void shouldMergeNestedNodes() {
        // Given
        ThresholdTree.Node base = ThresholdTree.fromMap(Map.of(
                "oilPressure", Map.of("warning", Map.of("min", 20, "max", 80))));
        ThresholdTree.Node override = ThresholdTree.fromMap(Map.of(
                "oilPressure", Map.of("warning", Map.of("max", 90))));

        // When
        ThresholdTree.Node merged = ThresholdMerger.merge(base, override);

        // Then
        assertThat(merged.numberAt("oilPressure.warning.min")).hasValue(20.0);
        assertThat(merged.numberAt("oilPressure.warning.max")).hasValue(90.0);
    }

    @Test
    @DisplayName("Should replace lists wholesale")
    void shouldReplaceLists() {
        ThresholdTree.Node base = ThresholdTree.fromMap(Map.of("gears", List.of(1, 2, 3)));
        ThresholdTree.Node override = ThresholdTree.fromMap(Map.of("gears", List.of(4)));

        ThresholdTree.Node merged = ThresholdMerger.merge(base, override);

        assertThat(merged.toPlain()).isEqualTo(Map.of("gears", List.of(4.0)));
    }

    @Test
    @DisplayName("Should let a scalar replace a subtree and the reverse")
    void shouldReplaceMismatchedShapes() {
        ThresholdTree.Node base = ThresholdTree.fromMap(Map.of("a", Map.of("x", 1), "b", 2));
        ThresholdTree.Node override = ThresholdTree.fromMap(Map.of("a", 5, "b", Map.of("y", 3)));

        ThresholdTree.Node merged = ThresholdMerger.merge(base, override);

        assertThat(merged.toPlain()).isEqualTo(Map.of("a", 5.0, "b", Map.of("y", 3.0)));
    }

    @Test
    @DisplayName("Should never erase a base value with a null override")
    void shouldIgnoreNullOverrides() {
        Map<String, Object> withNull = new HashMap<>();
        withNull.put("limit", null);
        ThresholdTree.Node base = ThresholdTree.fromMap(Map.of("limit", 7));

        ThresholdTree.Node merged = ThresholdMerger.merge(base, ThresholdTree.fromMap(withNull));

        assertThat(merged.numberAt("limit")).hasValue(7.0);
    }

    @Test
    @DisplayName("Should fold a chain root first with the last tree winning")
    void shouldMergeAllRootFirst() {
        ThresholdTree.Node merged = ThresholdMerger.mergeAll(List.of(
                ThresholdTree.fromMap(Map.of("v", 1, "root", 1)),
                ThresholdTree.fromMap(Map.of("v", 2)),
                ThresholdTree.fromMap(Map.of("v", 3))));

        assertThat(merged.toPlain()).isEqualTo(Map.of("v", 3.0, "root", 1.0));
        assertThat(ThresholdMerger.mergeAll(List.of()).isEmpty()).isTrue();
    }
}
