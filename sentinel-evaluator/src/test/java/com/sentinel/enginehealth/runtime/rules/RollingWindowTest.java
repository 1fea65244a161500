package com.sentinel.enginehealth.runtime.rules;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class RollingWindowTest {

    @Test
    @DisplayName("Should accumulate only true intervals")
    void shouldAccumulateTrueIntervals() {
        RollingWindow window = new RollingWindow(10);

        window.add(0, 1, true);
        window.add(1, 2, false);
        window.add(2, 3, true);

        assertThat(window.trueSeconds()).isEqualTo(2.0);
        assertThat(window.intervalCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should merge adjacent true intervals")
    void shouldMergeAdjacentIntervals() {
        RollingWindow window = new RollingWindow(10);

        window.add(0, 1, true);
        window.add(1, 2.5, true);

        assertThat(window.intervalCount()).isEqualTo(1);
        assertThat(window.trueSeconds()).isEqualTo(2.5);
    }

    @Test
    @DisplayName("Should evict and trim intervals that leave the window")
    void shouldEvictOldIntervals() {
        RollingWindow window = new RollingWindow(10);
        window.add(0, 1, true);
        window.add(2, 3, true);

        window.add(3, 12, false);
        assertThat(window.trueSeconds()).isEqualTo(1.0);

        window.add(12, 12.5, false);
        assertThat(window.trueSeconds()).isCloseTo(0.5, within(1e-9));

        window.add(12.5, 20, false);
        assertThat(window.trueSeconds()).isZero();
        assertThat(window.intervalCount()).isZero();
    }

    @Test
    @DisplayName("Should reject a non-positive window")
    void shouldRejectBadWindow() {
        assertThatThrownBy(() -> new RollingWindow(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
