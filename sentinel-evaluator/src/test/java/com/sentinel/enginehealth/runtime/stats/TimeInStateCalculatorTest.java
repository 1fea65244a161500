package com.sentinel.enginehealth.runtime.stats;

import com.sentinel.enginehealth.api.model.EngineStateConfig;
import com.sentinel.enginehealth.api.model.Recording;
import com.sentinel.enginehealth.api.model.StateDwell;
import com.sentinel.enginehealth.api.model.TimeInState;
import com.sentinel.enginehealth.infra.config.AnalysisSettings;
import com.sentinel.enginehealth.runtime.Recordings;
import com.sentinel.enginehealth.runtime.state.EngineStateClassifier;
import com.sentinel.enginehealth.runtime.state.EngineStateTimeline;
import com.sentinel.enginehealth.runtime.validity.ValidityMask;
import com.sentinel.enginehealth.runtime.validity.ValidityMasker;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TimeInStateCalculatorTest {

    private final TimeInStateCalculator calculator = new TimeInStateCalculator(10.0);

    @Test
    @DisplayName("Should credit each interval to the earlier sample and drop stale gaps")
    void shouldMeasureWallClockDwell() {
        // Given
        double[] times = {0, 1, 1.5, 3, 15};
        String[] labels = {"A", "A", "B", "B", "B"};

        // When
        TimeInState result = calculator.calculate("mode", times, labels);

        // Then
        assertThat(result.totalSeconds()).isEqualTo(3.0);
        assertThat(result.state("A")).get().satisfies(a -> {
            assertThat(a.seconds()).isEqualTo(1.5);
            assertThat(a.percentage()).isEqualTo(50.0);
            assertThat(a.transitions()).isZero();
        });
        assertThat(result.state("B")).get().satisfies(b -> {
            assertThat(b.seconds()).isEqualTo(1.5);
            assertThat(b.transitions()).isEqualTo(1);
        });
    }

    @Test
    @DisplayName("Should not be biased by the sample rate")
    void shouldIgnoreSampleDensity() {
        // A is sampled ten times as often as B but both last one second
        double[] times = {0, 0.1, 0.2, 0.3, 0.4, 0.5, 0.6, 0.7, 0.8, 0.9, 1.0, 2.0};
        String[] labels = {"A", "A", "A", "A", "A", "A", "A", "A", "A", "A", "B", "B"};

        TimeInState result = calculator.calculate("mode", times, labels);

        assertThat(result.state("A")).get()
                .satisfies(a -> assertThat(a.seconds()).isCloseTo(1.0, within(1e-9)));
        assertThat(result.state("B")).get().extracting(StateDwell::seconds).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should skip intervals that start at an unlabeled sample")
    void shouldSkipUnlabeledIntervals() {
        TimeInState result = calculator.calculate("mode", new double[]{0, 1, 2}, new String[]{"A", null, "A"});

        assertThat(result.totalSeconds()).isEqualTo(1.0);
        assertThat(result.state("A")).get().extracting(StateDwell::transitions).isEqualTo(0);
    }

    @Test
    @DisplayName("Should reject mismatched inputs")
    void shouldRejectMismatchedInputs() {
        assertThatThrownBy(() -> calculator.calculate("mode", new double[]{0, 1}, new String[]{"A"}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should report time spent in each engine state")
    void shouldMeasureEngineStates() {
        // Given
        Recording recording = Recordings.engineCycle("cycle").build();
        EngineStateTimeline timeline = new EngineStateClassifier(EngineStateConfig.defaults()).classify(recording);

        // When
        TimeInState result = calculator.forEngineState(recording, timeline);

        // Then
        assertThat(result.channel()).isEqualTo("EngineState");
        assertThat(result.totalSeconds()).isEqualTo(11.0);
        assertThat(result.state("CRANKING")).get().extracting(StateDwell::seconds).isEqualTo(2.0);
        assertThat(result.state("UNSTABLE")).get().extracting(StateDwell::seconds).isEqualTo(2.0);
        assertThat(result.state("STABLE")).get().extracting(StateDwell::seconds).isEqualTo(6.5);
        assertThat(result.state("STOPPING")).get().extracting(StateDwell::seconds).isEqualTo(0.5);
    }

    @Test
    @DisplayName("Should label channel values by their rounded value")
    void shouldLabelRoundedChannelValues() {
        // Given
        Recording recording = Recordings.builder("modes")
                .at(0).with("rpm", 0).with("Vsw", 12).with("fuel_ctl_mode", 1.0)
                .at(1).with("rpm", 0).with("Vsw", 12).with("fuel_ctl_mode", 0.9)
                .at(2).with("rpm", 0).with("Vsw", 12).with("fuel_ctl_mode", 3.0)
                .at(4).with("rpm", 0).with("Vsw", 12).with("fuel_ctl_mode", 3.0)
                .build();
        AnalysisSettings settings = AnalysisSettings.defaults();
        EngineStateTimeline timeline = new EngineStateClassifier(settings.getEngineState()).classify(recording);
        ValidityMask mask = new ValidityMasker(settings::policyFor).mask(recording, timeline);

        // When
        TimeInState result = calculator.forChannel(recording, "fuel_ctl_mode", timeline, mask);

        // Then
        assertThat(result.states()).extracting(StateDwell::state).containsExactly("1", "3");
        assertThat(result.state("1")).get().extracting(StateDwell::seconds).isEqualTo(2.0);
        assertThat(result.state("3")).get().extracting(StateDwell::seconds).isEqualTo(2.0);
    }
}
