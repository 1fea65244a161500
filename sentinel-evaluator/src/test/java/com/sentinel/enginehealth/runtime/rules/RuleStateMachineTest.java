package com.sentinel.enginehealth.runtime.rules;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RuleStateMachineTest {

    /**
     * Feeds a scripted sequence of (time, condition) pairs and returns every emitted edge.
     */
    private static List<RuleStateMachine.StepResult> run(double trigger, double clear, double[] times,
                                                         boolean[] truths) {
        List<RuleStateMachine.StepResult> edges = new ArrayList<>();
        RuleState state = RuleState.IDLE;
        for (int i = 0; i < times.length; i++) {
            RuleStateMachine.StepResult result = RuleStateMachine.step(state, truths[i], times[i], trigger, clear);
            if (result.emission() != RuleStateMachine.Emission.NONE) {
                edges.add(result);
            }
            state = result.next();
        }
        return edges;
    }

    @Nested
    @DisplayName("Triggering")
    class Triggering {

        @Test
        @DisplayName("Should report onset at the start of the true stretch plus the persistence")
        void shouldReportOnsetAtPersistenceBoundary() {
            // Given a condition true from t=10 to t=20 every 0.5s
            int n = 21;
            double[] times = new double[n];
            boolean[] truths = new boolean[n];
            for (int i = 0; i < n; i++) {
                times[i] = 10 + i * 0.5;
                truths[i] = true;
            }

            // When
            List<RuleStateMachine.StepResult> edges = run(2.0, 0.0, times, truths);

            // Then
            assertThat(edges).singleElement().satisfies(edge -> {
                assertThat(edge.emission()).isEqualTo(RuleStateMachine.Emission.FIRE);
                assertThat(edge.eventTime()).isEqualTo(12.0);
            });
        }

        @Test
        @DisplayName("Should not delay onset to the first sample past the persistence")
        void shouldNotDelayOnsetWithSparseSamples() {
            List<RuleStateMachine.StepResult> edges = run(2.0, 0.0,
                    new double[]{10.0, 11.3, 12.6, 13.9}, new boolean[]{true, true, true, true});

            assertThat(edges).singleElement()
                    .extracting(RuleStateMachine.StepResult::eventTime).isEqualTo(12.0);
        }

        @Test
        @DisplayName("Should fire immediately without trigger persistence")
        void shouldFireImmediately() {
            List<RuleStateMachine.StepResult> edges = run(0.0, 0.0,
                    new double[]{1.0, 2.0}, new boolean[]{false, true});

            assertThat(edges).singleElement()
                    .extracting(RuleStateMachine.StepResult::eventTime).isEqualTo(2.0);
        }

        @Test
        @DisplayName("Should restart trigger timing after a false blip before firing")
        void shouldRestartTriggerTimingAfterBlip() {
            List<RuleStateMachine.StepResult> edges = run(2.0, 1.0,
                    new double[]{5.0, 5.5, 6.0, 7.0, 8.0},
                    new boolean[]{true, false, true, true, true});

            assertThat(edges).singleElement().satisfies(edge -> {
                assertThat(edge.emission()).isEqualTo(RuleStateMachine.Emission.FIRE);
                assertThat(edge.eventTime()).isEqualTo(8.0);
            });
        }
    }

    @Nested
    @DisplayName("Clearing")
    class Clearing {

        @Test
        @DisplayName("Should not clear during a blip shorter than the clear persistence")
        void shouldNotClearDuringBlip() {
            List<RuleStateMachine.StepResult> edges = run(1.0, 1.0,
                    new double[]{3.0, 3.5, 4.0, 5.0, 5.5, 6.0, 7.0},
                    new boolean[]{true, true, true, true, false, true, true});

            assertThat(edges).extracting(RuleStateMachine.StepResult::emission)
                    .containsExactly(RuleStateMachine.Emission.FIRE);
        }

        @Test
        @DisplayName("Should report the first false sample as the clear time")
        void shouldReportFirstFalseAsClearTime() {
            List<RuleStateMachine.StepResult> edges = run(0.0, 1.0,
                    new double[]{9.0, 10.0, 10.5, 11.0},
                    new boolean[]{true, false, false, false});

            assertThat(edges).hasSize(2);
            assertThat(edges.get(1).emission()).isEqualTo(RuleStateMachine.Emission.CLEAR);
            assertThat(edges.get(1).eventTime()).isEqualTo(10.0);
        }

        @Test
        @DisplayName("Should return to idle after clearing")
        void shouldResetAfterClear() {
            RuleStateMachine.StepResult fired = RuleStateMachine.step(RuleState.IDLE, true, 1.0, 0.0, 0.0);
            RuleStateMachine.StepResult cleared = RuleStateMachine.step(fired.next(), false, 2.0, 0.0, 0.0);

            assertThat(cleared.emission()).isEqualTo(RuleStateMachine.Emission.CLEAR);
            assertThat(cleared.next()).isEqualTo(RuleState.IDLE);
        }
    }

    @Test
    @DisplayName("Window mode should fire once the accumulated true time reaches the persistence")
    void windowModeShouldFireOnAccumulatedTime() {
        RuleStateMachine.StepResult notYet = RuleStateMachine.stepWindowed(RuleState.IDLE, true, 4.0, 2.5, 3.0, 0.0);
        RuleStateMachine.StepResult reached = RuleStateMachine.stepWindowed(notYet.next(), false, 5.0, 3.0, 3.0, 0.0);

        assertThat(notYet.emission()).isEqualTo(RuleStateMachine.Emission.NONE);
        assertThat(reached.emission()).isEqualTo(RuleStateMachine.Emission.FIRE);
        assertThat(reached.eventTime()).isEqualTo(5.0);
        assertThat(reached.next().firing()).isTrue();
    }
}
