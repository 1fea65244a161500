package com.sentinel.enginehealth.runtime.state;

import com.sentinel.enginehealth.api.model.ChannelPolicy;
import com.sentinel.enginehealth.api.model.EngineState;
import com.sentinel.enginehealth.api.model.EngineStateConfig;
import com.sentinel.enginehealth.api.model.Recording;
import com.sentinel.enginehealth.api.model.SignalQualityNote;
import com.sentinel.enginehealth.api.model.ValidityPolicy;
import com.sentinel.enginehealth.runtime.Recordings;
import com.sentinel.enginehealth.runtime.validity.ValidityMask;
import com.sentinel.enginehealth.runtime.validity.ValidityMasker;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class EngineStateClassifierTest {

    private final EngineStateClassifier classifier = new EngineStateClassifier(EngineStateConfig.defaults());

    @Test
    @DisplayName("Should classify a full engine cycle")
    void shouldClassifyFullCycle() {
        // Given
        Recording recording = Recordings.engineCycle("cycle").build();

        // When
        EngineStateTimeline timeline = classifier.classify(recording);

        // Then
        assertThat(timeline.isClassified()).isTrue();
        assertThat(timeline.transitions())
                .extracting(StateTransition::time, StateTransition::to)
                .containsExactly(
                        tuple(0.0, EngineState.CRANKING),
                        tuple(2.0, EngineState.UNSTABLE),
                        tuple(4.0, EngineState.STABLE),
                        tuple(10.5, EngineState.STOPPING),
                        tuple(11.0, EngineState.OFF));
        assertThat(timeline.isInStartupGrace(4)).isTrue();
        assertThat(timeline.isInStartupGrace(7)).isTrue();
        assertThat(timeline.isInStartupGrace(8)).isFalse();
        assertThat(timeline.lastStartAt(10)).isEqualTo(0.0);
        assertThat(timeline.lastStopAt(10)).isNaN();
        assertThat(timeline.lastStopAt(21)).isEqualTo(10.5);
    }

    @Test
    @DisplayName("Should never reach stable on single-sample RPM spikes")
    void shouldIgnoreRpmSpikes() {
        // Given RPM 0 -> 1000 -> 0 one sample at a time with the key on
        Recordings builder = Recordings.builder("spikes");
        for (int i = 0; i < 20; i++) {
            builder.at(i * 0.5).with("rpm", i % 2 == 1 ? 1000 : 0).with("Vsw", 12.0).with("ECT", 95.0);
        }
        Recording recording = builder.build();
        ValidityMasker masker = new ValidityMasker(channel -> "ECT".equals(channel)
                ? ChannelPolicy.of(ValidityPolicy.VALID_WHEN_RUNNING)
                : ChannelPolicy.ALWAYS);

        // When
        EngineStateTimeline timeline = classifier.classify(recording);
        ValidityMask mask = masker.mask(recording, timeline);

        // Then
        assertThat(timeline.states()).doesNotContain(EngineState.UNSTABLE, EngineState.STABLE);
        assertThat(timeline.states()).allMatch(s -> s == EngineState.CRANKING);
        assertThat(mask.statsValidCount("ECT")).isZero();
        assertThat(mask.alertValidCount("ECT")).isZero();
        assertThat(mask.statsValidCount("rpm")).isEqualTo(20);
    }

    @Test
    @DisplayName("Should fall back to off when the key is on but the engine never turns")
    void shouldReturnToOffWhenKeyOnEngineOff() {
        // Given one minute of key-on with a stopped engine, then a start at 61 s
        Recordings builder = Recordings.builder("key-on-engine-off");
        for (int t = 0; t <= 66; t++) {
            builder.at(t).with("rpm", t <= 60 ? 0 : 900).with("Vsw", 12.0);
        }

        // When
        EngineStateTimeline timeline = classifier.classify(builder.build());

        // Then
        assertThat(timeline.state(1)).isEqualTo(EngineState.CRANKING);
        assertThat(timeline.state(2)).isEqualTo(EngineState.OFF);
        assertThat(timeline.state(30)).isEqualTo(EngineState.OFF);
        assertThat(timeline.state(60)).isEqualTo(EngineState.OFF);
        assertThat(timeline.transitions())
                .extracting(StateTransition::time, StateTransition::to)
                .containsExactly(
                        tuple(0.0, EngineState.CRANKING),
                        tuple(2.0, EngineState.OFF),
                        tuple(61.0, EngineState.CRANKING),
                        tuple(63.0, EngineState.UNSTABLE),
                        tuple(65.0, EngineState.STABLE));
        assertThat(timeline.lastStartAt(65)).isEqualTo(61.0);
    }

    @Test
    @DisplayName("Should default to off with a note when the key-switch channel is missing")
    void shouldDefaultToOffWithoutVsw() {
        Recording recording = Recordings.builder("no-vsw")
                .at(0).with("rpm", 900)
                .at(1).with("rpm", 900)
                .build();

        EngineStateTimeline timeline = classifier.classify(recording);

        assertThat(timeline.isClassified()).isFalse();
        assertThat(timeline.states()).containsOnly(EngineState.OFF);
        assertThat(timeline.notes()).singleElement().satisfies(note -> {
            assertThat(note.kind()).isEqualTo(SignalQualityNote.Kind.MISSING_REQUIRED_CHANNEL);
            assertThat(note.subject()).isEqualTo("Vsw");
        });
    }

    @Test
    @DisplayName("Should skip duplicate and decreasing timestamps without failing")
    void shouldSkipNonMonotonicTime() {
        Recording recording = Recordings.builder("jitter")
                .at(0).with("rpm", 0).with("Vsw", 12)
                .at(1).with("rpm", 0).with("Vsw", 12)
                .at(1).with("rpm", 0).with("Vsw", 0)
                .at(0.5).with("rpm", 0).with("Vsw", 0)
                .at(1.5).with("rpm", 0).with("Vsw", 12)
                .build();

        EngineStateTimeline timeline = classifier.classify(recording);

        assertThat(timeline.isAccepted(2)).isFalse();
        assertThat(timeline.isAccepted(3)).isFalse();
        assertThat(timeline.skippedCount()).isEqualTo(2);
        assertThat(timeline.state(2)).isEqualTo(EngineState.CRANKING);
        assertThat(timeline.state(4)).isEqualTo(EngineState.CRANKING);
        assertThat(timeline.notes()).extracting(SignalQualityNote::kind)
                .containsExactly(SignalQualityNote.Kind.NON_MONOTONIC_TIME);
    }

    @Test
    @DisplayName("Should classify an empty recording")
    void shouldHandleEmptyRecording() {
        EngineStateTimeline timeline = classifier.classify(Recordings.builder("empty").build());

        assertThat(timeline.size()).isZero();
        assertThat(timeline.notes()).isEmpty();
    }
}
