package com.sentinel.enginehealth.infra.metrics.impl.inmemory;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryMetricsRegistryTest {

    private final InMemoryMetricsRegistry registry = new InMemoryMetricsRegistry();

    @Test
    void counter_keepsTagCombinationsApart() {
        registry.counter("sentinel_alerts_total", "severity", "critical").increment();
        registry.counter("sentinel_alerts_total", "severity", "warning").increment(2);

        assertThat(registry.getCounterValue("sentinel_alerts_total", "severity", "critical")).isEqualTo(1);
        assertThat(registry.getCounterValue("sentinel_alerts_total")).isEqualTo(3);
    }

    @Test
    void counter_rejectsNegativeIncrement() {
        assertThatThrownBy(() -> registry.counter("c").increment(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void timer_keepsRecordings() {
        registry.timer("sentinel_analysis_duration").record(Duration.ofMillis(5));
        registry.timer("sentinel_analysis_duration").recordNanos(1_000);

        assertThat(registry.getTimerRecordings("sentinel_analysis_duration"))
                .containsExactly(Duration.ofMillis(5), Duration.ofNanos(1_000));
        assertThat(registry.timer("sentinel_analysis_duration").count()).isEqualTo(2);
    }

    @Test
    void reset_clearsEverything() {
        registry.counter("c").increment();
        registry.reset();

        assertThat(registry.getCounterValue("c")).isZero();
    }
}
