package com.sentinel.enginehealth.infra.metrics.impl.prometheus;

import com.sentinel.enginehealth.infra.metrics.Counter;
import com.sentinel.enginehealth.infra.metrics.Timer;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PrometheusMetricsRegistryTest {

    private CollectorRegistry collectors;
    private PrometheusMetricsRegistry registry;

    @BeforeEach
    void setUp() {
        collectors = new CollectorRegistry();
        registry = new PrometheusMetricsRegistry(collectors);
    }

    @Test
    void counter_bindsLabelValues() {
        Counter critical = registry.counter("sentinel_alerts_total", "severity", "critical");
        Counter warning = registry.counter("sentinel_alerts_total", "severity", "warning");

        critical.increment();
        critical.increment();
        warning.increment(5);

        assertThat(critical.count()).isEqualTo(2);
        assertThat(collectors.getSampleValue("sentinel_alerts_total",
                new String[]{"severity"}, new String[]{"warning"})).isEqualTo(5.0);
    }

    @Test
    void counter_negativeAmount_throwsException() {
        Counter counter = registry.counter("sentinel_rules_skipped_total");

        assertThatThrownBy(() -> counter.increment(-1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("cannot decrease");
    }

    @Test
    void timer_observesSeconds() {
        Timer timer = registry.timer("sentinel.analysis.duration");

        timer.record(Duration.ofMillis(250));

        assertThat(timer.count()).isEqualTo(1);
        assertThat(collectors.getSampleValue("sentinel_analysis_duration_seconds_sum")).isEqualTo(0.25);
    }

    @Test
    void sanitizeName_replacesIllegalCharacters() {
        assertThat(PrometheusMetricsRegistry.sanitizeName("Sentinel.Profile-Resolutions"))
                .isEqualTo("sentinel_profile_resolutions");
    }
}
