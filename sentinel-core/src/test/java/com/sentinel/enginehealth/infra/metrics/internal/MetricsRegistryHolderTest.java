package com.sentinel.enginehealth.infra.metrics.internal;

import com.sentinel.enginehealth.infra.metrics.MetricsRegistry;
import com.sentinel.enginehealth.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import com.sentinel.enginehealth.infra.metrics.impl.inmemory.InMemoryMetricsRegistryProvider;
import com.sentinel.enginehealth.infra.metrics.impl.prometheus.PrometheusMetricsRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsRegistryHolderTest {

    @Test
    void select_prefersHighestPriority() {
        MetricsRegistry registry = MetricsRegistryHolder.select(List.of(
                new InMemoryMetricsRegistryProvider(),
                new com.sentinel.enginehealth.infra.metrics.api.MetricsRegistryProvider() {
                    @Override
                    public MetricsRegistry create() {
                        return new PrometheusMetricsRegistry(new io.prometheus.client.CollectorRegistry());
                    }

                    @Override
                    public int priority() {
                        return 100;
                    }
                }));

        assertThat(registry).isInstanceOf(PrometheusMetricsRegistry.class);
    }

    @Test
    void select_fallsBackToNoOp() {
        MetricsRegistry registry = MetricsRegistryHolder.select(List.of());

        assertThat(registry).isInstanceOf(NoOpMetricsRegistry.class);
        registry.counter("anything").increment();
        assertThat(registry.counter("anything").count()).isZero();
    }

    @Test
    void getInstance_discoversServiceRegistration() {
        assertThat(MetricsRegistry.getInstance())
                .isInstanceOfAny(PrometheusMetricsRegistry.class, InMemoryMetricsRegistry.class);
    }
}
