package com.sentinel.enginehealth.infra.metrics.impl.prometheus;

import com.sentinel.enginehealth.infra.metrics.MetricsRegistry;
import com.sentinel.enginehealth.infra.metrics.api.MetricsRegistryProvider;

public final class PrometheusMetricsRegistryProvider implements MetricsRegistryProvider {

    @Override
    public MetricsRegistry create() {
        return new PrometheusMetricsRegistry();
    }

    @Override
    public int priority() {
        return 100;
    }

    @Override
    public String name() {
        return "prometheus";
    }
}
