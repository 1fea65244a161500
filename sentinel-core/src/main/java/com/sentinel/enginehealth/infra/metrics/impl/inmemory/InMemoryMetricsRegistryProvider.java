package com.sentinel.enginehealth.infra.metrics.impl.inmemory;

import com.sentinel.enginehealth.infra.metrics.MetricsRegistry;
import com.sentinel.enginehealth.infra.metrics.api.MetricsRegistryProvider;

public final class InMemoryMetricsRegistryProvider implements MetricsRegistryProvider {

    @Override
    public MetricsRegistry create() {
        return new InMemoryMetricsRegistry();
    }

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public String name() {
        return "in-memory";
    }
}
