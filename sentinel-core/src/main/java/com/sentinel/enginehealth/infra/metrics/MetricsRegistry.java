/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.infra.metrics;

import com.sentinel.enginehealth.infra.metrics.internal.MetricsRegistryHolder;

/**
 * Facade over the metrics backend used by resolution and analysis.
 *
 * <p>Tags are given as alternating key/value pairs:
 * <pre>{@code
 * registry.counter("sentinel_alerts_total", "severity", "critical").increment();
 * }</pre>
 */
public interface MetricsRegistry {

    Counter counter(String name, String... tags);

    Timer timer(String name, String... tags);

    /**
     * Process-wide registry picked through {@link java.util.ServiceLoader}.
     */
    static MetricsRegistry getInstance() {
        return MetricsRegistryHolder.INSTANCE;
    }
}
