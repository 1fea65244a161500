/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.infra.metrics.api;

import com.sentinel.enginehealth.infra.metrics.MetricsRegistry;

/**
 * Service Provider Interface for {@link MetricsRegistry} implementations,
 * registered under {@code META-INF/services}.
 *
 * <p>Implementations need a public no-arg constructor and must create thread-safe registries.
 */
public interface MetricsRegistryProvider {

    MetricsRegistry create();

    /**
     * Higher values are preferred when several providers are on the classpath.
     */
    default int priority() {
        return 0;
    }

    default String name() {
        return getClass().getSimpleName();
    }
}
