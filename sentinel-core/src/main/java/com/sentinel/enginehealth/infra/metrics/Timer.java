/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.infra.metrics;

import java.time.Duration;

/**
 * Records durations of an operation.
 */
public interface Timer {

    void record(Duration duration);

    default void recordNanos(long nanos) {
        record(Duration.ofNanos(nanos));
    }

    long count();
}
