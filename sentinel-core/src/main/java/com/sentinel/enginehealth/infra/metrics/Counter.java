/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.infra.metrics;

/**
 * Monotonically increasing count.
 */
public interface Counter {

    default void increment() {
        increment(1);
    }

    void increment(long amount);

    long count();
}
