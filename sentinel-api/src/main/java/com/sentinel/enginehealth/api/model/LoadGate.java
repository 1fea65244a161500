/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.api.model;

import java.util.Objects;

/**
 * Condition that must hold continuously for {@code debounceSec} before a
 * load-dependent rule is evaluated.
 */
public record LoadGate(Condition condition, double debounceSec) {

    public LoadGate {
        Objects.requireNonNull(condition, "condition");
        if (debounceSec < 0 || Double.isNaN(debounceSec)) {
            throw new IllegalArgumentException("debounceSec must be >= 0");
        }
    }
}
