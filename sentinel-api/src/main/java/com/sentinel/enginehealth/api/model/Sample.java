/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.api.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One row of engine telemetry: a timestamp in seconds and the channel values read at it.
 *
 * <p>Channels that were not recorded, or whose value is {@code null} or {@code NaN},
 * are absent. {@link #value(String)} reports an absent channel as {@code NaN}.
 *
 * @param time   sample time in seconds (not necessarily starting at zero)
 * @param values channel name to value; absent channels are simply not present
 */
public record Sample(double time, Map<String, Double> values) {

    public Sample {
        Objects.requireNonNull(values, "values must not be null");
        Map<String, Double> copy = new LinkedHashMap<>();
        values.forEach((channel, value) -> {
            if (channel != null && value != null && !value.isNaN()) {
                copy.put(channel, value);
            }
        });
        values = Collections.unmodifiableMap(copy);
    }

    public static Sample of(double time, Map<String, Double> values) {
        return new Sample(time, values);
    }

    /**
     * Returns the channel value, or {@code NaN} when the channel is absent.
     */
    public double value(String channel) {
        Double v = values.get(channel);
        return v == null ? Double.NaN : v;
    }

    public boolean has(String channel) {
        return values.containsKey(channel);
    }
}
