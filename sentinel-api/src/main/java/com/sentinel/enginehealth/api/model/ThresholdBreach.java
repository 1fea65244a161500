/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Measured side of a threshold alert.
 *
 * @param channel   recording channel that breached
 * @param bound     whether the value fell below a minimum or rose above a maximum
 * @param threshold configured limit that was crossed
 * @param unit      display unit of the channel
 * @param value     latest reading while the alert was active
 * @param minValue  lowest reading while active
 * @param maxValue  highest reading while active
 */
public record ThresholdBreach(
        @JsonProperty("channel") String channel,
        @JsonProperty("bound") Bound bound,
        @JsonProperty("threshold") double threshold,
        @JsonProperty("unit") String unit,
        @JsonProperty("value") double value,
        @JsonProperty("minValue") double minValue,
        @JsonProperty("maxValue") double maxValue) {

    public enum Bound {
        MIN,
        MAX
    }

    public static ThresholdBreach first(String channel, Bound bound, double threshold, String unit, double value) {
        return new ThresholdBreach(channel, bound, threshold, unit, value, value, value);
    }

    public ThresholdBreach update(double reading) {
        return new ThresholdBreach(channel, bound, threshold, unit, reading,
                Math.min(minValue, reading), Math.max(maxValue, reading));
    }

    /**
     * The reading furthest past the limit: the minimum for a low breach, the maximum for a high one.
     */
    public double peak() {
        return bound == Bound.MIN ? minValue : maxValue;
    }
}
