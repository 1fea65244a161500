/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.api.model;

/**
 * Run-time breakdown of a recording.
 */
public record OperatingStats(
        double totalRuntimeSec,
        double idleTimeSec,
        double loadedTimeSec,
        double maxRpm,
        double avgRpm,
        double maxMap,
        double avgMap) {

    public static final OperatingStats EMPTY = new OperatingStats(0, 0, 0, 0, 0, 0, 0);
}
