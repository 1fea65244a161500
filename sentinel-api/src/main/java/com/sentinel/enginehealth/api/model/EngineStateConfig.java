/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.api.model;

/**
 * Thresholds and timings of the engine-state classifier.
 *
 * @param rpmChannel            RPM channel name
 * @param vswChannel            key-switch voltage channel name
 * @param vswOnThreshold        key-on voltage
 * @param rpmCrankingThreshold  RPM above which the engine is turning
 * @param rpmRunningThreshold   RPM above which the engine is running
 * @param rpmStableThreshold    RPM above which the engine may settle to stable
 * @param debounceSamples       consecutive running samples needed to leave cranking
 * @param stableHoldoffSeconds  time above the stable threshold before stable
 * @param stopHoldoffSeconds    time below the running threshold before stopping
 * @param keyOffDebounceSeconds key-off time before stopping turns off
 * @param startupGraceSeconds   grace window after the engine starts running
 */
public record EngineStateConfig(
        String rpmChannel,
        String vswChannel,
        double vswOnThreshold,
        double rpmCrankingThreshold,
        double rpmRunningThreshold,
        double rpmStableThreshold,
        int debounceSamples,
        double stableHoldoffSeconds,
        double stopHoldoffSeconds,
        double keyOffDebounceSeconds,
        double startupGraceSeconds) {

    public static final String DEFAULT_RPM_CHANNEL = "rpm";
    public static final String DEFAULT_VSW_CHANNEL = "Vsw";

    public EngineStateConfig {
        if (debounceSamples < 1) {
            throw new IllegalArgumentException("debounceSamples must be >= 1");
        }
        if (rpmStableThreshold < rpmRunningThreshold) {
            throw new IllegalArgumentException("rpmStableThreshold must be >= rpmRunningThreshold");
        }
    }

    public static EngineStateConfig defaults() {
        return new EngineStateConfig(DEFAULT_RPM_CHANNEL, DEFAULT_VSW_CHANNEL,
                1.0, 100, 500, 800, 3, 2.0, 2.0, 0.5, 2.0);
    }
}
