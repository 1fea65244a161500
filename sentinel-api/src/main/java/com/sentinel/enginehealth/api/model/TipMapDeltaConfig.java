/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.api.model;

import java.util.Objects;

/**
 * Configuration of the {@code tip_map_delta} rule: throttle-inlet pressure minus
 * manifold pressure compared against an ideal delta with separate high and low tolerances.
 *
 * @param tipParam       throttle-inlet pressure channel
 * @param mapParam       manifold absolute pressure channel
 * @param fullLoadMapPsi MAP at full load, used for the load percentage
 * @param noLoadMapPsi   MAP at no load, used for the load percentage
 * @param loadLimitPct   samples above this load percentage are not evaluated; {@code null} disables the limit
 * @param deltaIdealPsi  expected TIP - MAP delta
 * @param deltaHighPsi   tolerance above the ideal delta
 * @param deltaLowPsi    tolerance below the ideal delta
 * @param loadGate       gate that must be held before evaluation
 */
public record TipMapDeltaConfig(
        String tipParam,
        String mapParam,
        double fullLoadMapPsi,
        double noLoadMapPsi,
        Double loadLimitPct,
        double deltaIdealPsi,
        double deltaHighPsi,
        double deltaLowPsi,
        LoadGate loadGate) {

    public static final String DEFAULT_TIP_PARAM = "TIP";
    public static final String DEFAULT_MAP_PARAM = "MAP";

    public TipMapDeltaConfig {
        tipParam = tipParam == null || tipParam.isBlank() ? DEFAULT_TIP_PARAM : tipParam;
        mapParam = mapParam == null || mapParam.isBlank() ? DEFAULT_MAP_PARAM : mapParam;
        Objects.requireNonNull(loadGate, "loadGate");
        if (fullLoadMapPsi <= noLoadMapPsi) {
            throw new IllegalArgumentException("fullLoadMapPsi must be greater than noLoadMapPsi");
        }
    }

    /**
     * Load percentage for a MAP reading, clamped to [0, 100].
     */
    public double loadPercent(double mapPsi) {
        double pct = (mapPsi - noLoadMapPsi) / (fullLoadMapPsi - noLoadMapPsi) * 100.0;
        return Math.max(0.0, Math.min(100.0, pct));
    }
}
