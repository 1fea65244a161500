/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.runtime.thresholds;

import com.sentinel.enginehealth.api.model.Severity;
import com.sentinel.enginehealth.api.model.ThresholdBreach.Bound;

/**
 * One limit taken from a profile's thresholds.
 *
 * @param id          alert id, e.g. {@code battery_critical_low}
 * @param name        alert display name
 * @param group       threshold section the limit came from
 * @param severity    severity of the alert
 * @param bound       {@code MIN} fires below the trigger, {@code MAX} above it
 * @param trigger     limit that opens the alert
 * @param clear       limit the reading must pass back over to clear; NaN clears as soon as the
 *                    reading is back inside the trigger
 * @param warmupSec   seconds after an engine start during which the check is idle; 0 for none
 * @param minRpm      RPM below which the check is idle; NaN for none
 */
public record ThresholdCheck(
        String id,
        String name,
        ThresholdGroup group,
        Severity severity,
        Bound bound,
        double trigger,
        double clear,
        double warmupSec,
        double minRpm) {

    public boolean breaches(double value) {
        return bound == Bound.MIN ? value < trigger : value > trigger;
    }

    /**
     * Whether an active alert clears at {@code value}.
     */
    public boolean clears(double value) {
        if (Double.isNaN(clear)) {
            return !breaches(value);
        }
        return bound == Bound.MIN ? value > clear : value < clear;
    }
}
