/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.runtime.rules;

import com.sentinel.enginehealth.api.model.TipMapDeltaConfig;
import com.sentinel.enginehealth.runtime.condition.ConditionEvaluator;
import com.sentinel.enginehealth.runtime.condition.SampleFrame;

/**
 * Base condition of a {@code tip_map_delta} rule.
 *
 * <p>The actual delta is {@code TIP - MAP}. The condition holds when it deviates from the
 * ideal delta by more than the high or low allowance, but only once the load gate has
 * been satisfied continuously for its debounce time, and never above the load limit.
 * Holds the gate timer, so one instance serves one rule for one recording.
 */
final class TipMapDeltaEvaluator {

    private final TipMapDeltaConfig config;
    private final ConditionEvaluator conditions;
    private double gateSince = Double.NaN;

    TipMapDeltaEvaluator(TipMapDeltaConfig config, ConditionEvaluator conditions) {
        this.config = config;
        this.conditions = conditions;
    }

    boolean evaluate(SampleFrame frame, boolean suppressed) {
        if (suppressed || !conditions.evaluate(config.loadGate().condition(), frame)) {
            gateSince = Double.NaN;
            return false;
        }
        if (Double.isNaN(gateSince)) {
            gateSince = frame.time();
        }
        if (frame.time() - gateSince < config.loadGate().debounceSec()) {
            return false;
        }

        double tip = frame.alertValue(config.tipParam());
        double map = frame.alertValue(config.mapParam());
        if (Double.isNaN(tip) || Double.isNaN(map)) {
            return false;
        }
        if (config.loadLimitPct() != null && config.loadPercent(map) > config.loadLimitPct()) {
            return false;
        }
        double actual = tip - map;
        return actual - config.deltaIdealPsi() > config.deltaHighPsi()
                || config.deltaIdealPsi() - actual > config.deltaLowPsi();
    }
}
