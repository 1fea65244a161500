/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.runtime.alerts;

import com.sentinel.enginehealth.api.model.AlertSummary;
import com.sentinel.enginehealth.api.model.OperatingStats;

/**
 * Single 0..100 health figure for a recording: 100, minus 20 per critical and 5 per
 * warning alert, plus 5 when the average running RPM sits in the normal band.
 */
public final class HealthScoreCalculator {

    static final int CRITICAL_PENALTY = 20;
    static final int WARNING_PENALTY = 5;
    static final int NORMAL_RPM_BONUS = 5;
    static final double NORMAL_RPM_LOW = 800;
    static final double NORMAL_RPM_HIGH = 2500;

    private HealthScoreCalculator() {
    }

    public static int score(AlertSummary summary, OperatingStats stats) {
        int score = 100 - CRITICAL_PENALTY * summary.criticalCount() - WARNING_PENALTY * summary.warningCount();
        if (stats.avgRpm() > NORMAL_RPM_LOW && stats.avgRpm() < NORMAL_RPM_HIGH) {
            score += NORMAL_RPM_BONUS;
        }
        return Math.max(0, Math.min(100, score));
    }
}
