/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.api.model;

import java.util.List;

/**
 * Alerts of one analysis grouped by severity.
 */
public record AlertSummary(
        int total,
        int criticalCount,
        int warningCount,
        double criticalDurationSec,
        double warningDurationSec,
        int openCount,
        List<AlertEvent> critical,
        List<AlertEvent> warnings) {

    public AlertSummary {
        critical = List.copyOf(critical);
        warnings = List.copyOf(warnings);
    }
}
