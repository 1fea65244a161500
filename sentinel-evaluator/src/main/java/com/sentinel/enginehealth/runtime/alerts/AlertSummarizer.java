/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.runtime.alerts;

import com.sentinel.enginehealth.api.model.AlertEvent;
import com.sentinel.enginehealth.api.model.AlertSummary;
import com.sentinel.enginehealth.api.model.Severity;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Groups alerts by severity with counts and total durations. Open alerts are measured up
 * to the end of the recording.
 */
public final class AlertSummarizer {

    private AlertSummarizer() {
    }

    public static AlertSummary summarize(List<AlertEvent> alerts, double endOfRecording) {
        List<AlertEvent> critical = new ArrayList<>();
        List<AlertEvent> warnings = new ArrayList<>();
        double criticalSec = 0.0;
        double warningSec = 0.0;
        int open = 0;

        List<AlertEvent> ordered = new ArrayList<>(alerts);
        ordered.sort(Comparator.comparingDouble(AlertEvent::onsetTime));
        for (AlertEvent alert : ordered) {
            if (alert.isOpen()) {
                open++;
            }
            if (alert.severity() == Severity.CRITICAL) {
                critical.add(alert);
                criticalSec += alert.duration(endOfRecording);
            } else {
                warnings.add(alert);
                warningSec += alert.duration(endOfRecording);
            }
        }
        return new AlertSummary(ordered.size(), critical.size(), warnings.size(),
                criticalSec, warningSec, open, critical, warnings);
    }
}
