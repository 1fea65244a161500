/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.runtime.alerts;

import com.sentinel.enginehealth.api.model.AlertEvent;
import com.sentinel.enginehealth.api.model.Rule;
import com.sentinel.enginehealth.api.model.ThresholdBreach;

import java.util.Locale;

/**
 * Renders alerts as display lines, e.g.
 * {@code Critical: Low Oil Pressure — Oil pressure below 10 psi, 12.0s→15.5s}, or for a
 * threshold alert {@code Warning: Low Battery Voltage — Vbat 11.2 V below 11.5 V, 3.0s→ongoing}.
 */
public final class AlertFormatter {

    static final String ONGOING = "ongoing";

    private AlertFormatter() {
    }

    public static String format(AlertEvent alert, Rule rule) {
        ThresholdBreach breach = alert.breach();
        String name;
        String description;
        if (rule == null && breach != null) {
            name = alert.message();
            description = String.format(Locale.ROOT, "%s %s %s %s %s %s", breach.channel(), number(breach.peak()),
                    breach.unit(), breach.bound() == ThresholdBreach.Bound.MIN ? "below" : "above",
                    number(breach.threshold()), breach.unit());
        } else {
            name = rule != null ? rule.name() : alert.ruleId();
            description = rule != null && rule.description() != null && !rule.description().isBlank()
                    ? rule.description()
                    : alert.message();
        }
        return String.format(Locale.ROOT, "%s: %s — %s, %s→%s",
                alert.severity().displayName(), name, description,
                seconds(alert.onsetTime()),
                alert.isOpen() ? ONGOING : seconds(alert.clearTime()));
    }

    public static String format(AlertEvent alert) {
        return format(alert, null);
    }

    private static String number(double value) {
        return value == Math.rint(value) && Math.abs(value) < 1e9
                ? String.valueOf((long) value)
                : String.format(Locale.ROOT, "%.1f", value);
    }

    private static String seconds(double time) {
        return String.format(Locale.ROOT, "%.1fs", time);
    }
}
