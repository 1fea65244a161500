/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.compiler.validation;

import com.sentinel.enginehealth.api.model.ThresholdTree;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Sanity checks of merged threshold values.
 *
 * <p>Every top-level node is treated as a channel with optional
 * {@code critical}/{@code warning} bands of {@code min}/{@code max}. The critical band
 * must lie outside the warning band, each band's min must be below its max, and an
 * {@code overspeed} value must exceed {@code critical.max}. A few well-known channels
 * additionally get plausibility warnings.
 */
public class ThresholdValidator {

    private record Bound(String path, boolean lowerLimit, double limit, String message) {
    }

    private static final List<Bound> PLAUSIBILITY = List.of(
            new Bound("battery.critical.min", true, 8.0, "battery critical.min below 8V is unusually low"),
            new Bound("coolantTemp.critical.max", false, 260.0,
                    "coolantTemp critical.max above 260F is unusually high"),
            new Bound("oilPressure.critical.min", true, 5.0, "oilPressure critical.min below 5 psi is very low"));

    public ValidationReport validate(ThresholdTree.Node thresholds) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        for (Map.Entry<String, ThresholdTree> entry : thresholds.children().entrySet()) {
            if (entry.getValue() instanceof ThresholdTree.Node channel) {
                checkChannel(entry.getKey(), channel, errors);
            }
        }

        for (Bound bound : PLAUSIBILITY) {
            OptionalDouble value = thresholds.numberAt(bound.path());
            if (value.isPresent()) {
                double v = value.getAsDouble();
                if (bound.lowerLimit() ? v < bound.limit() : v > bound.limit()) {
                    warnings.add(bound.message());
                }
            }
        }
        return new ValidationReport(errors, warnings);
    }

    private void checkChannel(String name, ThresholdTree.Node channel, List<String> errors) {
        OptionalDouble criticalMin = channel.numberAt("critical.min");
        OptionalDouble criticalMax = channel.numberAt("critical.max");
        OptionalDouble warningMin = channel.numberAt("warning.min");
        OptionalDouble warningMax = channel.numberAt("warning.max");

        if (criticalMin.isPresent() && warningMin.isPresent()
                && criticalMin.getAsDouble() >= warningMin.getAsDouble()) {
            errors.add(String.format("%s: critical.min (%s) must be less than warning.min (%s)",
                    name, fmt(criticalMin), fmt(warningMin)));
        }
        if (criticalMax.isPresent() && warningMax.isPresent()
                && criticalMax.getAsDouble() <= warningMax.getAsDouble()) {
            errors.add(String.format("%s: critical.max (%s) must be greater than warning.max (%s)",
                    name, fmt(criticalMax), fmt(warningMax)));
        }
        checkBand(name, "warning", warningMin, warningMax, errors);
        checkBand(name, "critical", criticalMin, criticalMax, errors);

        OptionalDouble overspeed = channel.numberAt("overspeed");
        if (overspeed.isPresent() && criticalMax.isPresent()
                && overspeed.getAsDouble() <= criticalMax.getAsDouble()) {
            errors.add(String.format("%s: overspeed (%s) must be greater than critical.max (%s)",
                    name, fmt(overspeed), fmt(criticalMax)));
        }
    }

    private void checkBand(String name, String band, OptionalDouble min, OptionalDouble max, List<String> errors) {
        if (min.isPresent() && max.isPresent() && min.getAsDouble() >= max.getAsDouble()) {
            errors.add(String.format("%s: %s.min (%s) must be less than %s.max (%s)",
                    name, band, fmt(min), band, fmt(max)));
        }
    }

    private static String fmt(OptionalDouble value) {
        double v = value.getAsDouble();
        return v == Math.rint(v) ? String.valueOf((long) v) : String.valueOf(v);
    }
}
