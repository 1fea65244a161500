/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.runtime.thresholds;

import com.sentinel.enginehealth.api.model.Severity;
import com.sentinel.enginehealth.api.model.ThresholdBreach.Bound;
import com.sentinel.enginehealth.api.model.ThresholdTree;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;

/**
 * Turns the threshold tree of a resolved profile into {@link ThresholdCheck}s.
 *
 * <p>Every {@link ThresholdGroup} section may carry {@code critical} and {@code warning}
 * bands with {@code min}/{@code max}, {@code hysteresis.lowClear}/{@code highClear} and
 * {@code enabled: false}. Group extras:
 * <ul>
 * <li>{@code battery}: without hysteresis, low alerts clear 1 V (critical) or 0.5 V (warning)
 * above the limit and high alerts 1 V / 0.5 V below it.</li>
 * <li>{@code coolantTemp.gracePeriod}: warm-up seconds after each start, 60 by default.</li>
 * <li>{@code oilPressure.rpmDependent} with {@code rpmThreshold} (500 by default).</li>
 * <li>{@code rpm.overspeed}: critical maximum.</li>
 * <li>{@code fuelTrim.closedLoop}: the bands live one level down.</li>
 * <li>{@code knock.maxRetard.critical}/{@code warning}: maxima.</li>
 * </ul>
 */
public final class ThresholdChecks {

    static final double DEFAULT_COOLANT_WARMUP_SEC = 60.0;
    static final double DEFAULT_OIL_RPM_THRESHOLD = 500.0;

    private ThresholdChecks() {
    }

    public static List<ThresholdCheck> fromThresholds(ThresholdTree.Node thresholds) {
        List<ThresholdCheck> checks = new ArrayList<>();
        for (ThresholdGroup group : ThresholdGroup.values()) {
            ThresholdTree section = thresholds.child(group.thresholdKey()).orElse(null);
            if (section instanceof ThresholdTree.Node node && !isDisabled(node)) {
                addGroup(group, node, checks);
            }
        }
        return checks;
    }

    private static void addGroup(ThresholdGroup group, ThresholdTree.Node node, List<ThresholdCheck> checks) {
        ThresholdTree.Node bands = node;
        if (group == ThresholdGroup.FUEL_TRIM) {
            ThresholdTree closedLoop = node.child("closedLoop").orElse(null);
            if (!(closedLoop instanceof ThresholdTree.Node closedLoopNode)) {
                return;
            }
            bands = closedLoopNode;
        }
        double warmup = group == ThresholdGroup.COOLANT_TEMP
                ? node.numberAt("gracePeriod").orElse(DEFAULT_COOLANT_WARMUP_SEC) : 0.0;
        double minRpm = group == ThresholdGroup.OIL_PRESSURE && isTrue(node, "rpmDependent")
                ? node.numberAt("rpmThreshold").orElse(DEFAULT_OIL_RPM_THRESHOLD) : Double.NaN;
        OptionalDouble lowClear = node.numberAt("hysteresis.lowClear");
        OptionalDouble highClear = node.numberAt("hysteresis.highClear");
        Limits limits = new Limits(group, warmup, minRpm);

        bands.numberAt("critical.min").ifPresent(min -> checks.add(limits.band(Severity.CRITICAL, Bound.MIN, min,
                lowClear.orElse(batteryClear(group, min, 1.0)))));
        bands.numberAt("warning.min").ifPresent(min -> checks.add(limits.band(Severity.WARNING, Bound.MIN, min,
                lowClear.orElse(batteryClear(group, min, 0.5)))));
        bands.numberAt("critical.max").ifPresent(max -> checks.add(limits.band(Severity.CRITICAL, Bound.MAX, max,
                highClear.orElse(batteryClear(group, max, -1.0)))));
        bands.numberAt("warning.max").ifPresent(max -> checks.add(limits.band(Severity.WARNING, Bound.MAX, max,
                highClear.orElse(batteryClear(group, max, -0.5)))));

        if (group == ThresholdGroup.RPM) {
            node.numberAt("overspeed").ifPresent(limit -> checks.add(
                    limits.named("rpm_overspeed", "Engine Overspeed", Severity.CRITICAL, limit)));
        }
        if (group == ThresholdGroup.KNOCK) {
            node.numberAt("maxRetard.critical").ifPresent(limit -> checks.add(
                    limits.named("knock_critical", "Critical Knock Detected", Severity.CRITICAL, limit)));
            node.numberAt("maxRetard.warning").ifPresent(limit -> checks.add(
                    limits.named("knock_warning", "Knock Detected", Severity.WARNING, limit)));
        }
    }

    private static double batteryClear(ThresholdGroup group, double limit, double offset) {
        return group == ThresholdGroup.BATTERY ? limit + offset : Double.NaN;
    }

    private static boolean isDisabled(ThresholdTree.Node node) {
        return node.find("enabled")
                .filter(t -> t instanceof ThresholdTree.Leaf leaf && Boolean.FALSE.equals(leaf.value()))
                .isPresent();
    }

    private static boolean isTrue(ThresholdTree.Node node, String key) {
        return node.find(key)
                .filter(t -> t instanceof ThresholdTree.Leaf leaf && Boolean.TRUE.equals(leaf.value()))
                .isPresent();
    }

    private record Limits(ThresholdGroup group, double warmupSec, double minRpm) {

        ThresholdCheck band(Severity severity, Bound bound, double trigger, double clear) {
            String word = bound == Bound.MIN ? group.lowWord() : group.highWord();
            String id = group.idPrefix() + "_" + severity.name().toLowerCase(Locale.ROOT)
                    + "_" + word.toLowerCase(Locale.ROOT);
            String name = (severity == Severity.CRITICAL ? "Critical " : "") + word + " " + group.label();
            return new ThresholdCheck(id, name, group, severity, bound, trigger, clear, warmupSec, minRpm);
        }

        ThresholdCheck named(String id, String name, Severity severity, double trigger) {
            return new ThresholdCheck(id, name, group, severity, Bound.MAX, trigger, Double.NaN, warmupSec, minRpm);
        }
    }
}
