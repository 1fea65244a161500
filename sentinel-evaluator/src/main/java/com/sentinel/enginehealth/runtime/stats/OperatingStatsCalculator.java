/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.runtime.stats;

import com.sentinel.enginehealth.api.model.OperatingStats;
import com.sentinel.enginehealth.api.model.Recording;
import com.sentinel.enginehealth.infra.config.AnalysisSettings;
import com.sentinel.enginehealth.runtime.state.EngineStateTimeline;

/**
 * Runtime, idle and loaded time plus RPM and MAP figures.
 *
 * <p>Durations use the same attribution as {@link TimeInStateCalculator}: each interval
 * belongs to the earlier sample's RPM, and stale or non-positive intervals are dropped.
 * Running means RPM above the runtime threshold; idle is running up to the idle ceiling,
 * loaded is above it. Averages are plain sample means over running samples.
 */
public class OperatingStatsCalculator {

    private final AnalysisSettings settings;

    public OperatingStatsCalculator(AnalysisSettings settings) {
        this.settings = settings;
    }

    public OperatingStats calculate(Recording recording, EngineStateTimeline timeline) {
        String rpmChannel = settings.getEngineState().rpmChannel();
        String mapChannel = settings.getMapChannel();
        double runtimeRpm = settings.getRuntimeRpmThreshold();
        double idleCeiling = settings.getIdleRpmCeiling();

        double runtime = 0;
        double idle = 0;
        double loaded = 0;
        double maxRpm = 0;
        double rpmSum = 0;
        long rpmCount = 0;
        double maxMap = 0;
        double mapSum = 0;
        long mapCount = 0;

        int previous = -1;
        for (int i = 0; i < recording.size(); i++) {
            if (!timeline.isAccepted(i)) {
                continue;
            }
            double rpm = recording.get(i).value(rpmChannel);
            if (!Double.isNaN(rpm)) {
                maxRpm = Math.max(maxRpm, rpm);
                if (rpm > runtimeRpm) {
                    rpmSum += rpm;
                    rpmCount++;
                    double map = recording.get(i).value(mapChannel);
                    if (!Double.isNaN(map)) {
                        maxMap = Math.max(maxMap, map);
                        mapSum += map;
                        mapCount++;
                    }
                }
            }

            if (previous >= 0) {
                double dt = recording.get(i).time() - recording.get(previous).time();
                double previousRpm = recording.get(previous).value(rpmChannel);
                if (dt > 0 && dt <= settings.getStaleThresholdSeconds() && previousRpm > runtimeRpm) {
                    runtime += dt;
                    if (previousRpm <= idleCeiling) {
                        idle += dt;
                    } else {
                        loaded += dt;
                    }
                }
            }
            previous = i;
        }
        return new OperatingStats(runtime, idle, loaded, maxRpm,
                rpmCount == 0 ? 0 : rpmSum / rpmCount, maxMap, mapCount == 0 ? 0 : mapSum / mapCount);
    }
}
