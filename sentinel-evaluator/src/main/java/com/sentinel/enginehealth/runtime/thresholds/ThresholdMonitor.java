/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.runtime.thresholds;

import com.sentinel.enginehealth.api.model.AlertEvent;
import com.sentinel.enginehealth.api.model.EngineStateConfig;
import com.sentinel.enginehealth.api.model.Recording;
import com.sentinel.enginehealth.api.model.Sample;
import com.sentinel.enginehealth.api.model.ThresholdBreach;
import com.sentinel.enginehealth.api.model.ThresholdTree;
import com.sentinel.enginehealth.infra.metrics.MetricsRegistry;
import com.sentinel.enginehealth.runtime.state.EngineStateTimeline;
import com.sentinel.enginehealth.runtime.validity.ValidityMask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Raises alerts straight from a profile's threshold limits, next to the profile's rules.
 *
 * <p>A check is idle on a sample when the sample is in the startup grace window, when its
 * channel is not alert-valid there, when its group only runs with the engine running and
 * the engine is not, during the coolant warm-up after a start, or below the oil-pressure
 * RPM gate. An idle sample clears an active alert. Otherwise a reading past the trigger
 * opens the alert and it stays open until the reading passes back over the clear limit.
 * The onset is the first breaching sample and the clear time is the first sample that
 * clears it; alerts still open at the end keep a {@code null} clear time.
 */
public class ThresholdMonitor {

    private static final Logger logger = LoggerFactory.getLogger(ThresholdMonitor.class);

    static final String METRIC_THRESHOLD_ALERTS = "sentinel_threshold_alerts_total";

    private final EngineStateConfig engineConfig;
    private final MetricsRegistry metrics;

    public ThresholdMonitor(EngineStateConfig engineConfig, MetricsRegistry metrics) {
        this.engineConfig = Objects.requireNonNull(engineConfig, "engineConfig");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public List<AlertEvent> run(ThresholdTree.Node thresholds, Recording recording, EngineStateTimeline timeline,
                                ValidityMask mask) {
        List<ThresholdCheck> checks = ThresholdChecks.fromThresholds(thresholds);
        List<AlertEvent> alerts = new ArrayList<>();
        for (ThresholdCheck check : checks) {
            Optional<String> channel = check.group().resolveChannel(recording);
            if (channel.isEmpty()) {
                logger.debug("No channel for threshold check {} in recording {}", check.id(), recording.id());
                continue;
            }
            alerts.addAll(track(check, channel.get(), recording, timeline, mask));
        }
        alerts.sort(Comparator.comparingDouble(AlertEvent::onsetTime));
        for (AlertEvent alert : alerts) {
            metrics.counter(METRIC_THRESHOLD_ALERTS, "severity", alert.severity().name().toLowerCase(Locale.ROOT))
                    .increment();
        }
        logger.debug("Recording {}: {} threshold check(s), {} alert(s)", recording.id(), checks.size(), alerts.size());
        return alerts;
    }

    private List<AlertEvent> track(ThresholdCheck check, String channel, Recording recording,
                                   EngineStateTimeline timeline, ValidityMask mask) {
        List<AlertEvent> alerts = new ArrayList<>();
        AlertEvent open = null;
        double rpm = 0.0;
        for (int i = 0; i < recording.size(); i++) {
            if (!timeline.isAccepted(i)) {
                continue;
            }
            Sample sample = recording.get(i);
            double time = sample.time();
            double rpmReading = sample.value(engineConfig.rpmChannel());
            if (!Double.isNaN(rpmReading)) {
                rpm = rpmReading;
            }
            double value = mask.isAlertValid(channel, i) ? sample.value(channel) : Double.NaN;

            if (isIdle(check, timeline, i, time, rpm) || Double.isNaN(value)) {
                if (open != null) {
                    alerts.add(open.cleared(time));
                    open = null;
                }
            } else if (open == null) {
                if (check.breaches(value)) {
                    open = new AlertEvent(check.id(), check.group().category(), check.severity(), time, null,
                            check.name(), ThresholdBreach.first(channel, check.bound(), check.trigger(),
                            check.group().unit(), value));
                }
            } else if (check.clears(value)) {
                alerts.add(open.cleared(time));
                open = null;
            } else {
                open = open.withBreach(open.breach().update(value));
            }
        }
        if (open != null) {
            alerts.add(open);
        }
        return alerts;
    }

    private static boolean isIdle(ThresholdCheck check, EngineStateTimeline timeline, int index, double time,
                                  double rpm) {
        if (timeline.isInStartupGrace(index)) {
            return true;
        }
        if (check.group().runningOnly() && !timeline.state(index).isRunning()) {
            return true;
        }
        double lastStart = timeline.lastStartAt(index);
        if (check.warmupSec() > 0 && (Double.isNaN(lastStart) || time - lastStart < check.warmupSec())) {
            return true;
        }
        return !Double.isNaN(check.minRpm()) && rpm < check.minRpm();
    }
}
