/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.runtime.stats;

import com.sentinel.enginehealth.api.model.Recording;
import com.sentinel.enginehealth.api.model.StateDwell;
import com.sentinel.enginehealth.api.model.TimeInState;
import com.sentinel.enginehealth.runtime.state.EngineStateTimeline;
import com.sentinel.enginehealth.runtime.validity.ValidityMask;
import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.objects.Object2DoubleLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.ArrayList;
import java.util.List;

/**
 * Wall-clock dwell time per discrete value.
 *
 * <p>The interval between two consecutive samples is credited to the earlier sample's
 * label. Intervals of zero or negative length, or longer than the staleness threshold,
 * are dropped, as are intervals that start at an unlabeled sample. Sample rate therefore
 * does not bias the percentages.
 */
public class TimeInStateCalculator {

    private final double staleThresholdSeconds;

    public TimeInStateCalculator(double staleThresholdSeconds) {
        this.staleThresholdSeconds = staleThresholdSeconds;
    }

    /**
     * @param times  sample times
     * @param labels label per sample, {@code null} where the sample carries no state
     */
    public TimeInState calculate(String channel, double[] times, String[] labels) {
        if (times.length != labels.length) {
            throw new IllegalArgumentException("times and labels differ in length");
        }
        Object2DoubleLinkedOpenHashMap<String> seconds = new Object2DoubleLinkedOpenHashMap<>();
        Object2IntOpenHashMap<String> entries = new Object2IntOpenHashMap<>();
        double total = 0.0;
        String previousLabel = null;

        for (int i = 0; i < labels.length; i++) {
            String label = labels[i];
            if (label != null) {
                if (!seconds.containsKey(label)) {
                    seconds.put(label, 0.0);
                }
                if (previousLabel != null && !previousLabel.equals(label)) {
                    entries.addTo(label, 1);
                }
                previousLabel = label;
            }
            if (i == 0 || labels[i - 1] == null) {
                continue;
            }
            double dt = times[i] - times[i - 1];
            if (dt <= 0 || dt > staleThresholdSeconds) {
                continue;
            }
            seconds.addTo(labels[i - 1], dt);
            total += dt;
        }

        List<StateDwell> states = new ArrayList<>(seconds.size());
        for (String label : seconds.keySet()) {
            double s = seconds.getDouble(label);
            states.add(new StateDwell(label, s, total > 0 ? s / total * 100.0 : 0.0, entries.getInt(label)));
        }
        return new TimeInState(channel, states, total);
    }

    /**
     * Dwell per rounded channel value, counting only samples the channel's statistics
     * policy admits.
     */
    public TimeInState forChannel(Recording recording, String channel, EngineStateTimeline timeline,
                                  ValidityMask mask) {
        DoubleArrayList times = new DoubleArrayList();
        List<String> labels = new ArrayList<>();
        for (int i = 0; i < recording.size(); i++) {
            if (!timeline.isAccepted(i)) {
                continue;
            }
            times.add(recording.get(i).time());
            labels.add(mask.isStatsValid(channel, i) ? label(recording.get(i).value(channel)) : null);
        }
        return calculate(channel, times.toDoubleArray(), labels.toArray(new String[0]));
    }

    /**
     * Dwell per engine state over the accepted samples.
     */
    public TimeInState forEngineState(Recording recording, EngineStateTimeline timeline) {
        DoubleArrayList times = new DoubleArrayList();
        List<String> labels = new ArrayList<>();
        for (int i = 0; i < recording.size(); i++) {
            if (timeline.isAccepted(i)) {
                times.add(recording.get(i).time());
                labels.add(timeline.state(i).name());
            }
        }
        return calculate("EngineState", times.toDoubleArray(), labels.toArray(new String[0]));
    }

    static String label(double value) {
        return String.valueOf(Math.round(value));
    }
}
