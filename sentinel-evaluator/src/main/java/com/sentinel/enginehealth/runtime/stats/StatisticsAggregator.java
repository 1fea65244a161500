/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.runtime.stats;

import com.sentinel.enginehealth.api.model.ChannelStatistics;
import com.sentinel.enginehealth.api.model.Recording;
import com.sentinel.enginehealth.runtime.state.EngineStateTimeline;
import com.sentinel.enginehealth.runtime.validity.ValidityMask;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Min, max, mean and standard deviation per channel over the samples its statistics
 * policy admits. Uses Welford's running update, so one pass and no sorting.
 */
public class StatisticsAggregator {

    public Map<String, ChannelStatistics> aggregate(Recording recording, EngineStateTimeline timeline,
                                                    ValidityMask mask) {
        Map<String, ChannelStatistics> result = new LinkedHashMap<>();
        for (String channel : recording.channels()) {
            RunningStats running = new RunningStats();
            long total = 0;
            for (int i = 0; i < recording.size(); i++) {
                double value = recording.get(i).value(channel);
                if (!timeline.isAccepted(i) || !Double.isFinite(value)) {
                    continue;
                }
                total++;
                if (mask.isStatsValid(channel, i)) {
                    running.add(value);
                }
            }
            result.put(channel, running.count() == 0
                    ? ChannelStatistics.empty(channel, total, mask.policy(channel).statsPolicy())
                    : new ChannelStatistics(channel, running.min(), running.max(), running.mean(),
                    running.stdDev(), running.count(), total, mask.policy(channel).statsPolicy(), false));
        }
        return result;
    }

    /**
     * Welford accumulator. Population standard deviation.
     */
    static final class RunningStats {
        private long count;
        private double mean;
        private double m2;
        private double min = Double.POSITIVE_INFINITY;
        private double max = Double.NEGATIVE_INFINITY;

        void add(double value) {
            count++;
            double delta = value - mean;
            mean += delta / count;
            m2 += delta * (value - mean);
            min = Math.min(min, value);
            max = Math.max(max, value);
        }

        long count() {
            return count;
        }

        double mean() {
            return count == 0 ? Double.NaN : mean;
        }

        double stdDev() {
            return count == 0 ? Double.NaN : Math.sqrt(m2 / count);
        }

        double min() {
            return count == 0 ? Double.NaN : min;
        }

        double max() {
            return count == 0 ? Double.NaN : max;
        }
    }
}
