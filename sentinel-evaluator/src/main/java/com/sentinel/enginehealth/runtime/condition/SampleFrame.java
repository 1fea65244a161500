/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.runtime.condition;

import com.sentinel.enginehealth.api.model.EngineState;
import com.sentinel.enginehealth.api.model.Sample;

/**
 * One sample as seen by the rule engine.
 *
 * @param index          position in the recording
 * @param sample         raw sample
 * @param state          classified engine state
 * @param inStartupGrace whether the sample falls in the grace window after a start
 * @param channelGate    decides whether a channel value may be used for alerting
 */
public record SampleFrame(
        int index,
        Sample sample,
        EngineState state,
        boolean inStartupGrace,
        ChannelGate channelGate) {

    /**
     * Alert-side validity of a channel value at a sample index.
     */
    @FunctionalInterface
    public interface ChannelGate {
        ChannelGate OPEN = (channel, index) -> true;

        boolean admits(String channel, int index);
    }

    public static SampleFrame of(Sample sample, EngineState state) {
        return new SampleFrame(0, sample, state, false, ChannelGate.OPEN);
    }

    public double time() {
        return sample.time();
    }

    /**
     * Channel value for alerting, {@code NaN} when absent or masked out.
     */
    public double alertValue(String channel) {
        double value = sample.value(channel);
        if (Double.isNaN(value) || !channelGate.admits(channel, index)) {
            return Double.NaN;
        }
        return value;
    }
}
