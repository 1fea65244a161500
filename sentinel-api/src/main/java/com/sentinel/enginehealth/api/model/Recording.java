/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.api.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * An ordered sequence of samples from one engine run.
 */
public record Recording(String id, List<Sample> samples) {

    public Recording {
        samples = List.copyOf(samples);
    }

    public static Recording of(String id, List<Sample> samples) {
        return new Recording(id, samples);
    }

    public int size() {
        return samples.size();
    }

    public Sample get(int index) {
        return samples.get(index);
    }

    /**
     * Every channel name that carries a value in at least one sample, in first-seen order.
     */
    public Set<String> channels() {
        Set<String> channels = new LinkedHashSet<>();
        for (Sample sample : samples) {
            channels.addAll(sample.values().keySet());
        }
        return Collections.unmodifiableSet(channels);
    }

    public boolean hasChannel(String channel) {
        for (Sample sample : samples) {
            if (sample.has(channel)) {
                return true;
            }
        }
        return false;
    }

    public double startTime() {
        return samples.isEmpty() ? 0.0 : samples.get(0).time();
    }

    public double endTime() {
        return samples.isEmpty() ? 0.0 : samples.get(samples.size() - 1).time();
    }
}
