/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.runtime.validity;

import com.sentinel.enginehealth.api.model.ChannelPolicy;
import com.sentinel.enginehealth.runtime.condition.SampleFrame;
import org.roaringbitmap.RoaringBitmap;

import java.util.Collections;
import java.util.Map;
import java.util.Set;

/**
 * Sample indices at which each channel counts for statistics and for alerting.
 *
 * <p>Channels the mask does not know are never valid.
 */
public final class ValidityMask implements SampleFrame.ChannelGate {

    private static final RoaringBitmap EMPTY = new RoaringBitmap();

    private final Map<String, RoaringBitmap> statsValid;
    private final Map<String, RoaringBitmap> alertValid;
    private final Map<String, ChannelPolicy> policies;

    ValidityMask(Map<String, RoaringBitmap> statsValid, Map<String, RoaringBitmap> alertValid,
                 Map<String, ChannelPolicy> policies) {
        this.statsValid = statsValid;
        this.alertValid = alertValid;
        this.policies = policies;
    }

    public Set<String> channels() {
        return Collections.unmodifiableSet(statsValid.keySet());
    }

    public boolean isStatsValid(String channel, int index) {
        return statsValid.getOrDefault(channel, EMPTY).contains(index);
    }

    public boolean isAlertValid(String channel, int index) {
        return alertValid.getOrDefault(channel, EMPTY).contains(index);
    }

    @Override
    public boolean admits(String channel, int index) {
        return isAlertValid(channel, index);
    }

    public int statsValidCount(String channel) {
        return statsValid.getOrDefault(channel, EMPTY).getCardinality();
    }

    public int alertValidCount(String channel) {
        return alertValid.getOrDefault(channel, EMPTY).getCardinality();
    }

    public ChannelPolicy policy(String channel) {
        return policies.getOrDefault(channel, ChannelPolicy.ALWAYS);
    }
}
