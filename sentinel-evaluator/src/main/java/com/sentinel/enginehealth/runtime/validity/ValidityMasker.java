/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.runtime.validity;

import com.sentinel.enginehealth.api.model.ChannelPolicy;
import com.sentinel.enginehealth.api.model.EngineState;
import com.sentinel.enginehealth.api.model.Recording;
import com.sentinel.enginehealth.api.model.Sample;
import com.sentinel.enginehealth.runtime.state.EngineStateTimeline;
import org.roaringbitmap.RoaringBitmap;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Builds a {@link ValidityMask} from per-channel policies and the engine-state timeline.
 *
 * <p>A sample counts for a channel when the value is present, passes the
 * {@code excludeZero}/{@code excludeNegative} filters, the sample was accepted by the
 * classifier and the engine state admits it under the relevant policy.
 */
public class ValidityMasker {

    private final Function<String, ChannelPolicy> policies;

    public ValidityMasker(Function<String, ChannelPolicy> policies) {
        this.policies = policies;
    }

    public ValidityMask mask(Recording recording, EngineStateTimeline timeline) {
        Map<String, RoaringBitmap> stats = new LinkedHashMap<>();
        Map<String, RoaringBitmap> alert = new LinkedHashMap<>();
        Map<String, ChannelPolicy> used = new LinkedHashMap<>();

        for (String channel : recording.channels()) {
            ChannelPolicy policy = policies.apply(channel);
            RoaringBitmap statsBits = new RoaringBitmap();
            RoaringBitmap alertBits = new RoaringBitmap();
            for (int i = 0; i < recording.size(); i++) {
                Sample sample = recording.get(i);
                if (!timeline.isAccepted(i) || !policy.acceptsValue(sample.value(channel))) {
                    continue;
                }
                EngineState state = timeline.state(i);
                boolean keyOn = timeline.isKeyOn(i);
                if (policy.statsPolicy().admits(state, keyOn)) {
                    statsBits.add(i);
                }
                if (policy.alertPolicy().admits(state, keyOn)) {
                    alertBits.add(i);
                }
            }
            statsBits.runOptimize();
            alertBits.runOptimize();
            stats.put(channel, statsBits);
            alert.put(channel, alertBits);
            used.put(channel, policy);
        }
        return new ValidityMask(stats, alert, used);
    }
}
