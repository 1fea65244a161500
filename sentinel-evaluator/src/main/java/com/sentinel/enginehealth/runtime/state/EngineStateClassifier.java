/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.runtime.state;

import com.sentinel.enginehealth.api.model.EngineState;
import com.sentinel.enginehealth.api.model.EngineStateConfig;
import com.sentinel.enginehealth.api.model.Recording;
import com.sentinel.enginehealth.api.model.Sample;
import com.sentinel.enginehealth.api.model.SignalQualityNote;
import org.roaringbitmap.RoaringBitmap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Runs {@link EngineStateMachine} over a recording and records one state per sample.
 *
 * <p>Never throws on bad input. A recording without the RPM or key-switch channel is
 * classified Off throughout with a {@code MISSING_REQUIRED_CHANNEL} note. A sample whose
 * time is not finite, or not after the last accepted sample, is skipped: it keeps the
 * previous state and is reported once in a {@code NON_MONOTONIC_TIME} note.
 */
public class EngineStateClassifier {

    private static final Logger logger = LoggerFactory.getLogger(EngineStateClassifier.class);

    private final EngineStateMachine machine;

    public EngineStateClassifier(EngineStateConfig config) {
        this.machine = new EngineStateMachine(config);
    }

    public EngineStateTimeline classify(Recording recording) {
        EngineStateConfig config = machine.config();
        int n = recording.size();
        EngineState[] states = new EngineState[n];
        boolean[] keyOn = new boolean[n];
        double[] lastStartAt = new double[n];
        double[] lastStopAt = new double[n];
        RoaringBitmap grace = new RoaringBitmap();
        RoaringBitmap skipped = new RoaringBitmap();
        List<StateTransition> transitions = new ArrayList<>();
        List<SignalQualityNote> notes = new ArrayList<>();

        markNonMonotonic(recording, skipped, notes);

        List<String> missing = new ArrayList<>();
        if (!recording.hasChannel(config.rpmChannel())) {
            missing.add(config.rpmChannel());
        }
        if (!recording.hasChannel(config.vswChannel())) {
            missing.add(config.vswChannel());
        }
        if (n > 0 && !missing.isEmpty()) {
            for (String channel : missing) {
                logger.warn("Recording {} has no {} channel, engine state defaults to OFF",
                        recording.id(), channel);
                notes.add(new SignalQualityNote(SignalQualityNote.Kind.MISSING_REQUIRED_CHANNEL, channel,
                        "Required channel " + channel + " is absent; every sample is classified OFF"));
            }
            Arrays.fill(states, EngineState.OFF);
            Arrays.fill(lastStartAt, Double.NaN);
            Arrays.fill(lastStopAt, Double.NaN);
            return new EngineStateTimeline(states, keyOn, grace, skipped, lastStartAt, lastStopAt,
                    transitions, notes, false);
        }

        EngineStateMachine.State current = EngineStateMachine.State.initial();
        double startAt = Double.NaN;
        double stopAt = Double.NaN;
        for (int i = 0; i < n; i++) {
            if (!skipped.contains(i)) {
                Sample sample = recording.get(i);
                EngineState before = current.state();
                current = machine.step(current, sample.time(),
                        sample.value(config.rpmChannel()), sample.value(config.vswChannel()));
                if (current.state() != before) {
                    StateTransition transition = new StateTransition(i, sample.time(), before, current.state());
                    transitions.add(transition);
                    if (transition.isStart()) {
                        startAt = sample.time();
                    } else if (transition.isStop()) {
                        stopAt = sample.time();
                    }
                }
                if (current.inGrace(sample.time(), config.startupGraceSeconds())) {
                    grace.add(i);
                }
            } else if (i > 0 && grace.contains(i - 1)) {
                grace.add(i);
            }
            states[i] = current.state();
            keyOn[i] = current.keyOn();
            lastStartAt[i] = startAt;
            lastStopAt[i] = stopAt;
        }
        logger.debug("Classified {} samples of {} with {} transitions", n, recording.id(), transitions.size());
        return new EngineStateTimeline(states, keyOn, grace, skipped, lastStartAt, lastStopAt,
                transitions, notes, true);
    }

    private static void markNonMonotonic(Recording recording, RoaringBitmap skipped, List<SignalQualityNote> notes) {
        double last = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < recording.size(); i++) {
            double time = recording.get(i).time();
            if (!Double.isFinite(time) || time <= last) {
                skipped.add(i);
            } else {
                last = time;
            }
        }
        if (!skipped.isEmpty()) {
            logger.warn("Recording {}: skipping {} sample(s) with non-increasing timestamps",
                    recording.id(), skipped.getCardinality());
            notes.add(new SignalQualityNote(SignalQualityNote.Kind.NON_MONOTONIC_TIME, "Time",
                    skipped.getCardinality() + " sample(s) skipped for duplicate or decreasing timestamps"));
        }
    }
}
