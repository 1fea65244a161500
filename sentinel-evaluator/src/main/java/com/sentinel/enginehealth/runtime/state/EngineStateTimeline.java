/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.runtime.state;

import com.sentinel.enginehealth.api.model.EngineState;
import com.sentinel.enginehealth.api.model.SignalQualityNote;
import org.roaringbitmap.RoaringBitmap;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Per-sample output of the engine-state classifier.
 *
 * <p>Index {@code i} always refers to sample {@code i} of the recording. Samples that were
 * skipped for a non-increasing timestamp carry the previous state and report
 * {@link #isAccepted(int)} as false.
 */
public final class EngineStateTimeline {

    private final EngineState[] states;
    private final boolean[] keyOn;
    private final RoaringBitmap grace;
    private final RoaringBitmap skipped;
    private final double[] lastStartAt;
    private final double[] lastStopAt;
    private final List<StateTransition> transitions;
    private final List<SignalQualityNote> notes;
    private final boolean classified;

    EngineStateTimeline(EngineState[] states, boolean[] keyOn, RoaringBitmap grace, RoaringBitmap skipped,
                        double[] lastStartAt, double[] lastStopAt, List<StateTransition> transitions,
                        List<SignalQualityNote> notes, boolean classified) {
        this.states = states;
        this.keyOn = keyOn;
        this.grace = grace;
        this.skipped = skipped;
        this.lastStartAt = lastStartAt;
        this.lastStopAt = lastStopAt;
        this.transitions = List.copyOf(transitions);
        this.notes = List.copyOf(notes);
        this.classified = classified;
    }

    public int size() {
        return states.length;
    }

    public EngineState state(int index) {
        return states[index];
    }

    public List<EngineState> states() {
        return Collections.unmodifiableList(Arrays.asList(states.clone()));
    }

    public boolean isKeyOn(int index) {
        return keyOn[index];
    }

    public boolean isInStartupGrace(int index) {
        return grace.contains(index);
    }

    public boolean isAccepted(int index) {
        return !skipped.contains(index);
    }

    public int skippedCount() {
        return skipped.getCardinality();
    }

    /**
     * Time of the most recent Off to Cranking transition at or before the sample, NaN if none.
     */
    public double lastStartAt(int index) {
        return lastStartAt[index];
    }

    /**
     * Time of the most recent running to Stopping transition at or before the sample, NaN if none.
     */
    public double lastStopAt(int index) {
        return lastStopAt[index];
    }

    public List<StateTransition> transitions() {
        return transitions;
    }

    public List<SignalQualityNote> notes() {
        return notes;
    }

    /**
     * False when a required channel was missing and every sample defaulted to Off.
     */
    public boolean isClassified() {
        return classified;
    }
}
