/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.runtime.state;

import com.sentinel.enginehealth.api.model.EngineState;
import com.sentinel.enginehealth.api.model.EngineStateConfig;

import java.util.Objects;

/**
 * Engine-state classifier as a pure transition function.
 *
 * <pre>
 * Off -> Cranking -> Unstable -> Stable -> Stopping -> Off
 * </pre>
 *
 * <ul>
 * <li>Off to Cranking: key on, on a rising edge or with RPM already at cranking speed.</li>
 * <li>Cranking to Unstable: RPM above the running threshold for {@code debounceSamples}
 * consecutive samples. Opens the startup grace window. Key off returns to Off, and so does
 * RPM below cranking for {@code stopHoldoffSeconds} (key on, engine not turning).</li>
 * <li>Unstable to Stable: RPM above the stable threshold for {@code stableHoldoffSeconds}.</li>
 * <li>Unstable or Stable to Stopping: key off, or RPM below running for {@code stopHoldoffSeconds}.</li>
 * <li>Stopping to Off: key off for {@code keyOffDebounceSeconds}, or RPM below cranking for
 * {@code stopHoldoffSeconds}. RPM back above running with the key on returns to Unstable.</li>
 * </ul>
 *
 * <p>All durations count from the later of the condition start and the state entry. A
 * missing RPM or key-switch reading holds the previous value.
 */
public final class EngineStateMachine {

    /**
     * Immutable classifier state carried from sample to sample.
     *
     * @param state              current engine state
     * @param enteredAt          time the current state was entered, NaN before the first sample
     * @param runningCount       consecutive samples with RPM above running since entering the state
     * @param keyOn              key state of the last sample
     * @param keyOffSince        start of the current key-off stretch, NaN while the key is on
     * @param aboveStableSince   start of the current RPM-above-stable stretch
     * @param belowRunningSince  start of the current RPM-below-running stretch
     * @param belowCrankingSince start of the current RPM-below-cranking stretch
     * @param graceStart         time of the last Cranking to Unstable transition, NaN if none
     * @param rpm                last known RPM
     * @param vsw                last known key-switch voltage
     */
    public record State(
            EngineState state,
            double enteredAt,
            int runningCount,
            boolean keyOn,
            double keyOffSince,
            double aboveStableSince,
            double belowRunningSince,
            double belowCrankingSince,
            double graceStart,
            double rpm,
            double vsw) {

        public static State initial() {
            return new State(EngineState.OFF, Double.NaN, 0, false,
                    Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN, 0.0, 0.0);
        }

        /**
         * Whether {@code time} falls in the grace window that follows the last start.
         */
        public boolean inGrace(double time, double graceSeconds) {
            return state.isEngineActive() && !Double.isNaN(graceStart)
                    && time >= graceStart && time - graceStart < graceSeconds;
        }
    }

    private final EngineStateConfig config;

    public EngineStateMachine(EngineStateConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public EngineStateConfig config() {
        return config;
    }

    /**
     * Advances the classifier by one sample.
     *
     * @param current previous state
     * @param time    sample time, strictly greater than the previous one
     * @param rpmRaw  RPM reading, NaN when the sample has none
     * @param vswRaw  key-switch voltage, NaN when the sample has none
     */
    public State step(State current, double time, double rpmRaw, double vswRaw) {
        double rpm = Double.isNaN(rpmRaw) ? current.rpm() : rpmRaw;
        double vsw = Double.isNaN(vswRaw) ? current.vsw() : vswRaw;
        boolean keyOn = vsw >= config.vswOnThreshold();
        boolean risingEdge = keyOn && !current.keyOn();

        double keyOffSince = keyOn ? Double.NaN : since(current.keyOffSince(), time);
        double aboveStable = rpm > config.rpmStableThreshold() ? since(current.aboveStableSince(), time) : Double.NaN;
        double belowRunning = rpm < config.rpmRunningThreshold() ? since(current.belowRunningSince(), time) : Double.NaN;
        double belowCranking = rpm < config.rpmCrankingThreshold()
                ? since(current.belowCrankingSince(), time) : Double.NaN;
        boolean aboveRunning = rpm > config.rpmRunningThreshold();
        int runningCount = aboveRunning ? current.runningCount() + 1 : 0;

        State carried = new State(current.state(), current.enteredAt(), runningCount, keyOn, keyOffSince,
                aboveStable, belowRunning, belowCranking, current.graceStart(), rpm, vsw);

        return switch (current.state()) {
            case OFF -> keyOn && (risingEdge || rpm >= config.rpmCrankingThreshold())
                    ? enter(carried, EngineState.CRANKING, time, aboveRunning)
                    : carried;
            case CRANKING -> {
                if (!keyOn || held(belowCranking, carried, time, config.stopHoldoffSeconds())) {
                    yield enter(carried, EngineState.OFF, time, false);
                }
                if (runningCount >= config.debounceSamples()) {
                    State unstable = enter(carried, EngineState.UNSTABLE, time, aboveRunning);
                    yield withGrace(unstable, time);
                }
                yield carried;
            }
            case UNSTABLE -> {
                if (!keyOn || held(belowRunning, carried, time, config.stopHoldoffSeconds())) {
                    yield enter(carried, EngineState.STOPPING, time, false);
                }
                if (held(aboveStable, carried, time, config.stableHoldoffSeconds())) {
                    yield enter(carried, EngineState.STABLE, time, aboveRunning);
                }
                yield carried;
            }
            case STABLE -> !keyOn || held(belowRunning, carried, time, config.stopHoldoffSeconds())
                    ? enter(carried, EngineState.STOPPING, time, false)
                    : carried;
            case STOPPING -> {
                if (held(keyOffSince, carried, time, config.keyOffDebounceSeconds())
                        || held(belowCranking, carried, time, config.stopHoldoffSeconds())) {
                    yield enter(carried, EngineState.OFF, time, false);
                }
                if (keyOn && runningCount >= config.debounceSamples()) {
                    yield enter(carried, EngineState.UNSTABLE, time, aboveRunning);
                }
                yield carried;
            }
        };
    }

    private static State enter(State s, EngineState next, double time, boolean countThisSample) {
        return new State(next, time, countThisSample ? 1 : 0, s.keyOn(), s.keyOffSince(),
                s.aboveStableSince(), s.belowRunningSince(), s.belowCrankingSince(), s.graceStart(),
                s.rpm(), s.vsw());
    }

    private static State withGrace(State s, double time) {
        return new State(s.state(), s.enteredAt(), s.runningCount(), s.keyOn(), s.keyOffSince(),
                s.aboveStableSince(), s.belowRunningSince(), s.belowCrankingSince(), time, s.rpm(), s.vsw());
    }

    private static double since(double previous, double time) {
        return Double.isNaN(previous) ? time : previous;
    }

    // A stretch only counts from the moment the current state was entered.
    private static boolean held(double stretchStart, State s, double time, double seconds) {
        if (Double.isNaN(stretchStart)) {
            return false;
        }
        double from = Double.isNaN(s.enteredAt()) ? stretchStart : Math.max(stretchStart, s.enteredAt());
        return time - from >= seconds;
    }
}
