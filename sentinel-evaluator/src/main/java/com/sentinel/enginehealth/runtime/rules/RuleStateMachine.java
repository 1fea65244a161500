/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.runtime.rules;

/**
 * Trigger and clear logic of a rule as a pure function of the previous {@link RuleState}.
 *
 * <p>Continuous mode fires once the condition has been true for
 * {@code triggerPersistenceSec}, reporting onset as the start of the true stretch plus
 * the persistence. Window mode fires as soon as the accumulated true time within the
 * window reaches the persistence, with onset at the current sample. Both modes clear
 * after {@code clearPersistenceSec} of continuous false, reporting the first false
 * sample as the clear time. A single true sample during the clear delay resets it.
 */
public final class RuleStateMachine {

    public enum Emission {
        NONE,
        FIRE,
        CLEAR
    }

    /**
     * @param next      state after the sample
     * @param emission  alert edge produced by the sample
     * @param eventTime onset for {@code FIRE}, clear time for {@code CLEAR}, NaN otherwise
     */
    public record StepResult(RuleState next, Emission emission, double eventTime) {
    }

    private RuleStateMachine() {
    }

    /**
     * Continuous-mode step.
     *
     * @param condition base condition after gating and suppression
     */
    public static StepResult step(RuleState state, boolean condition, double now,
                                  double triggerPersistenceSec, double clearPersistenceSec) {
        if (condition) {
            double trueSince = Double.isNaN(state.trueSince()) ? now : state.trueSince();
            if (!state.firing() && now - trueSince >= triggerPersistenceSec) {
                double onset = trueSince + triggerPersistenceSec;
                return new StepResult(new RuleState(true, trueSince, Double.NaN, onset), Emission.FIRE, onset);
            }
            return noEdge(new RuleState(state.firing(), trueSince, Double.NaN, state.onsetTime()));
        }
        return falseStep(state, now, clearPersistenceSec);
    }

    /**
     * Window-mode step.
     *
     * @param windowTrueSec true time accumulated within the trailing window up to {@code now}
     */
    public static StepResult stepWindowed(RuleState state, boolean condition, double now, double windowTrueSec,
                                          double triggerPersistenceSec, double clearPersistenceSec) {
        if (!state.firing()) {
            boolean reached = triggerPersistenceSec > 0
                    ? windowTrueSec >= triggerPersistenceSec
                    : condition;
            if (reached) {
                RuleState fired = condition
                        ? new RuleState(true, Double.isNaN(state.trueSince()) ? now : state.trueSince(), Double.NaN, now)
                        : new RuleState(true, Double.NaN, now, now);
                return new StepResult(fired, Emission.FIRE, now);
            }
        }
        if (condition) {
            double trueSince = Double.isNaN(state.trueSince()) ? now : state.trueSince();
            return noEdge(new RuleState(state.firing(), trueSince, Double.NaN, state.onsetTime()));
        }
        return falseStep(state, now, clearPersistenceSec);
    }

    private static StepResult falseStep(RuleState state, double now, double clearPersistenceSec) {
        if (!state.firing()) {
            return noEdge(RuleState.IDLE);
        }
        double lastFalseAt = Double.isNaN(state.lastFalseAt()) ? now : state.lastFalseAt();
        if (now - lastFalseAt >= clearPersistenceSec) {
            return new StepResult(RuleState.IDLE, Emission.CLEAR, lastFalseAt);
        }
        return noEdge(new RuleState(true, Double.NaN, lastFalseAt, state.onsetTime()));
    }

    private static StepResult noEdge(RuleState next) {
        return new StepResult(next, Emission.NONE, Double.NaN);
    }
}
