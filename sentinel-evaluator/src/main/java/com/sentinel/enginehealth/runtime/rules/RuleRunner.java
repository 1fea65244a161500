/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.runtime.rules;

import com.sentinel.enginehealth.api.model.AlertEvent;
import com.sentinel.enginehealth.api.model.Rule;
import com.sentinel.enginehealth.runtime.condition.ConditionEvaluator;
import com.sentinel.enginehealth.runtime.condition.SampleFrame;

import java.util.ArrayList;
import java.util.List;

/**
 * Drives one rule through a recording: gating, suppression, base condition and the
 * {@link RuleStateMachine}. State is confined to a single analysis run.
 */
final class RuleRunner {

    private final Rule rule;
    private final ConditionEvaluator conditions;
    private final TipMapDeltaEvaluator tipMapDelta;
    private final RollingWindow window;
    private final List<AlertEvent> alerts = new ArrayList<>();

    private RuleState state = RuleState.IDLE;
    private double previousTime = Double.NaN;
    private boolean previousTruth;

    RuleRunner(Rule rule, ConditionEvaluator conditions) {
        this.rule = rule;
        this.conditions = conditions;
        this.tipMapDelta = switch (rule.type()) {
            case GENERIC -> null;
            case TIP_MAP_DELTA -> new TipMapDeltaEvaluator(rule.tipMapDelta(), conditions);
        };
        this.window = rule.hasWindow() ? new RollingWindow(rule.windowSec()) : null;
    }

    Rule rule() {
        return rule;
    }

    /**
     * @param suppressed start/stop delay or startup grace applies to this sample
     */
    void step(SampleFrame frame, boolean suppressed) {
        double now = frame.time();
        boolean blocked = suppressed || !passesGates(frame);
        boolean truth = baseCondition(frame, blocked);

        RuleStateMachine.StepResult result;
        if (window != null) {
            if (!Double.isNaN(previousTime)) {
                window.add(previousTime, now, previousTruth);
            }
            result = RuleStateMachine.stepWindowed(state, truth, now, window.trueSeconds(),
                    rule.triggerPersistenceSec(), rule.clearPersistenceSec());
        } else {
            result = RuleStateMachine.step(state, truth, now,
                    rule.triggerPersistenceSec(), rule.clearPersistenceSec());
        }
        state = result.next();
        previousTime = now;
        previousTruth = truth;

        switch (result.emission()) {
            case FIRE -> alerts.add(new AlertEvent(rule.id(), rule.category(), rule.severity(),
                    result.eventTime(), null, alertMessage()));
            case CLEAR -> {
                int last = alerts.size() - 1;
                alerts.set(last, alerts.get(last).cleared(result.eventTime()));
                if (window != null) {
                    window.reset();
                }
            }
            case NONE -> {
            }
        }
    }

    List<AlertEvent> alerts() {
        return List.copyOf(alerts);
    }

    RuleState state() {
        return state;
    }

    private boolean passesGates(SampleFrame frame) {
        return !conditions.anyTrue(rule.ignoreWhen(), frame) && conditions.allTrue(rule.requireWhen(), frame);
    }

    private boolean baseCondition(SampleFrame frame, boolean blocked) {
        if (tipMapDelta != null) {
            return tipMapDelta.evaluate(frame, blocked);
        }
        return !blocked && conditions.evaluateAll(rule.conditions(), rule.logic(), frame);
    }

    private String alertMessage() {
        if (rule.description() != null && !rule.description().isBlank()) {
            return rule.description();
        }
        return rule.name() + " triggered";
    }
}
