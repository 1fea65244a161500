/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.runtime.condition;

import com.sentinel.enginehealth.api.model.ComparisonOperator;
import com.sentinel.enginehealth.api.model.Condition;
import com.sentinel.enginehealth.api.model.EngineState;
import com.sentinel.enginehealth.api.model.LogicOperator;
import com.sentinel.enginehealth.api.model.Sample;

import java.util.List;
import java.util.Optional;

/**
 * Evaluates single conditions and condition lists against a sample.
 *
 * <p>Engine-state predicates are answered from the engine state; any other parameter
 * is read from the sample. A missing value never satisfies a condition, whatever the
 * operator. Predicates compare against the rounded expected value for {@code ==}
 * and {@code !=}, so {@code EngineRunning == 0.9} reads as {@code == 1}.
 *
 * <p>Stateless and thread-safe.
 */
public final class ConditionEvaluator {

    public boolean evaluate(Condition condition, Sample sample, EngineState engineState) {
        return evaluate(condition, SampleFrame.of(sample, engineState));
    }

    public boolean evaluate(Condition condition, SampleFrame frame) {
        Optional<EngineStatePredicate> predicate = EngineStatePredicate.fromParam(condition.param());
        if (predicate.isPresent()) {
            double actual = predicate.get().valueFor(frame.state(), frame.inStartupGrace());
            ComparisonOperator op = condition.operator();
            double expected = op == ComparisonOperator.EQUAL || op == ComparisonOperator.NOT_EQUAL
                    ? Math.rint(condition.value())
                    : condition.value();
            return op.test(actual, expected);
        }
        double actual = frame.alertValue(condition.param());
        if (Double.isNaN(actual)) {
            return false;
        }
        return condition.operator().test(actual, condition.value());
    }

    /**
     * Combines conditions with AND or OR. An empty list is false.
     */
    public boolean evaluateAll(List<Condition> conditions, LogicOperator logic, SampleFrame frame) {
        if (conditions.isEmpty()) {
            return false;
        }
        if (logic == LogicOperator.OR) {
            for (Condition condition : conditions) {
                if (evaluate(condition, frame)) {
                    return true;
                }
            }
            return false;
        }
        for (Condition condition : conditions) {
            if (!evaluate(condition, frame)) {
                return false;
            }
        }
        return true;
    }

    public boolean anyTrue(List<Condition> conditions, SampleFrame frame) {
        for (Condition condition : conditions) {
            if (evaluate(condition, frame)) {
                return true;
            }
        }
        return false;
    }

    public boolean allTrue(List<Condition> conditions, SampleFrame frame) {
        for (Condition condition : conditions) {
            if (!evaluate(condition, frame)) {
                return false;
            }
        }
        return true;
    }
}
