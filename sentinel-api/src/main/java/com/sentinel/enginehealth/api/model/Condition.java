/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A single {@code (parameter, operator, value)} test.
 *
 * @param param    a raw channel name or an engine-state predicate name such as {@code EngineRunning}
 * @param operator comparison operator
 * @param value    numeric constant compared against
 */
public record Condition(
        @JsonProperty("param") String param,
        @JsonProperty("operator") ComparisonOperator operator,
        @JsonProperty("value") double value) {

    public Condition {
        Objects.requireNonNull(param, "param");
        Objects.requireNonNull(operator, "operator");
    }

    public static Condition of(String param, String operatorSymbol, double value) {
        return new Condition(param, ComparisonOperator.fromSymbol(operatorSymbol), value);
    }

    @Override
    public String toString() {
        return param + " " + operator.symbol() + " " + value;
    }
}
