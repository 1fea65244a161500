/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.api.model;

import java.util.Arrays;

/**
 * Numeric comparison used by rule conditions.
 */
public enum ComparisonOperator {
    GREATER_THAN(">"),
    LESS_THAN("<"),
    GREATER_THAN_OR_EQUAL(">="),
    LESS_THAN_OR_EQUAL("<="),
    EQUAL("=="),
    NOT_EQUAL("!=");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean test(double actual, double expected) {
        return switch (this) {
            case GREATER_THAN -> actual > expected;
            case LESS_THAN -> actual < expected;
            case GREATER_THAN_OR_EQUAL -> actual >= expected;
            case LESS_THAN_OR_EQUAL -> actual <= expected;
            case EQUAL -> actual == expected;
            case NOT_EQUAL -> actual != expected;
        };
    }

    /**
     * Parses an operator symbol such as {@code ">="}.
     *
     * @throws IllegalArgumentException for an unknown symbol
     */
    public static ComparisonOperator fromSymbol(String symbol) {
        return Arrays.stream(values())
                .filter(op -> op.symbol.equals(symbol == null ? null : symbol.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown operator: " + symbol));
    }
}
