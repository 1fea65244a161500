/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.api.exceptions;

import java.util.List;

/**
 * Thrown when a profile transitively names itself as a parent.
 *
 * <p>The cycle is listed from the first occurrence of the repeated id and ends
 * with that id again, e.g. {@code [a, b, c, a]}.
 */
public class CircularInheritanceException extends SentinelException {

    private final List<String> cycle;

    public CircularInheritanceException(List<String> cycle) {
        super("Circular inheritance detected: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> getCycle() {
        return cycle;
    }
}
