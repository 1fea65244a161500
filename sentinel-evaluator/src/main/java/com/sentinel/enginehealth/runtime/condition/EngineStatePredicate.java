/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.runtime.condition;

import com.sentinel.enginehealth.api.model.EngineState;

import java.util.Arrays;
import java.util.Optional;

/**
 * Condition parameters whose value is synthesized from the engine state rather than
 * read from the sample. Every predicate evaluates to {@code 1.0} or {@code 0.0}.
 */
public enum EngineStatePredicate {
    ENGINE_OFF("EngineOff"),
    ENGINE_CRANKING("EngineCranking"),
    ENGINE_RUNNING("EngineRunning"),
    ENGINE_UNSTABLE("EngineUnstable"),
    ENGINE_STABLE("EngineStable"),
    ENGINE_STOPPING("EngineStopping"),
    STARTUP_GRACE("StartupGrace");

    private final String paramName;

    EngineStatePredicate(String paramName) {
        this.paramName = paramName;
    }

    public String paramName() {
        return paramName;
    }

    public double valueFor(EngineState state, boolean inStartupGrace) {
        boolean holds = switch (this) {
            case ENGINE_OFF -> state == EngineState.OFF;
            case ENGINE_CRANKING -> state == EngineState.CRANKING;
            case ENGINE_RUNNING -> state.isEngineActive();
            case ENGINE_UNSTABLE -> state == EngineState.UNSTABLE;
            case ENGINE_STABLE -> state == EngineState.STABLE;
            case ENGINE_STOPPING -> state == EngineState.STOPPING;
            case STARTUP_GRACE -> inStartupGrace;
        };
        return holds ? 1.0 : 0.0;
    }

    public static Optional<EngineStatePredicate> fromParam(String param) {
        return Arrays.stream(values()).filter(p -> p.paramName.equals(param)).findFirst();
    }

    public static boolean isPredicate(String param) {
        return fromParam(param).isPresent();
    }
}
