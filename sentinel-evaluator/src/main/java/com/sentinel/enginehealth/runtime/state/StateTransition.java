/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.runtime.state;

import com.sentinel.enginehealth.api.model.EngineState;

/**
 * An engine-state change observed at a sample.
 */
public record StateTransition(int index, double time, EngineState from, EngineState to) {

    public boolean isStart() {
        return from == EngineState.OFF && to == EngineState.CRANKING;
    }

    public boolean isStop() {
        return from.isRunning() && to == EngineState.STOPPING;
    }
}
