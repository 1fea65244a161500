/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.api.model;

/**
 * Operating phase of the engine at one sample.
 */
public enum EngineState {
    OFF,
    CRANKING,
    UNSTABLE,
    STABLE,
    STOPPING;

    /**
     * True for every state except {@link #OFF}.
     */
    public boolean isEngineActive() {
        return this != OFF;
    }

    /**
     * True once the engine has left cranking and is producing power.
     */
    public boolean isRunning() {
        return this == UNSTABLE || this == STABLE;
    }
}
