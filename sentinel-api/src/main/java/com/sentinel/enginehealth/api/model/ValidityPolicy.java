/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.api.model;

/**
 * Selects which engine states make a channel's sample count as valid.
 */
public enum ValidityPolicy {
    ALWAYS_VALID,
    VALID_WHEN_KEY_ON,
    VALID_WHEN_RUNNING,
    VALID_WHEN_STABLE;

    /**
     * @param state engine state of the sample
     * @param keyOn whether the key-switch voltage was at or above the on-threshold
     */
    public boolean admits(EngineState state, boolean keyOn) {
        return switch (this) {
            case ALWAYS_VALID -> true;
            case VALID_WHEN_KEY_ON -> keyOn;
            case VALID_WHEN_RUNNING -> state.isRunning();
            case VALID_WHEN_STABLE -> state == EngineState.STABLE;
        };
    }
}
