/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.api.model;

/**
 * Time spent in one discrete state.
 *
 * @param state       state label (an engine state name or a rounded channel value)
 * @param seconds     accumulated dwell time
 * @param percentage  share of the total dwell time, 0..100
 * @param transitions number of times the state was entered
 */
public record StateDwell(String state, double seconds, double percentage, int transitions) {
}
