/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.api.model;

import java.util.List;
import java.util.Optional;

/**
 * Dwell-time histogram of one categorical channel.
 */
public record TimeInState(String channel, List<StateDwell> states, double totalSeconds) {

    public TimeInState {
        states = List.copyOf(states);
    }

    public Optional<StateDwell> state(String label) {
        return states.stream().filter(s -> s.state().equals(label)).findFirst();
    }
}
